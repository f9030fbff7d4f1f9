package com.devexperts.dxlab.statecheck.bfs;

/*
 * #%L
 * core
 * %%
 * Copyright (C) 2015 - 2017 Devexperts, LLC
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * #L%
 */

import com.devexperts.dxlab.statecheck.Expectation;
import com.devexperts.dxlab.statecheck.Model;
import com.devexperts.dxlab.statecheck.ModelFunctionException;
import com.devexperts.dxlab.statecheck.Property;
import com.devexperts.dxlab.statecheck.PropertyResult;
import com.devexperts.dxlab.statecheck.Reporter;
import com.devexperts.dxlab.statecheck.Verdict;
import com.devexperts.dxlab.statecheck.store.TraceReconstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks the verdicts of all model properties.
 * {@link #onDiscover} is called exactly once for every stored state, concurrently for the states of one layer.
 * When several states of a layer resolve the same property, the one with the lowest layer index
 * is kept, so verdicts and discoveries do not depend on thread scheduling.
 */
public class PropertyEvaluator<M extends Model<M, S, A>, S, A> {
    private final M model;
    private final List<Status<M, S>> statuses = new ArrayList<>();
    private final AtomicInteger unresolved;
    private final Reporter reporter;

    public PropertyEvaluator(M model, List<Property<M, S>> properties, Reporter reporter) {
        this.model = model;
        this.reporter = reporter;
        Set<String> names = new HashSet<>();
        for (Property<M, S> p : properties) {
            if (!names.add(p.getName()))
                throw new IllegalArgumentException("Duplicate property name: \"" + p.getName() + "\"");
            statuses.add(new Status<>(p));
        }
        this.unresolved = new AtomicInteger(statuses.size());
    }

    /**
     * Evaluates every property which is not resolved by an earlier state yet.
     *
     * @return {@code true} if the state violates an {@code ALWAYS} property.
     * @throws ModelFunctionException if a property condition fails.
     */
    public boolean onDiscover(S state, int depth, int layerIndex) {
        boolean violation = false;
        for (Status<M, S> status : statuses) {
            if (status.isResolvedBefore(depth, layerIndex))
                continue;
            Property<M, S> property = status.property;
            boolean holds;
            try {
                holds = property.getCondition().test(model, state);
            } catch (RuntimeException | AssertionError e) {
                throw new ModelFunctionException("Condition of " + property, state, null, e);
            }
            if (!property.getExpectation().isDiscovery(holds))
                continue;
            if (status.offer(state, depth, layerIndex)) {
                unresolved.decrementAndGet();
                reporter.logPropertyResolved(property.getName(), status.getVerdict(), depth);
            }
            if (property.getExpectation() == Expectation.ALWAYS)
                violation = true;
        }
        return violation;
    }

    public boolean hasProperties() {
        return !statuses.isEmpty();
    }

    public boolean allResolved() {
        return unresolved.get() == 0;
    }

    /**
     * Resolves the remaining properties after the whole state space has been visited:
     * {@code ALWAYS} ones pass and {@code SOMETIMES} ones fail.
     */
    public void onExhaustion(int depth) {
        for (Status<M, S> status : statuses) {
            if (status.resolveOnExhaustion()) {
                unresolved.decrementAndGet();
                reporter.logPropertyResolved(status.property.getName(), status.getVerdict(), depth);
            }
        }
    }

    public List<PropertyResult<S, A>> results(TraceReconstructor<S, A> reconstructor) {
        List<PropertyResult<S, A>> results = new ArrayList<>(statuses.size());
        for (Status<M, S> status : statuses) {
            S discovery = status.getDiscovery();
            results.add(new PropertyResult<>(status.property.getName(), status.property.getExpectation(),
                status.getVerdict(), discovery != null ? reconstructor.reconstruct(discovery) : null));
        }
        return results;
    }

    private static final class Status<M, S> {
        final Property<M, S> property;
        private Verdict verdict = Verdict.UNRESOLVED;
        private S discovery;
        private int depth = -1;
        private int layerIndex = -1;

        Status(Property<M, S> property) {
            this.property = property;
        }

        synchronized boolean isResolvedBefore(int depth, int layerIndex) {
            return discovery != null && (this.depth < depth || (this.depth == depth && this.layerIndex < layerIndex));
        }

        /**
         * Records the discovery unless an earlier one is known.
         *
         * @return {@code true} if this is the first discovery.
         */
        synchronized boolean offer(S state, int depth, int layerIndex) {
            boolean first = discovery == null;
            if (first || depth < this.depth || (depth == this.depth && layerIndex < this.layerIndex)) {
                this.discovery = state;
                this.depth = depth;
                this.layerIndex = layerIndex;
            }
            if (first)
                verdict = property.getExpectation().onDiscovery();
            return first;
        }

        synchronized boolean resolveOnExhaustion() {
            if (verdict != Verdict.UNRESOLVED)
                return false;
            verdict = property.getExpectation().onExhaustion();
            return true;
        }

        synchronized Verdict getVerdict() {
            return verdict;
        }

        synchronized S getDiscovery() {
            return discovery;
        }
    }
}
