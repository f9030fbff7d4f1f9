package com.devexperts.dxlab.statecheck;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a model checking run: a {@link PropertyResult} per property
 * in the order the model declares them, plus search statistics.
 */
public final class Report<S, A> {
    private final List<PropertyResult<S, A>> results;
    private final int stateCount;
    private final int maxDepth;
    private final Termination termination;

    public Report(List<PropertyResult<S, A>> results, int stateCount, int maxDepth, Termination termination) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.stateCount = stateCount;
        this.maxDepth = maxDepth;
        this.termination = termination;
    }

    public List<PropertyResult<S, A>> getPropertyResults() {
        return results;
    }

    /**
     * @throws IllegalArgumentException if the model has no property with this name.
     */
    public PropertyResult<S, A> getResult(String propertyName) {
        for (PropertyResult<S, A> r : results) {
            if (r.getName().equals(propertyName))
                return r;
        }
        throw new IllegalArgumentException("Unknown property: \"" + propertyName + "\"");
    }

    public Verdict getVerdict(String propertyName) {
        return getResult(propertyName).getVerdict();
    }

    /**
     * Number of distinct states stored during the run.
     */
    public int getStateCount() {
        return stateCount;
    }

    /**
     * Depth of the deepest stored state.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    public Termination getTermination() {
        return termination;
    }

    /**
     * {@code false} if the search stopped early, some verdicts may be {@link Verdict#UNRESOLVED} then.
     */
    public boolean isComplete() {
        return termination.isComplete();
    }

    /**
     * @throws AssertionError if some property has not passed.
     */
    public void assertProperties() {
        StringBuilder msg = new StringBuilder();
        for (PropertyResult<S, A> r : results) {
            if (r.getVerdict() != Verdict.PASS)
                msg.append("\n").append(r);
        }
        if (msg.length() > 0)
            throw new AssertionError("Properties have not passed (" + termination + "):" + msg);
    }

    /**
     * @throws AssertionError if the specified property has no discovery
     *                        or it is reached by another sequence of actions.
     */
    public void assertDiscovery(String propertyName, List<A> expectedActions) {
        PropertyResult<S, A> r = getResult(propertyName);
        Path<S, A> discovery = r.getDiscovery();
        if (discovery == null)
            throw new AssertionError("No discovery for " + r);
        if (!discovery.actions().equals(expectedActions)) {
            throw new AssertionError("Unexpected discovery for \"" + propertyName + "\": expected actions "
                + expectedActions + ", found " + discovery.actions());
        }
    }

    /**
     * @throws AssertionError if the specified property has a discovery.
     */
    public void assertNoDiscovery(String propertyName) {
        PropertyResult<S, A> r = getResult(propertyName);
        if (r.getDiscovery() != null)
            throw new AssertionError("Unexpected discovery for " + r);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("= Done: ").append(termination)
            .append(", ").append(stateCount).append(" states, max depth ").append(maxDepth).append(" =");
        for (PropertyResult<S, A> r : results)
            sb.append("\n").append(r);
        return sb.toString();
    }
}
