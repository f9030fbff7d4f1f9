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

import com.devexperts.dxlab.statecheck.Model;
import com.devexperts.dxlab.statecheck.ModelFunctionException;
import com.devexperts.dxlab.statecheck.StateVisitor;
import com.devexperts.dxlab.statecheck.store.TraceReconstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Phaser;

/**
 * Processes batches of the current layer until the search is over:
 * evaluates the properties of each state, then expands it
 * and offers the successors to the {@link FrontierScheduler}.
 * Waits on the phaser after the layer is drained.
 */
class ExpansionWorker<M extends Model<M, S, A>, S, A> implements Callable<Void> {
    private final BfsStrategy<M, S, A> strategy;
    private final M model;
    private final FrontierScheduler<S, A> scheduler;
    private final PropertyEvaluator<M, S, A> evaluator;
    private final TraceReconstructor<S, A> reconstructor;
    private final StateVisitor<S, A> visitor;
    private final Phaser phaser;
    private final List<A> actions = new ArrayList<>();

    ExpansionWorker(BfsStrategy<M, S, A> strategy, M model, FrontierScheduler<S, A> scheduler,
        PropertyEvaluator<M, S, A> evaluator, TraceReconstructor<S, A> reconstructor, StateVisitor<S, A> visitor,
        Phaser phaser)
    {
        this.strategy = strategy;
        this.model = model;
        this.scheduler = scheduler;
        this.evaluator = evaluator;
        this.reconstructor = reconstructor;
        this.visitor = visitor;
        this.phaser = phaser;
    }

    @Override
    public Void call() {
        try {
            while (true) {
                for (int start = scheduler.claimBatch(); start >= 0; start = scheduler.claimBatch()) {
                    int end = scheduler.batchEnd(start);
                    for (int i = start; i < end; i++) {
                        try {
                            process(i);
                        } catch (RuntimeException e) {
                            strategy.abort(e);
                        }
                    }
                }
                phaser.arriveAndAwaitAdvance();
                if (phaser.isTerminated())
                    return null;
            }
        } catch (Error e) {
            // Let the other workers pass the barrier without this one
            strategy.abort(new IllegalStateException("Expansion worker has died", e));
            phaser.arriveAndDeregister();
            throw e;
        }
    }

    private void process(int index) {
        S state = scheduler.stateAt(index);
        // Evaluate the whole layer even after a stop request, only expansion stops early
        boolean violation = evaluator.onDiscover(state, scheduler.getDepth(), index);
        strategy.onEvaluated(violation);
        if (visitor != null) {
            try {
                visitor.visit(reconstructor.reconstruct(state));
            } catch (RuntimeException | AssertionError e) {
                throw new ModelFunctionException("State visitor", state, null, e);
            }
        }
        if (strategy.isStopped() || !scheduler.isExpandable())
            return;
        expand(state, index);
    }

    private void expand(S state, int index) {
        actions.clear();
        try {
            model.actions(state, actions);
        } catch (RuntimeException | AssertionError e) {
            throw new ModelFunctionException("actions", state, null, e);
        }
        for (int i = 0; i < actions.size(); i++) {
            A action = actions.get(i);
            S next;
            try {
                next = model.nextState(state, action);
            } catch (RuntimeException | AssertionError e) {
                throw new ModelFunctionException("nextState", state, action, e);
            }
            if (next == null)
                continue;
            boolean withinBoundary;
            try {
                withinBoundary = model.withinBoundary(next);
            } catch (RuntimeException | AssertionError e) {
                throw new ModelFunctionException("withinBoundary", next, null, e);
            }
            if (withinBoundary)
                scheduler.offer(new Successor<>(next, state, action, index, i));
        }
    }
}
