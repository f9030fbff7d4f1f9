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

import com.devexperts.dxlab.statecheck.CheckerConfiguration;
import com.devexperts.dxlab.statecheck.Model;
import com.devexperts.dxlab.statecheck.ModelFunctionException;
import com.devexperts.dxlab.statecheck.Property;
import com.devexperts.dxlab.statecheck.Report;
import com.devexperts.dxlab.statecheck.Reporter;
import com.devexperts.dxlab.statecheck.StateVisitor;
import com.devexperts.dxlab.statecheck.Strategy;
import com.devexperts.dxlab.statecheck.Termination;
import com.devexperts.dxlab.statecheck.store.StateStore;
import com.devexperts.dxlab.statecheck.store.TraceReconstructor;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Breadth-first search over the state space by a fixed pool of {@link ExpansionWorker workers}.
 * <p>
 * Workers drain the current depth layer in parallel and meet on a {@link Phaser};
 * its barrier action commits the next layer and decides whether the search goes on.
 * All depth {@code d} states are therefore expanded before any depth {@code d + 1} state,
 * and every stored state is expanded at most once.
 */
public class BfsStrategy<M extends Model<M, S, A>, S, A> extends Strategy<M, S, A> {
    private final StateStore<S, A> store = new StateStore<>();
    private final TraceReconstructor<S, A> reconstructor = new TraceReconstructor<>(store);
    private final FrontierScheduler<S, A> scheduler;
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private volatile boolean stopped;
    private volatile boolean violationFound;
    private PropertyEvaluator<M, S, A> evaluator;
    private Termination termination;

    public BfsStrategy(M model, CheckerConfiguration cfg, @Nullable StateVisitor<S, A> visitor, Reporter reporter) {
        super(model, cfg, visitor, reporter);
        this.scheduler = new FrontierScheduler<>(store, cfg.maxStates, cfg.maxDepth, cfg.threads);
    }

    @Override
    public Report<S, A> run() throws InterruptedException {
        reporter.logRunStart(model, cfg);
        evaluator = new PropertyEvaluator<>(model, queryProperties(), reporter);
        List<S> initStates = queryInitStates();
        if (initStates.isEmpty())
            throw new IllegalStateException("Model " + model + " has no initial states");
        if (scheduler.seed(initStates)) {
            reporter.logLayer(0, scheduler.getLayerSize(), store.size());
            explore();
        } else {
            termination = Termination.STATE_LIMIT;
        }
        RuntimeException e = failure.get();
        if (e != null) {
            if (e instanceof ModelFunctionException) {
                reporter.logModelError((ModelFunctionException) e);
                throw e;
            }
            if (e.getCause() instanceof Error)
                throw (Error) e.getCause();
            throw new IllegalStateException("Model checking has failed", e);
        }
        if (termination == Termination.EXHAUSTED) {
            evaluator.onExhaustion(scheduler.getDepth());
        } else if (!termination.isComplete()) {
            reporter.logLimitReached(termination, store.size(), scheduler.getDepth());
        }
        return new Report<>(evaluator.results(reconstructor), store.size(), scheduler.getDepth(), termination);
    }

    private void explore() throws InterruptedException {
        int nThreads = cfg.threads;
        Phaser phaser = new Phaser(nThreads) {
            @Override
            protected boolean onAdvance(int phase, int registeredParties) {
                return !nextLayer();
            }
        };
        List<ExpansionWorker<M, S, A>> workers = new ArrayList<>(nThreads);
        for (int i = 0; i < nThreads; i++)
            workers.add(new ExpansionWorker<>(this, model, scheduler, evaluator, reconstructor, visitor, phaser));
        ExecutorService pool = Executors.newFixedThreadPool(nThreads);
        // Submitted one by one: a worker cancelled before it starts would never arrive at the phaser
        List<Future<Void>> futures = new ArrayList<>(nThreads);
        try {
            for (ExpansionWorker<M, S, A> worker : workers)
                futures.add(pool.submit(worker));
            for (Future<Void> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    abort(new IllegalStateException(e.getCause()));
                }
            }
        } catch (InterruptedException e) {
            // Workers ignore interrupts while waiting on the phaser, the barrier action ends the search
            abort(new IllegalStateException("Model checking has been interrupted", e));
            pool.shutdownNow();
            awaitWorkers(pool);
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private static void awaitWorkers(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS))
                    break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted)
            Thread.currentThread().interrupt();
    }

    /**
     * Barrier action, called by the last worker to drain the current layer.
     *
     * @return {@code true} if the search goes on with the next layer.
     */
    private boolean nextLayer() {
        try {
            if (failure.get() != null)
                return false;
            if (evaluator.hasProperties() && evaluator.allResolved()) {
                termination = Termination.ALL_RESOLVED;
                return false;
            }
            if (violationFound && cfg.failFast) {
                termination = Termination.FAIL_FAST;
                return false;
            }
            if (!scheduler.advance()) {
                if (scheduler.isStateLimitReached()) {
                    termination = Termination.STATE_LIMIT;
                } else if (scheduler.isDepthLimitReached()) {
                    termination = Termination.DEPTH_LIMIT;
                } else {
                    termination = Termination.EXHAUSTED;
                }
                return false;
            }
            reporter.logLayer(scheduler.getDepth(), scheduler.getLayerSize(), store.size());
            return true;
        } catch (RuntimeException e) {
            abort(e);
            return false;
        } catch (Throwable t) {
            // Peers wait for this barrier action, it must not throw
            abort(new IllegalStateException("Layer commit has failed", t));
            return false;
        }
    }

    void onEvaluated(boolean violation) {
        if (violation) {
            violationFound = true;
            if (cfg.failFast)
                stopped = true;
        }
        if (evaluator.hasProperties() && evaluator.allResolved())
            stopped = true;
    }

    /**
     * Stops the search because of a failure, only the first failure is reported.
     */
    void abort(RuntimeException e) {
        failure.compareAndSet(null, e);
        stopped = true;
    }

    boolean isStopped() {
        return stopped;
    }

    private List<Property<M, S>> queryProperties() {
        try {
            return model.properties();
        } catch (RuntimeException | AssertionError e) {
            throw new ModelFunctionException("properties", e);
        }
    }

    private List<S> queryInitStates() {
        try {
            return model.initStates();
        } catch (RuntimeException | AssertionError e) {
            throw new ModelFunctionException("initStates", e);
        }
    }
}
