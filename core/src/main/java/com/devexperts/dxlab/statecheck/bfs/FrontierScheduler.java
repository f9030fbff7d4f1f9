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

import com.devexperts.dxlab.statecheck.store.DiscoveryRecord;
import com.devexperts.dxlab.statecheck.store.StateStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out the states of the current depth layer in batches and buffers
 * the states discovered from them into the next layer.
 * <p>
 * Layer switching ({@link #seed} and {@link #advance}) must happen while no worker
 * touches the scheduler, {@link BfsStrategy} does it in the barrier action of its phaser.
 * The other methods are thread-safe.
 */
public class FrontierScheduler<S, A> {
    private static final int MAX_BATCH_SIZE = 64;
    private static final int BATCHES_PER_THREAD = 4;

    private final StateStore<S, A> store;
    private final int maxStates;
    private final int maxDepth;
    private final int threads;

    private final AtomicInteger cursor = new AtomicInteger();
    private final ConcurrentMap<S, Successor<S, A>> nextLayer = new ConcurrentHashMap<>();

    private List<S> layer = Collections.emptyList();
    private int depth = -1;
    private int batchSize = 1;
    private boolean stateLimitReached;
    private boolean depthLimitReached;

    public FrontierScheduler(StateStore<S, A> store, int maxStates, int maxDepth, int threads) {
        this.store = store;
        this.maxStates = maxStates;
        this.maxDepth = maxDepth;
        this.threads = threads;
    }

    /**
     * Stores the initial states and makes them the current layer.
     *
     * @return {@code false} if none of the states could be stored.
     */
    public boolean seed(List<S> initStates) {
        if (depth != -1)
            throw new IllegalStateException("Scheduler has already been seeded");
        List<S> committed = new ArrayList<>(initStates.size());
        for (S state : initStates) {
            if (store.contains(state))
                continue;
            if (store.size() >= maxStates) {
                stateLimitReached = true;
                break;
            }
            if (store.insertIfAbsent(state, DiscoveryRecord.initial(committed.size())).isNew())
                committed.add(state);
        }
        startLayer(0, committed);
        return !committed.isEmpty();
    }

    /**
     * Claims the next batch of the current layer.
     *
     * @return the index of the first state in the batch or {@code -1} if the layer is drained.
     */
    public int claimBatch() {
        int start = cursor.getAndAdd(batchSize);
        return start < layer.size() ? start : -1;
    }

    /**
     * Exclusive end index of the batch starting at {@code start}.
     */
    public int batchEnd(int start) {
        return Math.min(start + batchSize, layer.size());
    }

    public S stateAt(int index) {
        return layer.get(index);
    }

    /**
     * Depth of the current layer.
     */
    public int getDepth() {
        return depth;
    }

    public int getLayerSize() {
        return layer.size();
    }

    /**
     * {@code false} once the store is full and expanding states is useless.
     */
    public boolean isExpandable() {
        return !stateLimitReached;
    }

    /**
     * Buffers the successor into the next layer unless its state is already stored.
     * If the same state is offered several times, the earliest discovery wins.
     */
    public void offer(Successor<S, A> successor) {
        if (store.contains(successor.state))
            return;
        nextLayer.merge(successor.state, successor, Successor::earliest);
    }

    /**
     * Commits the buffered successors in discovery order as the next layer.
     *
     * @return {@code false} if the next layer is empty, the search is over then.
     */
    public boolean advance() {
        List<Successor<S, A>> candidates = new ArrayList<>(nextLayer.values());
        nextLayer.clear();
        if (candidates.isEmpty() || stateLimitReached) {
            finish();
            return false;
        }
        if (depth >= maxDepth) {
            depthLimitReached = true;
            finish();
            return false;
        }
        Collections.sort(candidates);
        int nextDepth = depth + 1;
        List<S> committed = new ArrayList<>(candidates.size());
        for (Successor<S, A> c : candidates) {
            if (store.size() >= maxStates) {
                stateLimitReached = true;
                break;
            }
            DiscoveryRecord<S, A> record = DiscoveryRecord.reachedBy(nextDepth, committed.size(), c.parent, c.action);
            if (store.insertIfAbsent(c.state, record).isNew())
                committed.add(c.state);
        }
        if (committed.isEmpty()) {
            finish();
            return false;
        }
        startLayer(nextDepth, committed);
        return true;
    }

    public boolean isStateLimitReached() {
        return stateLimitReached;
    }

    public boolean isDepthLimitReached() {
        return depthLimitReached;
    }

    private void startLayer(int depth, List<S> states) {
        this.depth = depth;
        this.layer = states;
        this.batchSize = Math.max(1, Math.min(MAX_BATCH_SIZE, states.size() / (threads * BATCHES_PER_THREAD)));
        cursor.set(0);
    }

    private void finish() {
        layer = Collections.emptyList();
        cursor.set(0);
    }
}
