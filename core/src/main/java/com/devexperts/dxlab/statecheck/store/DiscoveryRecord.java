package com.devexperts.dxlab.statecheck.store;

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

import org.jetbrains.annotations.Nullable;

/**
 * What is known about a stored state: the depth it was discovered at,
 * its position in that depth layer and the transition it was first reached by.
 * Initial states have neither predecessor nor action.
 */
public final class DiscoveryRecord<S, A> {
    private final int depth;
    private final int layerIndex;
    private final S predecessor;
    private final A action;

    private DiscoveryRecord(int depth, int layerIndex, @Nullable S predecessor, @Nullable A action) {
        if (depth < 0 || layerIndex < 0)
            throw new IllegalArgumentException("Negative depth or layer index");
        if ((depth == 0) != (predecessor == null))
            throw new IllegalArgumentException("Only initial states have no predecessor");
        this.depth = depth;
        this.layerIndex = layerIndex;
        this.predecessor = predecessor;
        this.action = action;
    }

    public static <S, A> DiscoveryRecord<S, A> initial(int layerIndex) {
        return new DiscoveryRecord<>(0, layerIndex, null, null);
    }

    public static <S, A> DiscoveryRecord<S, A> reachedBy(int depth, int layerIndex, S predecessor, A action) {
        return new DiscoveryRecord<>(depth, layerIndex, predecessor, action);
    }

    public int getDepth() {
        return depth;
    }

    public int getLayerIndex() {
        return layerIndex;
    }

    public boolean isInitial() {
        return depth == 0;
    }

    @Nullable
    public S getPredecessor() {
        return predecessor;
    }

    @Nullable
    public A getAction() {
        return action;
    }

    @Override
    public String toString() {
        return isInitial() ? "initial#" + layerIndex
            : "depth " + depth + "#" + layerIndex + " from " + predecessor + " by " + action;
    }
}
