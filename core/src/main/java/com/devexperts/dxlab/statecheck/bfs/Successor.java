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

/**
 * A state discovered from the current layer and waiting to be committed to the next one.
 * Ordered by the position of its parent in the layer, then by the position of the action,
 * which is the order a single-threaded search would discover it in.
 */
final class Successor<S, A> implements Comparable<Successor<S, A>> {
    final S state;
    final S parent;
    final A action;
    final int parentIndex;
    final int actionIndex;

    Successor(S state, S parent, A action, int parentIndex, int actionIndex) {
        this.state = state;
        this.parent = parent;
        this.action = action;
        this.parentIndex = parentIndex;
        this.actionIndex = actionIndex;
    }

    static <S, A> Successor<S, A> earliest(Successor<S, A> a, Successor<S, A> b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public int compareTo(Successor<S, A> other) {
        int res = Integer.compare(parentIndex, other.parentIndex);
        return res != 0 ? res : Integer.compare(actionIndex, other.actionIndex);
    }

    @Override
    public String toString() {
        return parent + " -[" + action + "]-> " + state + " (" + parentIndex + ":" + actionIndex + ")";
    }
}
