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

import com.devexperts.dxlab.statecheck.Path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rebuilds the path to a stored state by following predecessor links down to an initial state.
 * Predecessors are assigned in breadth-first order, so the path is a shortest one.
 */
public class TraceReconstructor<S, A> {
    private final StateStore<S, A> store;

    public TraceReconstructor(StateStore<S, A> store) {
        this.store = store;
    }

    public Path<S, A> reconstruct(S state) {
        DiscoveryRecord<S, A> record = store.get(state);
        if (record == null)
            throw new IllegalArgumentException("State " + state + " has not been discovered");
        List<Path.Step<S, A>> steps = new ArrayList<>(record.getDepth() + 1);
        steps.add(new Path.Step<>(state, null));
        while (!record.isInitial()) {
            S predecessor = record.getPredecessor();
            DiscoveryRecord<S, A> predecessorRecord = store.get(predecessor);
            if (predecessorRecord == null || predecessorRecord.getDepth() != record.getDepth() - 1) {
                throw new IllegalStateException("Broken predecessor chain at " + predecessor
                    + ": expected depth " + (record.getDepth() - 1) + ", found " + predecessorRecord);
            }
            steps.add(new Path.Step<>(predecessor, record.getAction()));
            record = predecessorRecord;
        }
        Collections.reverse(steps);
        return new Path<>(steps);
    }
}
