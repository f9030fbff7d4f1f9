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

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe set of visited states with their {@link DiscoveryRecord discovery records}.
 * States are compared by {@link Object#equals(Object)}, records are never replaced or removed.
 * One store belongs to one run.
 */
public class StateStore<S, A> {
    private final ConcurrentMap<S, DiscoveryRecord<S, A>> records = new ConcurrentHashMap<>();

    /**
     * Stores the specified record unless the state is already known.
     * If several threads insert the same state concurrently exactly one of them succeeds,
     * and all of them get the record which has been stored.
     */
    public InsertResult<S, A> insertIfAbsent(S state, DiscoveryRecord<S, A> record) {
        Objects.requireNonNull(state, "state");
        DiscoveryRecord<S, A> existing = records.putIfAbsent(state, record);
        return existing == null ? new InsertResult<>(true, record) : new InsertResult<>(false, existing);
    }

    public boolean contains(S state) {
        return records.containsKey(state);
    }

    @Nullable
    public DiscoveryRecord<S, A> get(S state) {
        return records.get(state);
    }

    public int size() {
        return records.size();
    }

    public static final class InsertResult<S, A> {
        private final boolean isNew;
        private final DiscoveryRecord<S, A> record;

        InsertResult(boolean isNew, DiscoveryRecord<S, A> record) {
            this.isNew = isNew;
            this.record = record;
        }

        /**
         * {@code true} if this call has stored the state.
         */
        public boolean isNew() {
            return isNew;
        }

        public DiscoveryRecord<S, A> getRecord() {
            return record;
        }

        public int getDepth() {
            return record.getDepth();
        }
    }
}
