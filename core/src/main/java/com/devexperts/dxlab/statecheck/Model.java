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

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Describes a discrete system to be checked: its initial states, the actions
 * available in each state, the transition function and the properties to verify.
 * <p>
 * States and actions are immutable values. States must implement {@link Object#equals(Object)}
 * and {@link Object#hashCode()} structurally, so that the same state reached by different paths
 * is stored only once.
 * <p>
 * IMPORTANT!
 * All methods are called concurrently from several worker threads
 * and must be deterministic and free of side effects.
 *
 * @param <M> the model type itself, passed to property conditions
 * @param <S> the state type
 * @param <A> the action type
 */
public interface Model<M extends Model<M, S, A>, S, A> {
    /**
     * Returns the initial states, there should be at least one.
     */
    List<S> initStates();

    /**
     * Appends all the actions available in the specified state to {@code actions}.
     * Appending nothing makes the state a dead end.
     */
    void actions(S state, List<A> actions);

    /**
     * Applies {@code action} to {@code state}.
     *
     * @return the next state or {@code null} if the action is not applicable in this state.
     */
    @Nullable
    S nextState(S state, A action);

    /**
     * Returns the properties to be checked. Called once per run.
     */
    List<Property<M, S>> properties();

    /**
     * States outside the boundary are dropped as if their transition was not applicable.
     * Use it to cut off an infinite state space.
     */
    default boolean withinBoundary(S state) {
        return true;
    }
}
