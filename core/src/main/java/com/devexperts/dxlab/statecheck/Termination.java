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

/**
 * Why a model checking run has stopped.
 */
public enum Termination {
    /**
     * Every reachable state has been visited.
     */
    EXHAUSTED(true),
    /**
     * Every property got a definitive verdict before the state space was exhausted.
     */
    ALL_RESOLVED(true),
    /**
     * An {@code ALWAYS} property has been violated in fail-fast mode.
     */
    FAIL_FAST(false),
    /**
     * The maximal number of states has been reached.
     */
    STATE_LIMIT(false),
    /**
     * Some states lie deeper than the maximal depth.
     */
    DEPTH_LIMIT(false);

    private final boolean complete;

    Termination(boolean complete) {
        this.complete = complete;
    }

    /**
     * {@code true} if no property could change its verdict by searching further.
     */
    public boolean isComplete() {
        return complete;
    }
}
