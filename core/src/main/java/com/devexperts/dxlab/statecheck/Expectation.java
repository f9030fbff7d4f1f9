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
 * How a {@link Property} condition is expected to behave over the reachable states.
 */
public enum Expectation {
    /**
     * The condition holds in every reachable state.
     * One violating state is a counterexample.
     */
    ALWAYS,
    /**
     * The condition holds in at least one reachable state.
     * It fails only when the whole state space is exhausted without a witness.
     */
    SOMETIMES;

    /**
     * Checks whether the condition result resolves a property with this expectation.
     */
    public boolean isDiscovery(boolean conditionResult) {
        return this == ALWAYS ? !conditionResult : conditionResult;
    }

    /**
     * Verdict of a property with this expectation once a discovery is made.
     */
    public Verdict onDiscovery() {
        return this == ALWAYS ? Verdict.FAIL : Verdict.PASS;
    }

    /**
     * Verdict of a property with this expectation after the exhaustive search without discoveries.
     */
    public Verdict onExhaustion() {
        return this == ALWAYS ? Verdict.PASS : Verdict.FAIL;
    }
}
