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

/**
 * Thrown when one of the model functions ({@link Model#actions}, {@link Model#nextState},
 * {@link Model#withinBoundary} or a property condition) fails.
 * Model functions must be total, so such a failure aborts the whole run.
 */
public class ModelFunctionException extends RuntimeException {
    private final transient Object state;
    private final transient Object action;

    public ModelFunctionException(String function, Throwable cause) {
        super(function + " failed", cause);
        this.state = null;
        this.action = null;
    }

    public ModelFunctionException(String function, Object state, @Nullable Object action, Throwable cause) {
        super(function + " failed on state " + state + (action != null ? " with action " + action : ""), cause);
        this.state = state;
        this.action = action;
    }

    /**
     * The state the failing function was called with, {@code null} if the function takes no state.
     */
    @Nullable
    public Object getState() {
        return state;
    }

    /**
     * The action the failing function was called with, {@code null} if the function takes no action.
     */
    @Nullable
    public Object getAction() {
        return action;
    }
}
