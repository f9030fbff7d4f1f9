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

import com.devexperts.dxlab.statecheck.annotations.ModelCheck;

/**
 * Configuration of a single model checking run.
 * Built either by {@link Options} or from the {@link ModelCheck} annotation on the model class.
 */
public class CheckerConfiguration {
    /**
     * Use as many workers as there are available processors.
     */
    public static final int AVAILABLE_PROCESSORS = 0;
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_THREADS = AVAILABLE_PROCESSORS;
    public static final int DEFAULT_MAX_STATES = UNBOUNDED;
    public static final int DEFAULT_MAX_DEPTH = UNBOUNDED;
    public static final boolean DEFAULT_FAIL_FAST = true;

    public final int threads;
    public final int maxStates;
    public final int maxDepth;
    public final boolean failFast;

    public CheckerConfiguration(int threads, int maxStates, int maxDepth, boolean failFast) {
        if (threads < 0)
            throw new IllegalArgumentException("Number of threads should not be negative: " + threads);
        if (maxStates < 1)
            throw new IllegalArgumentException("Maximal number of states should be positive: " + maxStates);
        if (maxDepth < 0)
            throw new IllegalArgumentException("Maximal depth should not be negative: " + maxDepth);
        this.threads = threads == AVAILABLE_PROCESSORS ? Runtime.getRuntime().availableProcessors() : threads;
        this.maxStates = maxStates;
        this.maxDepth = maxDepth;
        this.failFast = failFast;
    }

    static CheckerConfiguration createFromModelClass(Class<?> modelClass) {
        ModelCheck ann = modelClass.getAnnotation(ModelCheck.class);
        if (ann == null) {
            return new CheckerConfiguration(DEFAULT_THREADS, DEFAULT_MAX_STATES, DEFAULT_MAX_DEPTH,
                DEFAULT_FAIL_FAST);
        }
        return new CheckerConfiguration(ann.threads(), ann.maxStates(), ann.maxDepth(), ann.failFast());
    }

    public boolean isBounded() {
        return maxStates != UNBOUNDED || maxDepth != UNBOUNDED;
    }

    @Override
    public String toString() {
        return "threads=" + threads
            + ", maxStates=" + (maxStates == UNBOUNDED ? "unbounded" : String.valueOf(maxStates))
            + ", maxDepth=" + (maxDepth == UNBOUNDED ? "unbounded" : String.valueOf(maxDepth))
            + ", " + (failFast ? "fail-fast" : "exhaustive");
    }
}
