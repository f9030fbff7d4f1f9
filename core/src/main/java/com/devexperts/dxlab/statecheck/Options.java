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
 * Options of a model checking run.
 */
public class Options {
    protected int threads = CheckerConfiguration.DEFAULT_THREADS;
    protected int maxStates = CheckerConfiguration.DEFAULT_MAX_STATES;
    protected int maxDepth = CheckerConfiguration.DEFAULT_MAX_DEPTH;
    protected boolean failFast = CheckerConfiguration.DEFAULT_FAIL_FAST;
    protected LoggingLevel logLevel = Reporter.DEFAULT_LOG_LEVEL;
    protected StateVisitor<?, ?> visitor;

    /**
     * Number of worker threads; all available processors are used by default.
     */
    public Options threads(int threads) {
        if (threads < 1)
            throw new IllegalArgumentException("Number of threads should be positive: " + threads);
        this.threads = threads;
        return this;
    }

    /**
     * Stop the search once {@code maxStates} distinct states are stored.
     */
    public Options maxStates(int maxStates) {
        if (maxStates < 1)
            throw new IllegalArgumentException("Maximal number of states should be positive: " + maxStates);
        this.maxStates = maxStates;
        return this;
    }

    /**
     * Do not store states deeper than {@code maxDepth} transitions from an initial state.
     */
    public Options maxDepth(int maxDepth) {
        if (maxDepth < 0)
            throw new IllegalArgumentException("Maximal depth should not be negative: " + maxDepth);
        this.maxDepth = maxDepth;
        return this;
    }

    /**
     * Set this to {@code false} to keep searching after an {@code ALWAYS} property is violated,
     * enabled by default.
     */
    public Options failFast(boolean failFast) {
        this.failFast = failFast;
        return this;
    }

    public Options logLevel(LoggingLevel logLevel) {
        this.logLevel = logLevel;
        return this;
    }

    /**
     * Receive the path to every discovered state.
     */
    public Options visitor(StateVisitor<?, ?> visitor) {
        this.visitor = visitor;
        return this;
    }

    public CheckerConfiguration createConfiguration() {
        return new CheckerConfiguration(threads, maxStates, maxDepth, failFast);
    }
}
