package com.devexperts.dxlab.statecheck.annotations;

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

import com.devexperts.dxlab.statecheck.CheckerConfiguration;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares how the annotated model should be checked
 * by {@link com.devexperts.dxlab.statecheck.ModelChecker#check(com.devexperts.dxlab.statecheck.Model)}.
 * Ignored when options are passed explicitly.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Inherited
public @interface ModelCheck {
    /**
     * Number of worker threads, {@code 0} to use all available processors.
     */
    int threads() default CheckerConfiguration.DEFAULT_THREADS;

    /**
     * Maximal number of distinct states to store.
     */
    int maxStates() default CheckerConfiguration.DEFAULT_MAX_STATES;

    /**
     * States deeper than this number of transitions are not stored.
     */
    int maxDepth() default CheckerConfiguration.DEFAULT_MAX_DEPTH;

    /**
     * Stop on the first violated {@code ALWAYS} property.
     */
    boolean failFast() default CheckerConfiguration.DEFAULT_FAIL_FAST;
}
