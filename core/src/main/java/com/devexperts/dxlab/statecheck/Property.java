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

import java.util.Objects;

/**
 * A named condition over the states of a model together with its {@link Expectation}.
 * Use {@link #always(String, Condition)} for invariants
 * and {@link #sometimes(String, Condition)} for reachability checks.
 */
public final class Property<M, S> {
    private final Expectation expectation;
    private final String name;
    private final Condition<M, S> condition;

    private Property(Expectation expectation, String name, Condition<M, S> condition) {
        this.expectation = Objects.requireNonNull(expectation, "expectation");
        this.name = Objects.requireNonNull(name, "name");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    /**
     * The condition should hold in every reachable state.
     */
    public static <M, S> Property<M, S> always(String name, Condition<M, S> condition) {
        return new Property<>(Expectation.ALWAYS, name, condition);
    }

    /**
     * The condition should hold in at least one reachable state.
     */
    public static <M, S> Property<M, S> sometimes(String name, Condition<M, S> condition) {
        return new Property<>(Expectation.SOMETIMES, name, condition);
    }

    public Expectation getExpectation() {
        return expectation;
    }

    public String getName() {
        return name;
    }

    public Condition<M, S> getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return expectation + " \"" + name + "\"";
    }

    /**
     * Side-effect-free predicate over a model and one of its states.
     */
    @FunctionalInterface
    public interface Condition<M, S> {
        boolean test(M model, S state);
    }
}
