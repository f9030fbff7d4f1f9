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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A sequence of steps from an initial state to some reachable state.
 * Each step holds a state and the action taken from it, the last step has no action.
 */
public final class Path<S, A> {
    private final List<Step<S, A>> steps;

    public Path(List<Step<S, A>> steps) {
        if (steps.isEmpty())
            throw new IllegalArgumentException("Path should contain at least one state");
        if (steps.get(steps.size() - 1).action != null)
            throw new IllegalArgumentException("The last step of a path should not have an action");
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public List<Step<S, A>> getSteps() {
        return steps;
    }

    /**
     * Number of transitions in this path.
     */
    public int length() {
        return steps.size() - 1;
    }

    public S firstState() {
        return steps.get(0).state;
    }

    public S lastState() {
        return steps.get(steps.size() - 1).state;
    }

    public List<S> states() {
        return steps.stream().map(Step::getState).collect(Collectors.toList());
    }

    public List<A> actions() {
        return steps.subList(0, steps.size() - 1).stream().map(Step::getAction).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return steps.equals(((Path<?, ?>) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Step<S, A> step : steps) {
            sb.append(step.state);
            if (step.action != null)
                sb.append(" -[").append(step.action).append("]-> ");
        }
        return sb.toString();
    }

    public static final class Step<S, A> {
        private final S state;
        private final A action;

        public Step(S state, @Nullable A action) {
            this.state = Objects.requireNonNull(state, "state");
            this.action = action;
        }

        public S getState() {
            return state;
        }

        @Nullable
        public A getAction() {
            return action;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (o == null || getClass() != o.getClass())
                return false;
            Step<?, ?> step = (Step<?, ?>) o;
            return state.equals(step.state) && Objects.equals(action, step.action);
        }

        @Override
        public int hashCode() {
            return 31 * state.hashCode() + Objects.hashCode(action);
        }

        @Override
        public String toString() {
            return action == null ? String.valueOf(state) : state + " -[" + action + "]->";
        }
    }
}
