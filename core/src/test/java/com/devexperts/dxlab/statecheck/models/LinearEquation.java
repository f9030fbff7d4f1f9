package com.devexperts.dxlab.statecheck.models;

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

import com.devexperts.dxlab.statecheck.Model;
import com.devexperts.dxlab.statecheck.Property;

import java.util.Collections;
import java.util.List;

/**
 * Looks for {@code x} and {@code y} such that {@code a*x + b*y = c},
 * all values are unsigned bytes and the arithmetic wraps around.
 */
public class LinearEquation implements Model<LinearEquation, LinearEquation.Solution, LinearEquation.Action> {
    public enum Action { INCREASE_X, INCREASE_Y }

    private final int a;
    private final int b;
    private final int c;

    public LinearEquation(int a, int b, int c) {
        this.a = a & 0xFF;
        this.b = b & 0xFF;
        this.c = c & 0xFF;
    }

    @Override
    public List<Solution> initStates() {
        return Collections.singletonList(new Solution(0, 0));
    }

    @Override
    public void actions(Solution state, List<Action> actions) {
        actions.add(Action.INCREASE_X);
        actions.add(Action.INCREASE_Y);
    }

    @Override
    public Solution nextState(Solution state, Action action) {
        return action == Action.INCREASE_X ? new Solution(state.x + 1, state.y) : new Solution(state.x, state.y + 1);
    }

    @Override
    public List<Property<LinearEquation, Solution>> properties() {
        return Collections.singletonList(Property.sometimes("solvable", LinearEquation::isSolution));
    }

    private boolean isSolution(Solution s) {
        return ((a * s.x + b * s.y) & 0xFF) == c;
    }

    public static final class Solution {
        public final int x;
        public final int y;

        public Solution(int x, int y) {
            this.x = x & 0xFF;
            this.y = y & 0xFF;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Solution))
                return false;
            Solution other = (Solution) o;
            return x == other.x && y == other.y;
        }

        @Override
        public int hashCode() {
            return 31 * x + y;
        }

        @Override
        public String toString() {
            return "(" + x + ", " + y + ")";
        }
    }
}
