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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Counts up from zero until the limit. {@link Action#TELEPORT} is offered in every state
 * but is never applicable.
 */
public class Counter implements Model<Counter, Integer, Counter.Action> {
    public static final int TELEPORT_TARGET = 1_000;

    public enum Action { INCREMENT, TELEPORT }

    private final int limit;
    private final int boundary;
    private final List<Property<Counter, Integer>> properties;

    public Counter(int limit, int boundary, List<Property<Counter, Integer>> properties) {
        this.limit = limit;
        this.boundary = boundary;
        this.properties = properties;
    }

    @SafeVarargs
    public static Counter upTo(int limit, Property<Counter, Integer>... properties) {
        return new Counter(limit, Integer.MAX_VALUE, Arrays.asList(properties));
    }

    @SafeVarargs
    public static Counter unbounded(Property<Counter, Integer>... properties) {
        return upTo(Integer.MAX_VALUE, properties);
    }

    @Override
    public List<Integer> initStates() {
        return Collections.singletonList(0);
    }

    @Override
    public void actions(Integer state, List<Action> actions) {
        actions.add(Action.INCREMENT);
        actions.add(Action.TELEPORT);
    }

    @Override
    public Integer nextState(Integer state, Action action) {
        if (action == Action.TELEPORT)
            return null;
        return state < limit ? state + 1 : null;
    }

    @Override
    public List<Property<Counter, Integer>> properties() {
        return properties;
    }

    @Override
    public boolean withinBoundary(Integer state) {
        return state <= boundary;
    }
}
