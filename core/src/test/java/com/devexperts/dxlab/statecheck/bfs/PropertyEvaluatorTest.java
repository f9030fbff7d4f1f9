package com.devexperts.dxlab.statecheck.bfs;

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

import com.devexperts.dxlab.statecheck.LoggingLevel;
import com.devexperts.dxlab.statecheck.ModelFunctionException;
import com.devexperts.dxlab.statecheck.Property;
import com.devexperts.dxlab.statecheck.PropertyResult;
import com.devexperts.dxlab.statecheck.Reporter;
import com.devexperts.dxlab.statecheck.Verdict;
import com.devexperts.dxlab.statecheck.models.Counter;
import com.devexperts.dxlab.statecheck.store.DiscoveryRecord;
import com.devexperts.dxlab.statecheck.store.StateStore;
import com.devexperts.dxlab.statecheck.store.TraceReconstructor;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PropertyEvaluatorTest {
    private static final Reporter REPORTER = new Reporter(LoggingLevel.ERROR);

    private final Counter counter = Counter.upTo(10);
    private final StateStore<Integer, Counter.Action> store = new StateStore<>();

    @Before
    public void setUp() {
        for (int n = 0; n <= 10; n++)
            store.insertIfAbsent(n, DiscoveryRecord.initial(n));
    }

    @Test
    public void alwaysFailsOnViolation() {
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator = evaluator(
            Property.always("small", (c, n) -> n < 2));
        assertFalse(evaluator.onDiscover(1, 1, 0));
        assertFalse(evaluator.allResolved());
        assertTrue(evaluator.onDiscover(2, 2, 0));
        assertTrue(evaluator.allResolved());
        assertEquals(Verdict.FAIL, verdict(evaluator, "small"));
    }

    @Test
    public void sometimesPassesOnWitness() {
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator = evaluator(
            Property.sometimes("three", (c, n) -> n == 3));
        assertFalse(evaluator.onDiscover(3, 3, 0));
        assertTrue(evaluator.allResolved());
        assertEquals(Verdict.PASS, verdict(evaluator, "three"));
    }

    @Test
    public void exhaustionResolvesTheRest() {
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator = evaluator(
            Property.always("positive", (c, n) -> n >= 0),
            Property.sometimes("negative", (c, n) -> n < 0),
            Property.sometimes("zero", (c, n) -> n == 0));
        evaluator.onDiscover(0, 0, 0);
        evaluator.onExhaustion(0);
        assertTrue(evaluator.allResolved());
        assertEquals(Verdict.PASS, verdict(evaluator, "positive"));
        assertEquals(Verdict.FAIL, verdict(evaluator, "negative"));
        assertEquals(Verdict.PASS, verdict(evaluator, "zero"));
    }

    @Test
    public void lowestLayerIndexWins() {
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator = evaluator(
            Property.always("below 5", (c, n) -> n < 5));
        // Later states of the layer may be evaluated first
        assertTrue(evaluator.onDiscover(7, 0, 2));
        assertTrue(evaluator.onDiscover(5, 0, 0));
        assertFalse(evaluator.onDiscover(6, 0, 1));
        PropertyResult<Integer, Counter.Action> result = results(evaluator).get(0);
        assertEquals(Integer.valueOf(5), result.getDiscovery().lastState());
    }

    @Test
    public void unresolvedWithoutExhaustion() {
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator = evaluator(
            Property.always("any", (c, n) -> true));
        evaluator.onDiscover(0, 0, 0);
        PropertyResult<Integer, Counter.Action> result = results(evaluator).get(0);
        assertEquals(Verdict.UNRESOLVED, result.getVerdict());
        assertTrue(result.isIncomplete());
        assertNull(result.getDiscovery());
    }

    @Test
    public void noProperties() {
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator =
            new PropertyEvaluator<>(counter, Collections.emptyList(), REPORTER);
        assertFalse(evaluator.hasProperties());
        assertFalse(evaluator.onDiscover(0, 0, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateNames() {
        evaluator(Property.always("p", (c, n) -> true), Property.sometimes("p", (c, n) -> false));
    }

    @Test
    public void failingCondition() {
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator = evaluator(
            Property.always("divides", (c, n) -> 10 / n > 0));
        try {
            evaluator.onDiscover(0, 0, 0);
            fail("ModelFunctionException expected");
        } catch (ModelFunctionException e) {
            assertEquals(0, e.getState());
            assertTrue(e.getCause() instanceof ArithmeticException);
        }
    }

    @SafeVarargs
    private final PropertyEvaluator<Counter, Integer, Counter.Action> evaluator(
        Property<Counter, Integer>... properties)
    {
        return new PropertyEvaluator<>(counter, Arrays.asList(properties), REPORTER);
    }

    private List<PropertyResult<Integer, Counter.Action>> results(
        PropertyEvaluator<Counter, Integer, Counter.Action> evaluator)
    {
        return evaluator.results(new TraceReconstructor<>(store));
    }

    private Verdict verdict(PropertyEvaluator<Counter, Integer, Counter.Action> evaluator, String name) {
        for (PropertyResult<Integer, Counter.Action> r : results(evaluator)) {
            if (r.getName().equals(name))
                return r.getVerdict();
        }
        throw new AssertionError("No property " + name);
    }
}
