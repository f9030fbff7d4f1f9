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

import com.devexperts.dxlab.statecheck.annotations.LogLevel;
import com.devexperts.dxlab.statecheck.annotations.ModelCheck;
import com.devexperts.dxlab.statecheck.models.Counter;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OptionsTest {

    @Test
    public void defaults() {
        CheckerConfiguration cfg = new Options().createConfiguration();
        assertEquals(Runtime.getRuntime().availableProcessors(), cfg.threads);
        assertEquals(CheckerConfiguration.UNBOUNDED, cfg.maxStates);
        assertEquals(CheckerConfiguration.UNBOUNDED, cfg.maxDepth);
        assertTrue(cfg.failFast);
        assertFalse(cfg.isBounded());
    }

    @Test
    public void test() {
        CheckerConfiguration cfg = new Options()
            .threads(3)
            .maxStates(1000)
            .maxDepth(0)
            .failFast(false)
            .logLevel(LoggingLevel.DEBUG)
            .createConfiguration();
        assertEquals(3, cfg.threads);
        assertEquals(1000, cfg.maxStates);
        assertEquals(0, cfg.maxDepth);
        assertFalse(cfg.failFast);
        assertTrue(cfg.isBounded());
        assertEquals("threads=3, maxStates=1000, maxDepth=0, exhaustive", cfg.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroThreads() {
        new Options().threads(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroStates() {
        new Options().maxStates(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeDepth() {
        new Options().maxDepth(-1);
    }

    @Test
    public void zeroThreadsMeansAllProcessors() {
        CheckerConfiguration cfg = new CheckerConfiguration(CheckerConfiguration.AVAILABLE_PROCESSORS,
            CheckerConfiguration.UNBOUNDED, CheckerConfiguration.UNBOUNDED, true);
        assertEquals(Runtime.getRuntime().availableProcessors(), cfg.threads);
    }

    @Test
    public void negativeThreads() {
        try {
            new CheckerConfiguration(-1, CheckerConfiguration.UNBOUNDED, CheckerConfiguration.UNBOUNDED, true);
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException e) {
            assertEquals("Number of threads should not be negative: -1", e.getMessage());
        }
    }

    @Test
    public void annotationConfiguration() {
        CheckerConfiguration cfg = CheckerConfiguration.createFromModelClass(LimitedCounter.class);
        assertEquals(2, cfg.threads);
        assertEquals(4, cfg.maxStates);
        assertEquals(CheckerConfiguration.UNBOUNDED, cfg.maxDepth);
        assertFalse(cfg.failFast);
    }

    @Test
    public void annotationsAreUsedWithoutOptions() {
        Counter counter = new LimitedCounter();
        Report<Integer, Counter.Action> report = ModelChecker.check(counter);
        assertEquals(Termination.STATE_LIMIT, report.getTermination());
        assertEquals(4, report.getStateCount());
        assertEquals(Verdict.FAIL, report.getVerdict("below 2"));
        assertEquals(Verdict.UNRESOLVED, report.getVerdict("reaches 100"));
    }

    @Test
    public void optionsOverrideAnnotations() {
        Counter counter = new LimitedCounter();
        Report<Integer, Counter.Action> report = ModelChecker.check(counter, new Options().threads(1));
        assertEquals(Termination.FAIL_FAST, report.getTermination());
        assertEquals(3, report.getStateCount());
    }

    @ModelCheck(threads = 2, maxStates = 4, failFast = false)
    @LogLevel(LoggingLevel.ERROR)
    static class LimitedCounter extends Counter {
        LimitedCounter() {
            super(100, Integer.MAX_VALUE, Arrays.asList(
                Property.always("below 2", (c, n) -> n < 2),
                Property.sometimes("reaches 100", (c, n) -> n == 100)));
        }
    }
}
