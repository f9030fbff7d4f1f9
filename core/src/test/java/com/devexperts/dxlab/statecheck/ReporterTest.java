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

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ReporterTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    public void messagesBelowLevelAreSkipped() {
        Reporter reporter = reporter(LoggingLevel.WARN);
        reporter.logLayer(3, 10, 20);
        reporter.logPropertyResolved("p", Verdict.PASS, 3);
        assertEquals("", out.toString());
        reporter.logLimitReached(Termination.DEPTH_LIMIT, 20, 3);
        assertTrue(out.toString().contains("DEPTH_LIMIT"));
        assertEquals("", err.toString());
    }

    @Test
    public void errorsGoToErrorStream() {
        Reporter reporter = reporter(LoggingLevel.DEBUG);
        reporter.logModelError(new ModelFunctionException("nextState", 1, "go", new ArithmeticException()));
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("nextState failed on state 1 with action go"));
    }

    @Test
    public void debugLogsLayers() {
        reporter(LoggingLevel.DEBUG).logLayer(3, 10, 20);
        assertTrue(out.toString().startsWith("Depth 3: 10 new states, 20 states total"));
    }

    private Reporter reporter(LoggingLevel level) {
        return new Reporter(level, new PrintStream(out, true), new PrintStream(err, true));
    }
}
