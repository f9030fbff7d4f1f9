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

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * Logs the progress of a single model checking run.
 * Messages below the configured {@link LoggingLevel} are not even built.
 */
public class Reporter {
    public static final LoggingLevel DEFAULT_LOG_LEVEL = LoggingLevel.WARN;

    private final LoggingLevel logLevel;
    private final PrintStream out;
    private final PrintStream err;

    public Reporter(LoggingLevel logLevel) {
        this(logLevel, System.out, System.err);
    }

    public Reporter(LoggingLevel logLevel, PrintStream out, PrintStream err) {
        this.logLevel = logLevel;
        this.out = out;
        this.err = err;
    }

    public LoggingLevel getLogLevel() {
        return logLevel;
    }

    public void logRunStart(Object model, CheckerConfiguration cfg) {
        log(LoggingLevel.INFO, sb -> sb.append("= Checking ").append(model.getClass().getSimpleName())
            .append(" with ").append(cfg).append(" ="));
    }

    public void logLayer(int depth, int layerSize, int stateCount) {
        log(LoggingLevel.DEBUG, sb -> sb.append("Depth ").append(depth).append(": ").append(layerSize)
            .append(" new states, ").append(stateCount).append(" states total"));
    }

    public void logPropertyResolved(String name, Verdict verdict, int depth) {
        log(LoggingLevel.INFO, sb -> sb.append("Property \"").append(name).append("\" is ").append(verdict)
            .append(" (depth ").append(depth).append(")"));
    }

    public void logLimitReached(Termination termination, int stateCount, int depth) {
        log(LoggingLevel.WARN, sb -> sb.append("Search stopped on ").append(termination)
            .append(" after ").append(stateCount).append(" states at depth ").append(depth)
            .append(", unresolved properties are incomplete"));
    }

    public void logModelError(ModelFunctionException e) {
        log(LoggingLevel.ERROR, sb -> sb.append("Model function failed: ").append(e.getMessage()));
    }

    public void logSummary(Report<?, ?> report) {
        log(LoggingLevel.INFO, sb -> sb.append(report));
    }

    private void log(LoggingLevel level, Consumer<StringBuilder> msg) {
        if (logLevel.compareTo(level) > 0)
            return;
        StringBuilder sb = new StringBuilder();
        msg.accept(sb);
        PrintStream stream = level == LoggingLevel.ERROR ? err : out;
        stream.println(sb);
    }
}
