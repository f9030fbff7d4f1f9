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
import org.jetbrains.annotations.Nullable;

/**
 * This class checks models.
 * See {@link #check(Model)} and {@link #check(Model, Options)} methods for details.
 */
public class ModelChecker<M extends Model<M, S, A>, S, A> {
    private final M model;
    private final CheckerConfiguration cfg;
    private final StateVisitor<S, A> visitor;
    private final Reporter reporter;

    @SuppressWarnings("unchecked")
    private ModelChecker(M model, @Nullable Options options) {
        this.model = model;
        LoggingLevel logLevel;
        if (options != null) {
            logLevel = options.logLevel;
            this.cfg = options.createConfiguration();
            this.visitor = (StateVisitor<S, A>) options.visitor;
        } else {
            logLevel = getLogLevelFromAnnotation(model.getClass());
            this.cfg = CheckerConfiguration.createFromModelClass(model.getClass());
            this.visitor = null;
        }
        this.reporter = new Reporter(logLevel);
    }

    /**
     * Checks the specified model as its {@link ModelCheck} annotation says,
     * or with the default configuration if the model class is not annotated.
     *
     * @throws ModelFunctionException if a model function fails.
     */
    public static <M extends Model<M, S, A>, S, A> Report<S, A> check(M model) {
        return check(model, null);
    }

    /**
     * Checks the specified model with the specified options.
     * <p>
     * NOTE: this method ignores {@link ModelCheck} and {@link LogLevel} annotations on the model class.
     *
     * @throws ModelFunctionException if a model function fails.
     */
    public static <M extends Model<M, S, A>, S, A> Report<S, A> check(M model, @Nullable Options options) {
        return new ModelChecker<M, S, A>(model, options).check();
    }

    private Report<S, A> check() {
        Strategy<M, S, A> strategy = Strategy.createStrategy(model, cfg, visitor, reporter);
        try {
            Report<S, A> report = strategy.run();
            reporter.logSummary(report);
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Model checking has been interrupted", e);
        }
    }

    private static LoggingLevel getLogLevelFromAnnotation(Class<?> modelClass) {
        LogLevel logLevelAnn = modelClass.getAnnotation(LogLevel.class);
        if (logLevelAnn == null)
            return Reporter.DEFAULT_LOG_LEVEL;
        return logLevelAnn.value();
    }
}
