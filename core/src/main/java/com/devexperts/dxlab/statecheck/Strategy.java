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

import com.devexperts.dxlab.statecheck.bfs.BfsStrategy;
import org.jetbrains.annotations.Nullable;

/**
 * Explores the state space of a model and evaluates its properties.
 * Each strategy instance performs exactly one run.
 */
public abstract class Strategy<M extends Model<M, S, A>, S, A> {
    protected final M model;
    protected final CheckerConfiguration cfg;
    protected final Reporter reporter;
    protected final StateVisitor<S, A> visitor;

    protected Strategy(M model, CheckerConfiguration cfg, @Nullable StateVisitor<S, A> visitor, Reporter reporter) {
        this.model = model;
        this.cfg = cfg;
        this.visitor = visitor;
        this.reporter = reporter;
    }

    /**
     * Creates {@link Strategy} for the specified configuration.
     */
    public static <M extends Model<M, S, A>, S, A> Strategy<M, S, A> createStrategy(M model,
        CheckerConfiguration cfg, @Nullable StateVisitor<S, A> visitor, Reporter reporter)
    {
        return new BfsStrategy<>(model, cfg, visitor, reporter);
    }

    /**
     * @throws ModelFunctionException if a model function fails.
     */
    public abstract Report<S, A> run() throws InterruptedException;
}
