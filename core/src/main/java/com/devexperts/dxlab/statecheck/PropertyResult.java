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

/**
 * Final verdict of one property. The discovery is the counterexample of a failed
 * {@code ALWAYS} property or the witness of a passed {@code SOMETIMES} property.
 */
public final class PropertyResult<S, A> {
    private final String name;
    private final Expectation expectation;
    private final Verdict verdict;
    private final Path<S, A> discovery;

    public PropertyResult(String name, Expectation expectation, Verdict verdict, @Nullable Path<S, A> discovery) {
        this.name = name;
        this.expectation = expectation;
        this.verdict = verdict;
        this.discovery = discovery;
    }

    public String getName() {
        return name;
    }

    public Expectation getExpectation() {
        return expectation;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    @Nullable
    public Path<S, A> getDiscovery() {
        return discovery;
    }

    /**
     * The search stopped before this property got a verdict.
     */
    public boolean isIncomplete() {
        return verdict == Verdict.UNRESOLVED;
    }

    @Override
    public String toString() {
        String res = expectation + " \"" + name + "\": " + (isIncomplete() ? "INCOMPLETE" : verdict.toString());
        if (discovery != null)
            res += " (" + (expectation == Expectation.ALWAYS ? "counterexample" : "witness") + ": " + discovery + ")";
        return res;
    }
}
