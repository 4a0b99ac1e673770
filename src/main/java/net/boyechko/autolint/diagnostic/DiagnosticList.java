/*
 * Auto-Lint - Rule-Based Linting and Formatting for Markup and Type Declarations
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.autolint.diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Diagnostics in the order they were raised. The list only grows: there is no way to remove or
 * reorder entries once collected.
 */
public class DiagnosticList implements Iterable<Diagnostic> {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public DiagnosticList() {}

    public DiagnosticList(Iterable<Diagnostic> diagnostics) {
        if (diagnostics != null) {
            for (Diagnostic diagnostic : diagnostics) {
                add(diagnostic);
            }
        }
    }

    public void add(Diagnostic diagnostic) {
        if (diagnostic == null) {
            throw new IllegalArgumentException("Cannot add a null diagnostic");
        }
        diagnostics.add(diagnostic);
    }

    public void addAll(Iterable<Diagnostic> others) {
        for (Diagnostic diagnostic : others) {
            add(diagnostic);
        }
    }

    public Diagnostic get(int index) {
        return diagnostics.get(index);
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public Stream<Diagnostic> stream() {
        return diagnostics.stream();
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return Collections.unmodifiableList(diagnostics).iterator();
    }

    /** Read-only snapshot view in collection order. */
    public List<Diagnostic> asList() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** Returns the diagnostics that survive suppression, i.e. the ones a report shows. */
    public DiagnosticList getReportable() {
        return filter(d -> !d.isSuppressed());
    }

    /** Returns the diagnostics that carry a fix suggestion. */
    public DiagnosticList getFixable() {
        return filter(Diagnostic::hasFix);
    }

    /** Returns the diagnostics whose fix made it into the rewritten tree. */
    public DiagnosticList getApplied() {
        return filter(Diagnostic::isApplied);
    }

    /** Returns the diagnostics whose fix was dropped as stale or superseded. */
    public DiagnosticList getSkipped() {
        return filter(Diagnostic::isFixSkipped);
    }

    /** Returns the reportable diagnostics that still need attention. */
    public DiagnosticList getRemaining() {
        return filter(d -> !d.isSuppressed() && !d.isApplied());
    }

    private DiagnosticList filter(Predicate<Diagnostic> predicate) {
        DiagnosticList out = new DiagnosticList();
        for (Diagnostic diagnostic : diagnostics) {
            if (predicate.test(diagnostic)) {
                out.add(diagnostic);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return diagnostics.toString();
    }
}
