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
package net.boyechko.autolint.traverse;

import net.boyechko.autolint.diagnostic.DiagnosticCollector;
import net.boyechko.autolint.diagnostic.FixMode;

/**
 * State scoped to a single traversal pass, threaded through every {@link Path} of that pass.
 * Never shared between engine invocations.
 */
public final class PassContext {
    private final DiagnosticCollector collector;

    public PassContext(DiagnosticCollector collector) {
        this.collector = collector;
    }

    public static PassContext describing() {
        return new PassContext(new DiagnosticCollector(FixMode.DESCRIBE_ONLY));
    }

    public static PassContext fixing(int pass) {
        return new PassContext(new DiagnosticCollector(FixMode.APPLY_FIXES, pass));
    }

    public DiagnosticCollector collector() {
        return collector;
    }

    public FixMode mode() {
        return collector.mode();
    }

    public int pass() {
        return collector.pass();
    }
}
