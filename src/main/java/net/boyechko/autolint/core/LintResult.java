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
package net.boyechko.autolint.core;

import java.util.List;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.diagnostic.DiagnosticList;
import net.boyechko.autolint.fix.FixConflict;
import net.boyechko.autolint.fix.FixPointResult;
import net.boyechko.autolint.traverse.QueuedEdit;

/**
 * Summary of linting or fixing one tree.
 *
 * @param root the final tree; the input tree when nothing was fixed
 * @param diagnostics every diagnostic, suppressed ones included, each marked with its fix status
 * @param iterations rewrites performed; zero for a describe-only run
 * @param limitReached true if fixing stopped at the iteration cap
 * @param conflicts edits discarded in favour of an enclosing edit
 * @param appliedEdits edits that made it into {@code root}, in application order
 */
public record LintResult(
        Node root,
        DiagnosticList diagnostics,
        int iterations,
        boolean limitReached,
        List<FixConflict> conflicts,
        List<QueuedEdit> appliedEdits) {

    public LintResult {
        conflicts = List.copyOf(conflicts);
        appliedEdits = List.copyOf(appliedEdits);
    }

    /** Result of a run that only reported. */
    public static LintResult described(Node root, DiagnosticList diagnostics) {
        return new LintResult(root, diagnostics, 0, false, List.of(), List.of());
    }

    public static LintResult fixed(FixPointResult fixPoint) {
        return new LintResult(
                fixPoint.root(),
                fixPoint.diagnostics(),
                fixPoint.iterations(),
                fixPoint.limitReached(),
                fixPoint.conflicts(),
                fixPoint.applied());
    }

    /** Diagnostics a report shows, in collection order. */
    public DiagnosticList reportable() {
        return diagnostics.getReportable();
    }

    public int totalDetected() {
        return reportable().size();
    }

    public int totalFixable() {
        return reportable().getFixable().size();
    }

    public int totalApplied() {
        return reportable().getApplied().size();
    }

    public int totalRemaining() {
        return diagnostics.getRemaining().size();
    }

    public boolean changed() {
        return !appliedEdits.isEmpty();
    }
}
