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
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;
import net.boyechko.autolint.traverse.QueuedEdit;

/** Interface for reporting progress and results of linting. */
public interface LintListener {
    void onPassStart(int pass);

    void onDiagnostic(Diagnostic diagnostic);

    void onFixApplied(QueuedEdit edit);

    void onWarning(String message);

    void onSummary(LintResult result);

    default void onTargetStart(String name) {}

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onDiagnosticGroup(DiagnosticCategory category, List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            onDiagnostic(diagnostic);
        }
    }
}
