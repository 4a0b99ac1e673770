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
package net.boyechko.autolint.fix;

import java.util.List;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.diagnostic.DiagnosticList;
import net.boyechko.autolint.traverse.QueuedEdit;

/**
 * Outcome of fixing a tree until no rule proposes anything new.
 *
 * @param root the best tree obtained
 * @param diagnostics applied diagnostics of earlier passes, then every diagnostic of the last pass
 * @param iterations number of rewrites performed
 * @param limitReached true if the iteration cap stopped the loop before it settled
 * @param applied every applied edit, in application order across iterations
 * @param conflicts every conflict recorded across iterations
 */
public record FixPointResult(
        Node root,
        DiagnosticList diagnostics,
        int iterations,
        boolean limitReached,
        List<QueuedEdit> applied,
        List<FixConflict> conflicts) {

    public FixPointResult {
        applied = List.copyOf(applied);
        conflicts = List.copyOf(conflicts);
    }
}
