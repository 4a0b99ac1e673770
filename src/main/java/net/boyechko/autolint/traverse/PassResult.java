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

import java.util.List;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.diagnostic.DiagnosticList;

/**
 * Outcome of one traversal pass.
 *
 * @param root the tree that was walked; it is never modified
 * @param edits queued edits in the order they were queued
 * @param diagnostics every diagnostic of the pass in raise order, suppressed ones flagged
 * @param nodesVisited number of nodes entered
 */
public record PassResult(
        Node root, List<QueuedEdit> edits, DiagnosticList diagnostics, int nodesVisited) {

    public PassResult {
        edits = List.copyOf(edits);
    }

    public boolean hasEdits() {
        return !edits.isEmpty();
    }
}
