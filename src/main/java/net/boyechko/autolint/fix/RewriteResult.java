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
import net.boyechko.autolint.traverse.QueuedEdit;

/**
 * Outcome of rebuilding a tree from queued edits.
 *
 * @param root the rebuilt tree; the input tree itself if nothing was applied
 * @param applied edits that made it into {@code root}, in application order
 * @param stale edits whose expected node no longer matched the tree
 * @param conflicts edits discarded because an enclosing edit won
 */
public record RewriteResult(
        Node root, List<QueuedEdit> applied, List<QueuedEdit> stale, List<FixConflict> conflicts) {

    public RewriteResult {
        applied = List.copyOf(applied);
        stale = List.copyOf(stale);
        conflicts = List.copyOf(conflicts);
    }

    public boolean changed() {
        return !applied.isEmpty();
    }
}
