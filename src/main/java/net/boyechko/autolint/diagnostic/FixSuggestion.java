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

import net.boyechko.autolint.ast.Node;

/**
 * A proposed replacement for the node at a diagnostic's location. {@code old} must still equal
 * the live node when the fix is applied; otherwise the fix is stale and dropped.
 */
public record FixSuggestion(Node old, Node fixed) {

    public FixSuggestion {
        if (old == null || fixed == null) {
            throw new IllegalArgumentException("Fix suggestion needs both old and fixed nodes");
        }
    }

    public boolean isNoOp() {
        return old.equals(fixed);
    }
}
