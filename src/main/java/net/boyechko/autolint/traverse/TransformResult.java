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

import net.boyechko.autolint.ast.Node;

/** What a rule callback wants done with the node it was given. */
public sealed interface TransformResult {

    record Keep() implements TransformResult {}

    record Replace(Node node) implements TransformResult {
        public Replace {
            if (node == null) {
                throw new IllegalArgumentException("Replacement node is required; use remove()");
            }
        }
    }

    record Remove() implements TransformResult {}

    TransformResult KEEP = new Keep();
    TransformResult REMOVE = new Remove();

    static TransformResult keep() {
        return KEEP;
    }

    static TransformResult replace(Node node) {
        return new Replace(node);
    }

    static TransformResult remove() {
        return REMOVE;
    }
}
