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
package net.boyechko.autolint.ast;

/**
 * One syntactic construct in the tree.
 *
 * <p>Nodes are immutable values. Record equality is deep structural equality, spans included;
 * see {@link Nodes#sameShape} for a comparison that ignores spans. Children are held by
 * reference, so copies made through the {@code with...} methods share every subtree they do not
 * override.
 */
public sealed interface Node
        permits Program,
                Element,
                Attribute,
                Text,
                Comment,
                InterfaceDeclaration,
                InterfaceBody,
                PropertySignature,
                TypeParameter,
                TypeReference {

    NodeKind kind();

    SourceSpan span();

    default boolean is(NodeKind other) {
        return kind() == other;
    }
}
