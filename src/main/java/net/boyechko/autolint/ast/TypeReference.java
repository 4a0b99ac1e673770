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

import java.util.List;

/** A named type, optionally with type arguments: {@code Map<K, V>}. */
public record TypeReference(SourceSpan span, String name, List<Node> typeArguments)
        implements Node {

    public TypeReference {
        if (span == null) span = SourceSpan.NONE;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name is required");
        }
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
    }

    public static TypeReference of(String name, Node... typeArguments) {
        return new TypeReference(SourceSpan.NONE, name, List.of(typeArguments));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_REFERENCE;
    }

    public TypeReference withTypeArguments(List<Node> newTypeArguments) {
        return new TypeReference(span, name, newTypeArguments);
    }
}
