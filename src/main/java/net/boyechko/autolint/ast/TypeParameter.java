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

/** {@code Name extends Constraint = Default}; constraint and default are optional. */
public record TypeParameter(SourceSpan span, String name, Node constraint, Node defaultType)
        implements Node {

    public TypeParameter {
        if (span == null) span = SourceSpan.NONE;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type parameter name is required");
        }
    }

    public static TypeParameter of(String name) {
        return new TypeParameter(SourceSpan.NONE, name, null, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_PARAMETER;
    }

    public TypeParameter withConstraint(Node newConstraint) {
        return new TypeParameter(span, name, newConstraint, defaultType);
    }

    public TypeParameter withDefaultType(Node newDefaultType) {
        return new TypeParameter(span, name, constraint, newDefaultType);
    }
}
