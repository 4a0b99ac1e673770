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

/** A markup attribute; a {@code null} value is a boolean attribute such as {@code disabled}. */
public record Attribute(SourceSpan span, String name, String value) implements Node {

    public Attribute {
        if (span == null) span = SourceSpan.NONE;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Attribute name is required");
        }
    }

    public static Attribute of(String name, String value) {
        return new Attribute(SourceSpan.NONE, name, value);
    }

    public static Attribute flag(String name) {
        return new Attribute(SourceSpan.NONE, name, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }
}
