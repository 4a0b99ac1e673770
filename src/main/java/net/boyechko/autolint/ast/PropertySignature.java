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

/** {@code key?: Type} inside an interface body. */
public record PropertySignature(
        SourceSpan span, String key, boolean optional, Node typeAnnotation) implements Node {

    public PropertySignature {
        if (span == null) span = SourceSpan.NONE;
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Property key is required");
        }
    }

    public static PropertySignature of(String key, Node typeAnnotation) {
        return new PropertySignature(SourceSpan.NONE, key, false, typeAnnotation);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROPERTY_SIGNATURE;
    }

    public PropertySignature withOptional(boolean newOptional) {
        return new PropertySignature(span, key, newOptional, typeAnnotation);
    }

    public PropertySignature withTypeAnnotation(Node newTypeAnnotation) {
        return new PropertySignature(span, key, optional, newTypeAnnotation);
    }
}
