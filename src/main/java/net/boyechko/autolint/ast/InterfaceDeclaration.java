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

/** {@code interface Name<T, U> { ... }} */
public record InterfaceDeclaration(
        SourceSpan span, String name, List<TypeParameter> typeParameters, InterfaceBody body)
        implements Node {

    public InterfaceDeclaration {
        if (span == null) span = SourceSpan.NONE;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Interface name is required");
        }
        typeParameters = typeParameters == null ? List.of() : List.copyOf(typeParameters);
        if (body == null) {
            throw new IllegalArgumentException("Interface body is required");
        }
    }

    public static InterfaceDeclaration of(
            String name, List<TypeParameter> typeParameters, InterfaceBody body) {
        return new InterfaceDeclaration(SourceSpan.NONE, name, typeParameters, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INTERFACE_DECLARATION;
    }

    public InterfaceDeclaration withBody(InterfaceBody newBody) {
        return new InterfaceDeclaration(span, name, typeParameters, newBody);
    }

    public InterfaceDeclaration withTypeParameters(List<TypeParameter> newTypeParameters) {
        return new InterfaceDeclaration(span, name, newTypeParameters, body);
    }
}
