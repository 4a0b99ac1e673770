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

/** The closed set of syntactic kinds the engine understands. */
public enum NodeKind {
    PROGRAM("Program"),
    ELEMENT("Element"),
    ATTRIBUTE("Attribute"),
    TEXT("Text"),
    COMMENT("Comment"),
    INTERFACE_DECLARATION("InterfaceDeclaration"),
    INTERFACE_BODY("InterfaceBody"),
    PROPERTY_SIGNATURE("PropertySignature"),
    TYPE_PARAMETER("TypeParameter"),
    TYPE_REFERENCE("TypeReference");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /** Short label used in traversal paths and log output. */
    public String label() {
        return label;
    }
}
