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

public record Text(SourceSpan span, String value) implements Node {

    public Text {
        if (span == null) span = SourceSpan.NONE;
        if (value == null) value = "";
    }

    public static Text of(String value) {
        return new Text(SourceSpan.NONE, value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }

    public boolean isBlank() {
        return value.isBlank();
    }
}
