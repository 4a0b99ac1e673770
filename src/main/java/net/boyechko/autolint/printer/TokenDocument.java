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
package net.boyechko.autolint.printer;

import java.util.List;

/**
 * Layout-agnostic form of formatted output. The {@link LayoutEngine} decides, group by group,
 * whether spaces stay spaces or become line breaks.
 */
public sealed interface TokenDocument {

    /** Text printed as-is. Never contains a newline. */
    record Literal(String text) implements TokenDocument {
        public Literal {
            if (text == null) {
                throw new IllegalArgumentException("Literal text is required");
            }
            if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("Literal text may not contain a line break");
            }
        }
    }

    record Concat(List<TokenDocument> parts) implements TokenDocument {
        public Concat {
            parts = List.copyOf(parts);
        }
    }

    /** A space when its group is flat; a newline plus indent when its group breaks. */
    record Space() implements TokenDocument {}

    /** A newline plus indent regardless of layout. */
    record Break() implements TokenDocument {}

    /**
     * Atomic flat-or-broken decision unit.
     *
     * @param indent indent levels added for lines started inside this group
     */
    record Group(TokenDocument contents, int indent) implements TokenDocument {
        public Group {
            if (contents == null) {
                throw new IllegalArgumentException("Group contents are required");
            }
            if (indent < 0) {
                throw new IllegalArgumentException("Indent must not be negative: " + indent);
            }
        }
    }
}
