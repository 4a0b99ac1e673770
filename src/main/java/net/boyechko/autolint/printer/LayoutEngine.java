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

import net.boyechko.autolint.printer.TokenDocument.Break;
import net.boyechko.autolint.printer.TokenDocument.Concat;
import net.boyechko.autolint.printer.TokenDocument.Group;
import net.boyechko.autolint.printer.TokenDocument.Literal;
import net.boyechko.autolint.printer.TokenDocument.Space;

/**
 * Renders a {@link TokenDocument} to text within a fixed line width.
 *
 * <p>Each group is decided on its own: if its flattened width fits within the line width it
 * renders flat, otherwise its own spaces become line breaks indented by the levels of all enclosing
 * groups. Nested groups then decide for themselves; no decision is revisited.
 */
public class LayoutEngine {
    public static final int DEFAULT_LINE_WIDTH = 80;
    public static final String DEFAULT_INDENT_UNIT = "  ";

    private final int lineWidth;
    private final String indentUnit;

    public LayoutEngine() {
        this(DEFAULT_LINE_WIDTH);
    }

    public LayoutEngine(int lineWidth) {
        this(lineWidth, DEFAULT_INDENT_UNIT);
    }

    public LayoutEngine(int lineWidth, String indentUnit) {
        if (lineWidth < 1) {
            throw new IllegalArgumentException("Line width must be positive: " + lineWidth);
        }
        if (indentUnit == null || !indentUnit.isBlank() || indentUnit.contains("\n")) {
            throw new IllegalArgumentException("Indent unit must be spaces or tabs");
        }
        this.lineWidth = lineWidth;
        this.indentUnit = indentUnit;
    }

    public int lineWidth() {
        return lineWidth;
    }

    public String render(TokenDocument doc) {
        StringBuilder out = new StringBuilder();
        render(doc, false, 0, out);
        stripTrailingSpaces(out);
        return out.toString();
    }

    /** True if {@code group} would render on one line. */
    public boolean fits(Group group) {
        return Tokens.flatWidth(group) <= lineWidth;
    }

    /**
     * @param broken whether the innermost enclosing group broke; top level counts as flat
     * @param indent accumulated indent levels of all enclosing groups
     */
    private void render(TokenDocument doc, boolean broken, int indent, StringBuilder out) {
        if (doc instanceof Literal literal) {
            out.append(literal.text());
        } else if (doc instanceof Space) {
            if (broken) {
                newline(indent, out);
            } else {
                out.append(' ');
            }
        } else if (doc instanceof Break) {
            newline(indent, out);
        } else if (doc instanceof Group group) {
            render(group.contents(), !fits(group), indent + group.indent(), out);
        } else {
            for (TokenDocument part : ((Concat) doc).parts()) {
                render(part, broken, indent, out);
            }
        }
    }

    private void newline(int indent, StringBuilder out) {
        stripTrailingSpaces(out);
        out.append('\n');
        for (int i = 0; i < indent; i++) {
            out.append(indentUnit);
        }
    }

    private static void stripTrailingSpaces(StringBuilder out) {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
            end--;
        }
        out.setLength(end);
    }
}
