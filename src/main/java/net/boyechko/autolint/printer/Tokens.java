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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.autolint.printer.TokenDocument.Break;
import net.boyechko.autolint.printer.TokenDocument.Concat;
import net.boyechko.autolint.printer.TokenDocument.Group;
import net.boyechko.autolint.printer.TokenDocument.Literal;
import net.boyechko.autolint.printer.TokenDocument.Space;

/** Shorthand constructors for {@link TokenDocument} trees. */
public final class Tokens {
    public static final TokenDocument SPACE = new Space();
    public static final TokenDocument BREAK = new Break();
    public static final TokenDocument EMPTY = new Concat(List.of());

    private Tokens() {}

    public static TokenDocument text(String text) {
        return new Literal(text);
    }

    public static TokenDocument concat(TokenDocument... parts) {
        return concat(List.of(parts));
    }

    public static TokenDocument concat(List<TokenDocument> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Concat(parts);
    }

    public static TokenDocument group(TokenDocument... parts) {
        return new Group(concat(parts), 0);
    }

    public static TokenDocument indent(TokenDocument... parts) {
        return new Group(concat(parts), 1);
    }

    /** Places {@code separator} between consecutive {@code parts}. */
    public static TokenDocument join(TokenDocument separator, List<TokenDocument> parts) {
        List<TokenDocument> out = new ArrayList<>(parts.size() * 2);
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                out.add(separator);
            }
            out.add(parts.get(i));
        }
        return concat(out);
    }

    /** Width of the document rendered flat, or {@link Integer#MAX_VALUE} if it holds a break. */
    public static int flatWidth(TokenDocument doc) {
        if (doc instanceof Literal literal) {
            return literal.text().length();
        }
        if (doc instanceof Space) {
            return 1;
        }
        if (doc instanceof Break) {
            return Integer.MAX_VALUE;
        }
        if (doc instanceof Group group) {
            return flatWidth(group.contents());
        }
        long width = 0;
        for (TokenDocument part : ((Concat) doc).parts()) {
            int w = flatWidth(part);
            if (w == Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            }
            width += w;
        }
        return (int) Math.min(width, Integer.MAX_VALUE - 1);
    }

    /** Renders the document with every space flat; breaks still break. Useful in log messages. */
    public static String flatten(TokenDocument doc) {
        StringBuilder sb = new StringBuilder();
        appendFlat(doc, sb);
        return sb.toString();
    }

    private static void appendFlat(TokenDocument doc, StringBuilder sb) {
        if (doc instanceof Literal literal) {
            sb.append(literal.text());
        } else if (doc instanceof Space) {
            sb.append(' ');
        } else if (doc instanceof Break) {
            sb.append('\n');
        } else if (doc instanceof Group group) {
            appendFlat(group.contents(), sb);
        } else {
            for (TokenDocument part : ((Concat) doc).parts()) {
                appendFlat(part, sb);
            }
        }
    }
}
