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

import static net.boyechko.autolint.printer.Tokens.BREAK;
import static net.boyechko.autolint.printer.Tokens.SPACE;
import static net.boyechko.autolint.printer.Tokens.concat;
import static net.boyechko.autolint.printer.Tokens.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.autolint.ast.Attribute;
import net.boyechko.autolint.ast.Comment;
import net.boyechko.autolint.ast.Element;
import net.boyechko.autolint.ast.ElementFlavor;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.ast.Program;
import net.boyechko.autolint.ast.Text;
import net.boyechko.autolint.printer.TokenDocument.Group;

/** Printers for programs and markup: elements, attributes, text and comments. */
final class MarkupBuilders {

    private MarkupBuilders() {}

    static void registerAll(Map<NodeKind, KindPrinter> table) {
        table.put(NodeKind.PROGRAM, MarkupBuilders::program);
        table.put(NodeKind.ELEMENT, MarkupBuilders::element);
        table.put(NodeKind.ATTRIBUTE, MarkupBuilders::attribute);
        table.put(NodeKind.TEXT, MarkupBuilders::textNode);
        table.put(NodeKind.COMMENT, MarkupBuilders::comment);
    }

    static TokenDocument program(Printer printer, Node node, Node parent) {
        Program program = (Program) node;
        List<TokenDocument> statements = new ArrayList<>();
        for (Node statement : program.body()) {
            statements.add(printer.tokenize(statement, program));
        }
        return Tokens.join(BREAK, statements);
    }

    static TokenDocument element(Printer printer, Node node, Node parent) {
        Element element = (Element) node;
        List<Node> content = new ArrayList<>();
        for (Node child : element.children()) {
            if (!(child instanceof Text t && t.isBlank())) {
                content.add(child);
            }
        }

        List<TokenDocument> openTag = new ArrayList<>();
        openTag.add(text("<" + element.name()));
        for (Attribute attribute : element.attributes()) {
            openTag.add(SPACE);
            openTag.add(printer.tokenize(attribute, element));
        }
        TokenDocument open = new Group(concat(openTag), 1);

        if (element.selfClosing() && content.isEmpty()) {
            return concat(open, text(" />"));
        }
        TokenDocument close = text("</" + element.name() + ">");
        if (content.isEmpty()) {
            return concat(open, text(">"), close);
        }
        if (content.stream().allMatch(c -> c instanceof Text)) {
            List<TokenDocument> inline = new ArrayList<>();
            inline.add(open);
            inline.add(text(">"));
            for (Node child : content) {
                inline.add(printer.tokenize(child, element));
            }
            inline.add(close);
            return concat(inline);
        }

        List<TokenDocument> body = new ArrayList<>();
        for (Node child : content) {
            body.add(BREAK);
            body.add(printer.tokenize(child, element));
        }
        return concat(open, text(">"), new Group(concat(body), 1), BREAK, close);
    }

    static TokenDocument attribute(Printer printer, Node node, Node parent) {
        Attribute attribute = (Attribute) node;
        if (attribute.value() == null) {
            return text(attribute.name());
        }
        return text(attribute.name() + "=\"" + attribute.value().replace("\"", "&quot;") + "\"");
    }

    static TokenDocument textNode(Printer printer, Node node, Node parent) {
        return text(((Text) node).value().strip().replaceAll("\\s+", " "));
    }

    /** Prints a comment in its parent's syntax; a terminator inside the text is split. */
    static TokenDocument comment(Printer printer, Node node, Node parent) {
        String value = ((Comment) node).value().strip().replaceAll("\\s+", " ");
        switch (commentStyle(parent)) {
            case HTML:
                return text("<!-- " + value.replace("-->", "-- >") + " -->");
            case JSX:
                return text("{/* " + value.replace("*/", "* /") + " */}");
            default:
                return text("/* " + value.replace("*/", "* /") + " */");
        }
    }

    private enum CommentStyle {
        HTML,
        JSX,
        BLOCK
    }

    private static CommentStyle commentStyle(Node parent) {
        if (parent instanceof Element element) {
            return element.flavor() == ElementFlavor.JSX ? CommentStyle.JSX : CommentStyle.HTML;
        }
        if (parent instanceof Program program) {
            for (Node sibling : program.body()) {
                if (sibling instanceof Element element && element.flavor() == ElementFlavor.HTML) {
                    return CommentStyle.HTML;
                }
            }
        }
        return CommentStyle.BLOCK;
    }
}
