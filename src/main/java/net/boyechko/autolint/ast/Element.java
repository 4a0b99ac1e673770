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

/**
 * A markup element such as {@code <div class="x">...</div>} or {@code <img />}.
 *
 * @param attributes attributes in source order
 * @param children child content in source order
 * @param selfClosing true when written as {@code <name />}
 */
public record Element(
        SourceSpan span,
        ElementFlavor flavor,
        String name,
        List<Attribute> attributes,
        List<Node> children,
        boolean selfClosing)
        implements Node {

    public Element {
        if (span == null) span = SourceSpan.NONE;
        if (flavor == null) flavor = ElementFlavor.HTML;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Element name is required");
        }
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Element html(String name) {
        return new Element(SourceSpan.NONE, ElementFlavor.HTML, name, List.of(), List.of(), false);
    }

    public static Element jsx(String name) {
        return new Element(SourceSpan.NONE, ElementFlavor.JSX, name, List.of(), List.of(), false);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ELEMENT;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public Element withSelfClosing(boolean newSelfClosing) {
        return new Element(span, flavor, name, attributes, children, newSelfClosing);
    }

    public Element withAttributes(List<Attribute> newAttributes) {
        return new Element(span, flavor, name, newAttributes, children, selfClosing);
    }

    public Element withAttributes(Attribute... newAttributes) {
        return withAttributes(List.of(newAttributes));
    }

    public Element withChildren(List<Node> newChildren) {
        return new Element(span, flavor, name, attributes, newChildren, selfClosing);
    }

    public Element withChildren(Node... newChildren) {
        return withChildren(List.of(newChildren));
    }

    public Element withSpan(SourceSpan newSpan) {
        return new Element(newSpan, flavor, name, attributes, children, selfClosing);
    }
}
