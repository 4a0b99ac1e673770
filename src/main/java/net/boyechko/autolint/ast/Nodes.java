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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural helpers over the closed node schema. Every per-kind dispatch here is an exhaustive
 * switch over {@link NodeKind}; adding a kind without a case is a compile error.
 */
public final class Nodes {
    private Nodes() {}

    public static NodeKind kindOf(Node node) {
        return node.kind();
    }

    /** Returns the child nodes of {@code node} in document order. */
    public static List<Node> childrenOf(Node node) {
        return switch (node.kind()) {
            case PROGRAM -> ((Program) node).body();
            case ELEMENT -> {
                Element element = (Element) node;
                List<Node> kids =
                        new ArrayList<>(element.attributes().size() + element.children().size());
                kids.addAll(element.attributes());
                kids.addAll(element.children());
                yield kids;
            }
            case ATTRIBUTE, TEXT, COMMENT -> List.of();
            case INTERFACE_DECLARATION -> {
                InterfaceDeclaration decl = (InterfaceDeclaration) node;
                List<Node> kids = new ArrayList<>(decl.typeParameters().size() + 1);
                kids.addAll(decl.typeParameters());
                kids.add(decl.body());
                yield kids;
            }
            case INTERFACE_BODY -> ((InterfaceBody) node).members();
            case PROPERTY_SIGNATURE -> {
                Node annotation = ((PropertySignature) node).typeAnnotation();
                yield annotation != null ? List.of(annotation) : List.of();
            }
            case TYPE_PARAMETER -> {
                TypeParameter param = (TypeParameter) node;
                List<Node> kids = new ArrayList<>(2);
                if (param.constraint() != null) kids.add(param.constraint());
                if (param.defaultType() != null) kids.add(param.defaultType());
                yield kids;
            }
            case TYPE_REFERENCE -> ((TypeReference) node).typeArguments();
        };
    }

    /**
     * Returns a copy of {@code node} whose children are {@code replacements}, matched by index
     * against {@link #childrenOf}. A {@code null} entry removes that child. Entries identical to
     * the current child keep it shared; if nothing changes, {@code node} itself is returned.
     *
     * @throws IllegalArgumentException if the list size does not match or an entry has a kind
     *     the slot does not accept
     * @throws IllegalStateException if a required child would be removed
     */
    public static Node withChildren(Node node, List<Node> replacements) {
        List<Node> current = childrenOf(node);
        if (replacements.size() != current.size()) {
            throw new IllegalArgumentException(
                    node.kind().label()
                            + " has "
                            + current.size()
                            + " children, got "
                            + replacements.size()
                            + " replacements");
        }
        if (sameReferences(current, replacements)) {
            return node;
        }

        return switch (node.kind()) {
            case PROGRAM -> ((Program) node).withBody(present(replacements));
            case ELEMENT -> {
                Element element = (Element) node;
                int attrCount = element.attributes().size();
                List<Attribute> attrs = new ArrayList<>();
                for (Node replacement : replacements.subList(0, attrCount)) {
                    if (replacement != null) {
                        attrs.add(require(replacement, Attribute.class, "Element attribute"));
                    }
                }
                List<Node> kids = present(replacements.subList(attrCount, replacements.size()));
                yield element.withAttributes(attrs).withChildren(kids);
            }
            case ATTRIBUTE, TEXT, COMMENT -> node;
            case INTERFACE_DECLARATION -> {
                InterfaceDeclaration decl = (InterfaceDeclaration) node;
                int paramCount = decl.typeParameters().size();
                List<TypeParameter> params = new ArrayList<>();
                for (Node replacement : replacements.subList(0, paramCount)) {
                    if (replacement != null) {
                        params.add(require(replacement, TypeParameter.class, "Type parameter"));
                    }
                }
                Node body = replacements.get(paramCount);
                if (body == null) {
                    throw new IllegalStateException(
                            "Cannot remove the body of interface " + decl.name());
                }
                yield decl.withTypeParameters(params)
                        .withBody(require(body, InterfaceBody.class, "Interface body"));
            }
            case INTERFACE_BODY -> ((InterfaceBody) node).withMembers(present(replacements));
            case PROPERTY_SIGNATURE ->
                    ((PropertySignature) node).withTypeAnnotation(replacements.get(0));
            case TYPE_PARAMETER -> {
                TypeParameter param = (TypeParameter) node;
                int slot = 0;
                Node constraint = null;
                Node defaultType = null;
                if (param.constraint() != null) constraint = replacements.get(slot++);
                if (param.defaultType() != null) defaultType = replacements.get(slot);
                yield param.withConstraint(constraint).withDefaultType(defaultType);
            }
            case TYPE_REFERENCE -> ((TypeReference) node).withTypeArguments(present(replacements));
        };
    }

    /** Returns a copy of {@code node} carrying {@code span}; children are untouched. */
    public static Node withSpan(Node node, SourceSpan span) {
        return switch (node.kind()) {
            case PROGRAM -> new Program(span, ((Program) node).body());
            case ELEMENT -> ((Element) node).withSpan(span);
            case ATTRIBUTE -> {
                Attribute attr = (Attribute) node;
                yield new Attribute(span, attr.name(), attr.value());
            }
            case TEXT -> new Text(span, ((Text) node).value());
            case COMMENT -> new Comment(span, ((Comment) node).value());
            case INTERFACE_DECLARATION -> {
                InterfaceDeclaration decl = (InterfaceDeclaration) node;
                yield new InterfaceDeclaration(
                        span, decl.name(), decl.typeParameters(), decl.body());
            }
            case INTERFACE_BODY -> new InterfaceBody(span, ((InterfaceBody) node).members());
            case PROPERTY_SIGNATURE -> {
                PropertySignature prop = (PropertySignature) node;
                yield new PropertySignature(
                        span, prop.key(), prop.optional(), prop.typeAnnotation());
            }
            case TYPE_PARAMETER -> {
                TypeParameter param = (TypeParameter) node;
                yield new TypeParameter(
                        span, param.name(), param.constraint(), param.defaultType());
            }
            case TYPE_REFERENCE -> {
                TypeReference ref = (TypeReference) node;
                yield new TypeReference(span, ref.name(), ref.typeArguments());
            }
        };
    }

    /** Returns a deep copy of {@code node} with every span set to {@link SourceSpan#NONE}. */
    public static Node stripSpans(Node node) {
        List<Node> kids = childrenOf(node);
        List<Node> stripped = new ArrayList<>(kids.size());
        for (Node kid : kids) {
            stripped.add(stripSpans(kid));
        }
        return withSpan(withChildren(node, stripped), SourceSpan.NONE);
    }

    /** Structural equality that ignores source spans. */
    public static boolean sameShape(Node a, Node b) {
        if (a == null || b == null) {
            return a == b;
        }
        return stripSpans(a).equals(stripSpans(b));
    }

    /** Follows {@code location} from {@code root}; empty if any step is out of range. */
    public static Optional<Node> resolve(Node root, Location location) {
        Node current = root;
        for (int index : location.steps()) {
            List<Node> kids = childrenOf(current);
            if (index >= kids.size()) {
                return Optional.empty();
            }
            current = kids.get(index);
        }
        return Optional.of(current);
    }

    /** Counts {@code node} and all of its descendants. */
    public static int size(Node node) {
        int total = 1;
        for (Node kid : childrenOf(node)) {
            total += size(kid);
        }
        return total;
    }

    private static boolean sameReferences(List<Node> current, List<Node> replacements) {
        for (int i = 0; i < current.size(); i++) {
            if (current.get(i) != replacements.get(i)) {
                return false;
            }
        }
        return true;
    }

    private static List<Node> present(List<Node> replacements) {
        List<Node> out = new ArrayList<>(replacements.size());
        for (Node replacement : replacements) {
            if (replacement != null) {
                out.add(replacement);
            }
        }
        return out;
    }

    private static <T extends Node> T require(Node node, Class<T> type, String slot) {
        if (!type.isInstance(node)) {
            throw new IllegalArgumentException(
                    slot + " must be a " + type.getSimpleName() + ", got " + node.kind().label());
        }
        return type.cast(node);
    }
}
