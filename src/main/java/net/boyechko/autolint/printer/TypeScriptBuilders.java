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
import net.boyechko.autolint.ast.InterfaceBody;
import net.boyechko.autolint.ast.InterfaceDeclaration;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.ast.PropertySignature;
import net.boyechko.autolint.ast.TypeParameter;
import net.boyechko.autolint.ast.TypeReference;
import net.boyechko.autolint.printer.TokenDocument.Group;

/** Printers for TypeScript interface declarations and the type syntax inside them. */
final class TypeScriptBuilders {

    private TypeScriptBuilders() {}

    static void registerAll(Map<NodeKind, KindPrinter> table) {
        table.put(NodeKind.INTERFACE_DECLARATION, TypeScriptBuilders::interfaceDeclaration);
        table.put(NodeKind.INTERFACE_BODY, TypeScriptBuilders::interfaceBody);
        table.put(NodeKind.PROPERTY_SIGNATURE, TypeScriptBuilders::propertySignature);
        table.put(NodeKind.TYPE_PARAMETER, TypeScriptBuilders::typeParameter);
        table.put(NodeKind.TYPE_REFERENCE, TypeScriptBuilders::typeReference);
    }

    static TokenDocument interfaceDeclaration(Printer printer, Node node, Node parent) {
        InterfaceDeclaration decl = (InterfaceDeclaration) node;
        List<TokenDocument> params = new ArrayList<>();
        for (TypeParameter param : decl.typeParameters()) {
            params.add(printer.tokenize(param, decl));
        }
        return concat(
                text("interface " + decl.name()),
                angleList(params),
                text(" "),
                printer.tokenize(decl.body(), decl));
    }

    static TokenDocument interfaceBody(Printer printer, Node node, Node parent) {
        InterfaceBody body = (InterfaceBody) node;
        if (body.members().isEmpty()) {
            return text("{}");
        }
        List<TokenDocument> members = new ArrayList<>();
        for (Node member : body.members()) {
            members.add(BREAK);
            members.add(printer.tokenize(member, body));
        }
        return concat(text("{"), new Group(concat(members), 1), BREAK, text("}"));
    }

    /** The trailing semicolon is only printed when the signature sits in an interface body. */
    static TokenDocument propertySignature(Printer printer, Node node, Node parent) {
        PropertySignature property = (PropertySignature) node;
        List<TokenDocument> parts = new ArrayList<>();
        parts.add(text(property.key() + (property.optional() ? "?" : "")));
        if (property.typeAnnotation() != null) {
            parts.add(text(": "));
            parts.add(printer.tokenize(property.typeAnnotation(), property));
        }
        if (parent instanceof InterfaceBody) {
            parts.add(text(";"));
        }
        return concat(parts);
    }

    static TokenDocument typeParameter(Printer printer, Node node, Node parent) {
        TypeParameter param = (TypeParameter) node;
        List<TokenDocument> parts = new ArrayList<>();
        parts.add(text(param.name()));
        if (param.constraint() != null) {
            parts.add(SPACE);
            parts.add(text("extends"));
            parts.add(SPACE);
            parts.add(printer.tokenize(param.constraint(), param));
        }
        if (param.defaultType() != null) {
            parts.add(SPACE);
            parts.add(text("="));
            parts.add(SPACE);
            parts.add(printer.tokenize(param.defaultType(), param));
        }
        return new Group(concat(parts), 1);
    }

    static TokenDocument typeReference(Printer printer, Node node, Node parent) {
        TypeReference ref = (TypeReference) node;
        List<TokenDocument> args = new ArrayList<>();
        for (Node arg : ref.typeArguments()) {
            args.add(printer.tokenize(arg, ref));
        }
        return concat(text(ref.name()), angleList(args));
    }

    // <A, B> as one group; empty when there is nothing to list
    private static TokenDocument angleList(List<TokenDocument> items) {
        if (items.isEmpty()) {
            return Tokens.EMPTY;
        }
        return new Group(
                concat(text("<"), Tokens.join(concat(text(","), SPACE), items), text(">")), 1);
    }
}
