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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns nodes into {@link TokenDocument}s through a per-kind dispatch table. */
public class Printer {
    private static final Logger logger = LoggerFactory.getLogger(Printer.class);

    private final Map<NodeKind, KindPrinter> printers;

    public Printer(Map<NodeKind, KindPrinter> printers) {
        this.printers = new EnumMap<>(NodeKind.class);
        this.printers.putAll(printers);
    }

    /** A printer covering every node kind with the markup and TypeScript builders. */
    public static Printer standard() {
        Map<NodeKind, KindPrinter> table = new EnumMap<>(NodeKind.class);
        MarkupBuilders.registerAll(table);
        TypeScriptBuilders.registerAll(table);
        Printer printer = new Printer(table);
        for (NodeKind kind : NodeKind.values()) {
            if (!printer.supports(kind)) {
                throw new UnsupportedNodeKindException(kind);
            }
        }
        return printer;
    }

    public boolean supports(NodeKind kind) {
        return printers.containsKey(kind);
    }

    public Map<NodeKind, KindPrinter> printers() {
        return Collections.unmodifiableMap(printers);
    }

    /**
     * @throws UnsupportedNodeKindException if no printer handles the node's kind
     */
    public TokenDocument tokenize(Node node, Node parent) {
        KindPrinter printer = printers.get(node.kind());
        if (printer == null) {
            logger.error("Cannot print {} node: no printer registered", node.kind().label());
            throw new UnsupportedNodeKindException(node.kind());
        }
        return printer.print(this, node, parent);
    }

    public TokenDocument tokenize(Node root) {
        return tokenize(root, null);
    }

    public String print(Node root, int lineWidth) {
        return print(root, new LayoutEngine(lineWidth));
    }

    public String print(Node root, LayoutEngine layout) {
        return layout.render(tokenize(root));
    }
}
