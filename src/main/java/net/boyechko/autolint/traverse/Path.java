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
package net.boyechko.autolint.traverse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;
import net.boyechko.autolint.diagnostic.FixSuggestion;

/**
 * Cursor over one node and its ancestor chain, handed to rule callbacks. A path only borrows the
 * nodes it points at; it never edits them. {@link #replaceWith} and {@link #remove} describe an
 * edit which the walker queues when the callback returns it.
 *
 * <p>A fresh path is built for every callback invocation and should not be retained afterwards.
 */
public final class Path {
    private final Node node;
    private final Path parent;
    private final Location location;
    private final PassContext context;

    Path(Node node, Path parent, Location location, PassContext context) {
        this.node = node;
        this.parent = parent;
        this.location = location;
        this.context = context;
    }

    /** Creates a root path; mostly useful for invoking a rule callback directly. */
    public static Path root(Node node, PassContext context) {
        return new Path(node, null, Location.ROOT, context);
    }

    public Node node() {
        return node;
    }

    public NodeKind kind() {
        return node.kind();
    }

    public Optional<Path> parent() {
        return Optional.ofNullable(parent);
    }

    /** The parent node, or null at the root. */
    public Node parentNode() {
        return parent != null ? parent.node : null;
    }

    public Location location() {
        return location;
    }

    public PassContext context() {
        return context;
    }

    /** Ancestor nodes from the direct parent up to the root. */
    public List<Node> ancestors() {
        List<Node> out = new ArrayList<>(location.depth());
        for (Path p = parent; p != null; p = p.parent) {
            out.add(p.node);
        }
        return out;
    }

    /** Returns the closest ancestor of {@code kind}, if any. */
    public Optional<Node> findAncestor(NodeKind kind) {
        for (Path p = parent; p != null; p = p.parent) {
            if (p.node.is(kind)) {
                return Optional.of(p.node);
            }
        }
        return Optional.empty();
    }

    /** Requests that the node at this location become {@code newNode} after the pass. */
    public TransformResult replaceWith(Node newNode) {
        return newNode.equals(node) ? TransformResult.keep() : TransformResult.replace(newNode);
    }

    /** Requests that the node at this location be dropped from its parent after the pass. */
    public TransformResult remove() {
        return TransformResult.remove();
    }

    public Diagnostic addDiagnostic(DiagnosticCategory category) {
        return context.collector()
                .addDiagnostic(category, location, node.span(), category.messageId());
    }

    /**
     * Records a fixable diagnostic at this location. Returns the node the rule should hand back:
     * the old node when only describing, the fixed one when fixes are applied.
     */
    public Node addFixableDiagnostic(FixSuggestion patch, DiagnosticCategory category) {
        return context.collector().addFixableDiagnostic(location, patch, category);
    }

    /** Human-readable trail such as {@code /Program.Element[0].Attribute[1]}. */
    public String describe() {
        List<Path> chain = new ArrayList<>();
        for (Path p = this; p != null; p = p.parent) {
            chain.add(0, p);
        }
        StringBuilder sb = new StringBuilder("/");
        for (int i = 0; i < chain.size(); i++) {
            Path p = chain.get(i);
            if (i > 0) {
                sb.append('.');
            }
            sb.append(p.node.kind().label());
            if (!p.location.isRoot()) {
                sb.append('[').append(p.location.lastIndex()).append(']');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
