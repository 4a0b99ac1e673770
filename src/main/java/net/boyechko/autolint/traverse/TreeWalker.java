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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.boyechko.autolint.ast.Comment;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.Nodes;
import net.boyechko.autolint.diagnostic.Suppression;
import net.boyechko.autolint.rule.Rule;
import net.boyechko.autolint.rule.RuleCallback;
import net.boyechko.autolint.rule.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a tree once, depth-first, running every matching rule's enter hook before a node's
 * children and its exit hook after them.
 *
 * <p>Rules on the same node run in registration order and each sees the node as left by the rules
 * before it. Children are taken from that transformed node. Exit hooks see the node with the
 * edits queued beneath it already applied; if they change it further, those descendant edits are
 * folded into the node's own edit. Nothing is edited in place: each location's net change is
 * queued as one {@link QueuedEdit} for the fix applier.
 */
public class TreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private final RuleRegistry registry;
    private final Set<String> enabledCategories;

    private PassContext ctx;
    private Map<Location, QueuedEdit> edits;
    private Set<Node> ancestors;
    private int visited;

    public TreeWalker(RuleRegistry registry) {
        this(registry, Set.of());
    }

    /**
     * @param enabledCategories category ids whose rules may run; empty enables every category
     */
    public TreeWalker(RuleRegistry registry, Set<String> enabledCategories) {
        this.registry = registry;
        this.enabledCategories = Set.copyOf(enabledCategories);
    }

    public PassResult walk(Node root, PassContext ctx) {
        this.ctx = ctx;
        this.edits = new LinkedHashMap<>();
        this.ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
        this.visited = 0;

        walkNode(root, null, Location.ROOT);

        // Marks suppressed diagnostics; the full list still goes to the fix applier.
        ctx.collector().report();
        logger.debug(
                "Pass {} visited {} nodes, raised {} diagnostics, queued {} edits",
                ctx.pass(),
                visited,
                ctx.collector().diagnostics().size(),
                edits.size());

        return new PassResult(
                root, new ArrayList<>(edits.values()), ctx.collector().diagnostics(), visited);
    }

    private void walkNode(Node node, Path parentPath, Location location) {
        if (node == null) {
            throw new MalformedTreeException(location, "Null child node");
        }
        if (ancestors.contains(node)) {
            logger.error(
                    "Cycle detected: {} node is its own ancestor at {}", node.kind(), location);
            throw new MalformedTreeException(
                    location, node.kind().label() + " node appears on its own ancestor chain");
        }
        visited++;

        ancestors.add(node);
        try {
            visit(node, parentPath, location);
        } finally {
            ancestors.remove(node);
        }
    }

    private void visit(Node original, Path parentPath, Location location) {
        Node current = original;
        List<Rule> touchedBy = new ArrayList<>();

        // Enter hooks, in registration order
        for (Rule rule : rulesFor(current)) {
            if (!rule.hasEnter() || !rule.matches(current.kind())) {
                continue;
            }
            TransformResult result =
                    invoke(rule, rule.enter(), new Path(current, parentPath, location, ctx));
            if (result instanceof TransformResult.Remove) {
                touchedBy.add(rule);
                queueRemoval(location, original, touchedBy);
                return;
            }
            if (result instanceof TransformResult.Replace replace
                    && !replace.node().equals(current)) {
                current = replace.node();
                touchedBy.add(rule);
            }
        }

        Path path = new Path(current, parentPath, location, ctx);
        List<Node> kids = Nodes.childrenOf(current);

        boolean pushed = ancestors.add(current);
        try {
            for (int i = 0; i < kids.size(); i++) {
                Node kid = kids.get(i);
                if (kid instanceof Comment comment && i + 1 < kids.size()) {
                    Suppression.parse(comment.value(), location.child(i + 1))
                            .ifPresent(ctx.collector()::suppress);
                }
                walkNode(kid, path, location.child(i));
            }
        } finally {
            if (pushed) {
                ancestors.remove(current);
            }
        }

        List<QueuedEdit> absorbed = List.of();
        if (hasExitHooks(current)) {
            // Exit hooks see the node with the edits queued beneath it in this pass applied.
            List<QueuedEdit> folded = new ArrayList<>();
            Node settled = applyPendingEdits(current, location, folded);
            Node exited = settled;
            List<Rule> exitTouchedBy = new ArrayList<>();
            for (Rule rule : rulesFor(settled)) {
                if (!rule.hasExit() || !rule.matches(exited.kind())) {
                    continue;
                }
                TransformResult result =
                        invoke(rule, rule.exit(), new Path(exited, parentPath, location, ctx));
                if (result instanceof TransformResult.Remove) {
                    touchedBy.add(rule);
                    queueRemoval(location, original, touchedBy);
                    return;
                }
                if (result instanceof TransformResult.Replace replace
                        && !replace.node().equals(exited)) {
                    exited = replace.node();
                    exitTouchedBy.add(rule);
                }
            }
            if (!exited.equals(settled)) {
                current = exited;
                touchedBy.addAll(exitTouchedBy);
                for (QueuedEdit edit : folded) {
                    edits.remove(edit.location());
                }
                absorbed = folded;
            }
        }

        if (!current.equals(original)) {
            edits.put(
                    location,
                    new QueuedEdit(
                            location,
                            original,
                            current,
                            names(touchedBy),
                            order(touchedBy),
                            absorbed));
        }
    }

    private boolean hasExitHooks(Node node) {
        for (Rule rule : rulesFor(node)) {
            if (rule.hasExit() && rule.matches(node.kind())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code node} with the edits queued beneath {@code location} substituted in. Edits
     * nested under another queued edit are left out, as the fix applier would discard them too.
     * Every edit used is added to {@code folded}.
     */
    private Node applyPendingEdits(Node node, Location location, List<QueuedEdit> folded) {
        Map<Location, QueuedEdit> below = new HashMap<>();
        Set<Location> spine = new HashSet<>();
        for (QueuedEdit edit : edits.values()) {
            if (location.isStrictAncestorOf(edit.location())) {
                below.put(edit.location(), edit);
                Optional<Location> p = edit.location().parent();
                while (p.isPresent() && !p.get().equals(location)) {
                    spine.add(p.get());
                    p = p.get().parent();
                }
            }
        }
        if (below.isEmpty()) {
            return node;
        }
        return rebuild(node, location, below, spine, folded);
    }

    private static Node rebuild(
            Node node,
            Location location,
            Map<Location, QueuedEdit> below,
            Set<Location> spine,
            List<QueuedEdit> folded) {
        List<Node> kids = Nodes.childrenOf(node);
        List<Node> rebuilt = new ArrayList<>(kids.size());
        for (int i = 0; i < kids.size(); i++) {
            Location at = location.child(i);
            QueuedEdit edit = below.get(at);
            if (edit != null) {
                folded.add(edit);
                rebuilt.add(edit.replacement());
            } else if (spine.contains(at)) {
                rebuilt.add(rebuild(kids.get(i), at, below, spine, folded));
            } else {
                rebuilt.add(kids.get(i));
            }
        }
        return Nodes.withChildren(node, rebuilt);
    }

    private List<Rule> rulesFor(Node node) {
        List<Rule> matching = registry.lookup(node.kind());
        if (enabledCategories.isEmpty()) {
            return matching;
        }
        List<Rule> enabled = new ArrayList<>(matching.size());
        for (Rule rule : matching) {
            if (enabledCategories.contains(rule.category().id())) {
                enabled.add(rule);
            }
        }
        return enabled;
    }

    private TransformResult invoke(Rule rule, RuleCallback callback, Path path) {
        TransformResult result;
        try {
            result = callback.apply(path);
        } catch (RuntimeException e) {
            logger.error(
                    "Error in rule {} at {}: {}", rule.name(), path.describe(), e.getMessage());
            throw new RuleExecutionException(rule.name(), path.location(), e);
        }
        if (result == null) {
            throw new RuleExecutionException(
                    rule.name(),
                    path.location(),
                    new IllegalStateException("callback returned null instead of a result"));
        }
        return result;
    }

    private void queueRemoval(Location location, Node original, List<Rule> touchedBy) {
        if (location.isRoot()) {
            throw new RuleExecutionException(
                    touchedBy.get(touchedBy.size() - 1).name(),
                    location,
                    new IllegalStateException("the root node cannot be removed"));
        }
        edits.put(
                location,
                new QueuedEdit(location, original, null, names(touchedBy), order(touchedBy)));
    }

    private static List<String> names(List<Rule> rules) {
        List<String> out = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            out.add(rule.name());
        }
        return out;
    }

    private int order(List<Rule> rules) {
        int min = Integer.MAX_VALUE;
        for (Rule rule : rules) {
            min = Math.min(min, registry.indexOf(rule));
        }
        return min;
    }
}
