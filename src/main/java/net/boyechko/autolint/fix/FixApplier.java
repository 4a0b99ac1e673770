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
package net.boyechko.autolint.fix;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.Nodes;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticList;
import net.boyechko.autolint.traverse.PassResult;
import net.boyechko.autolint.traverse.QueuedEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the edits queued by a pass into a new tree.
 *
 * <p>Each rewrite drops stale edits first (the expected node is no longer at its location), then
 * resolves overlaps: when one edit targets a strict ancestor of another, the ancestor's edit wins
 * and the other is discarded with a warning. The survivors are applied in one bottom-up rebuild
 * that copies only the spine above each edit; every other subtree is shared with the input.
 */
public class FixApplier {
    private static final Logger logger = LoggerFactory.getLogger(FixApplier.class);

    public static final int DEFAULT_ITERATION_CAP = 10;

    static final String STALE_NOTE = "fix skipped: stale";

    private final int iterationCap;

    public FixApplier() {
        this(DEFAULT_ITERATION_CAP);
    }

    public FixApplier(int iterationCap) {
        if (iterationCap < 1) {
            throw new IllegalArgumentException("Iteration cap must be at least 1: " + iterationCap);
        }
        this.iterationCap = iterationCap;
    }

    public int iterationCap() {
        return iterationCap;
    }

    /** Applies {@code edits} to {@code root} in one rebuild. */
    public RewriteResult rewrite(Node root, List<QueuedEdit> edits) {
        List<QueuedEdit> stale = new ArrayList<>();
        List<QueuedEdit> fresh = new ArrayList<>();
        for (QueuedEdit edit : edits) {
            if (isStale(root, edit)) {
                logger.debug("Dropping stale edit: {}", edit);
                stale.add(edit);
            } else if (edit.isRemoval() && edit.location().isRoot()) {
                logger.warn("Ignoring edit that would remove the root: {}", edit);
                stale.add(edit);
            } else {
                fresh.add(edit);
            }
        }

        List<FixConflict> conflicts = new ArrayList<>();
        List<QueuedEdit> accepted = resolveConflicts(fresh, conflicts);
        if (accepted.isEmpty()) {
            return new RewriteResult(root, List.of(), stale, conflicts);
        }

        Map<Location, QueuedEdit> byLocation = new LinkedHashMap<>();
        Set<Location> spine = new HashSet<>();
        for (QueuedEdit edit : accepted) {
            byLocation.put(edit.location(), edit);
            Optional<Location> p = edit.location().parent();
            while (p.isPresent()) {
                spine.add(p.get());
                p = p.get().parent();
            }
        }

        Node rebuilt = rebuild(root, Location.ROOT, byLocation, spine);

        List<QueuedEdit> applied = new ArrayList<>(accepted);
        applied.sort(Comparator.comparingInt(QueuedEdit::ruleOrder));
        for (QueuedEdit edit : applied) {
            logger.debug("Applied {}", edit);
        }
        return new RewriteResult(rebuilt, applied, stale, conflicts);
    }

    /**
     * Marks the diagnostics of a pass according to what {@code result} did with their locations:
     * applied, skipped as stale, or skipped because an enclosing fix won.
     */
    public void annotate(DiagnosticList diagnostics, RewriteResult result) {
        Set<Location> applied = new HashSet<>();
        for (QueuedEdit edit : result.applied()) {
            applied.addAll(edit.coveredLocations());
        }
        Set<Location> stale = new HashSet<>();
        for (QueuedEdit edit : result.stale()) {
            stale.add(edit.location());
        }
        Map<Location, FixConflict> superseded = new LinkedHashMap<>();
        for (FixConflict conflict : result.conflicts()) {
            superseded.putIfAbsent(conflict.discarded().location(), conflict);
        }

        for (Diagnostic diagnostic : diagnostics) {
            if (!diagnostic.hasFix() || diagnostic.isApplied()) {
                continue;
            }
            Location at = diagnostic.location();
            if (applied.contains(at)) {
                diagnostic.markApplied();
            } else if (stale.contains(at)) {
                diagnostic.markFixSkipped(STALE_NOTE);
            } else if (superseded.containsKey(at)) {
                Location winner = superseded.get(at).kept().location();
                diagnostic.markFixSkipped("fix skipped: superseded by fix at " + winner);
            }
        }
    }

    /**
     * Applies the fix suggestions recorded by an earlier describe-only pass to {@code root},
     * which may have changed since. Suggestions whose old node no longer matches are skipped.
     */
    public RewriteResult applySuggestions(Node root, DiagnosticList diagnostics) {
        List<QueuedEdit> edits = new ArrayList<>();
        Set<Location> seen = new HashSet<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (!diagnostic.hasFix() || diagnostic.fix().isNoOp()) {
                continue;
            }
            if (!seen.add(diagnostic.location())) {
                // One suggestion per location; the first one raised wins.
                continue;
            }
            edits.add(
                    new QueuedEdit(
                            diagnostic.location(),
                            diagnostic.fix().old(),
                            diagnostic.fix().fixed(),
                            List.of(diagnostic.category().id()),
                            edits.size()));
        }
        RewriteResult result = rewrite(root, edits);
        annotate(diagnostics, result);
        return result;
    }

    public FixPointResult applyUntilStable(Node root, PassRunner runner) {
        return applyUntilStable(root, runner, () -> false);
    }

    /**
     * Repeats pass and rewrite until a pass queues no edits, a rewrite applies nothing, or the
     * iteration cap is reached. Hitting the cap is not an error: a warning is logged and the best
     * tree so far is returned.
     *
     * @param runner runs one pass over the current tree; {@link PassRunner#run} receives the
     *     1-based pass number
     * @param cancelled checked before each pass
     * @throws CancellationException if {@code cancelled} turns true between passes
     */
    public FixPointResult applyUntilStable(
            Node root, PassRunner runner, BooleanSupplier cancelled) {
        Node current = root;
        DiagnosticList report = new DiagnosticList();
        List<QueuedEdit> allApplied = new ArrayList<>();
        List<FixConflict> allConflicts = new ArrayList<>();
        int iterations = 0;
        boolean limitReached = false;

        for (int pass = 1; ; pass++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Fixing cancelled before pass " + pass);
            }
            PassResult result = runner.run(current, pass);

            if (!result.hasEdits()) {
                report.addAll(result.diagnostics());
                break;
            }
            if (iterations == iterationCap) {
                limitReached = true;
                report.addAll(result.diagnostics());
                logger.warn(
                        "Fix limit reached after {} iterations; {} edits left unapplied",
                        iterations,
                        result.edits().size());
                break;
            }

            RewriteResult rewrite = rewrite(current, result.edits());
            annotate(result.diagnostics(), rewrite);
            allApplied.addAll(rewrite.applied());
            allConflicts.addAll(rewrite.conflicts());

            if (!rewrite.changed()) {
                report.addAll(result.diagnostics());
                break;
            }
            report.addAll(result.diagnostics().getApplied());
            iterations++;
            current = rewrite.root();
        }

        return new FixPointResult(
                current, report, iterations, limitReached, allApplied, allConflicts);
    }

    /** Runs one traversal pass over a tree. */
    @FunctionalInterface
    public interface PassRunner {
        PassResult run(Node root, int pass);
    }

    private static boolean isStale(Node root, QueuedEdit edit) {
        Optional<Node> live = Nodes.resolve(root, edit.location());
        return live.isEmpty() || !live.get().equals(edit.expected());
    }

    /**
     * Keeps edits in queue order, discarding any edit at or beneath the location of an edit
     * already kept. Ancestors are considered first so they always win.
     */
    private static List<QueuedEdit> resolveConflicts(
            List<QueuedEdit> edits, List<FixConflict> conflicts) {
        List<QueuedEdit> byDocumentOrder = new ArrayList<>(edits);
        // Stable sort: same-location edits keep queue order, so the first one queued wins.
        byDocumentOrder.sort(Comparator.comparing(QueuedEdit::location));

        Set<QueuedEdit> discarded = Collections.newSetFromMap(new IdentityHashMap<>());
        List<QueuedEdit> kept = new ArrayList<>();
        for (QueuedEdit edit : byDocumentOrder) {
            QueuedEdit winner = null;
            for (QueuedEdit k : kept) {
                if (edit.location().isWithin(k.location())) {
                    winner = k;
                    break;
                }
            }
            if (winner != null) {
                FixConflict conflict = new FixConflict(winner, edit);
                logger.warn("Fix conflict: {}", conflict.describe());
                conflicts.add(conflict);
                discarded.add(edit);
            } else {
                kept.add(edit);
            }
        }

        List<QueuedEdit> accepted = new ArrayList<>();
        for (QueuedEdit edit : edits) {
            if (!discarded.contains(edit)) {
                accepted.add(edit);
            }
        }
        return accepted;
    }

    private static Node rebuild(
            Node node, Location location, Map<Location, QueuedEdit> edits, Set<Location> spine) {
        QueuedEdit edit = edits.get(location);
        if (edit != null) {
            return edit.replacement();
        }
        if (!spine.contains(location)) {
            return node;
        }
        List<Node> kids = Nodes.childrenOf(node);
        List<Node> rebuilt = new ArrayList<>(kids.size());
        for (int i = 0; i < kids.size(); i++) {
            rebuilt.add(rebuild(kids.get(i), location.child(i), edits, spine));
        }
        return Nodes.withChildren(node, rebuilt);
    }
}
