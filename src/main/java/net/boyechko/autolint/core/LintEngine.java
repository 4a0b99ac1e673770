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
package net.boyechko.autolint.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;
import net.boyechko.autolint.diagnostic.DiagnosticList;
import net.boyechko.autolint.fix.FixApplier;
import net.boyechko.autolint.fix.FixConflict;
import net.boyechko.autolint.fix.FixPointResult;
import net.boyechko.autolint.printer.LayoutEngine;
import net.boyechko.autolint.printer.Printer;
import net.boyechko.autolint.rule.RuleRegistry;
import net.boyechko.autolint.rules.DefaultRules;
import net.boyechko.autolint.traverse.MalformedTreeException;
import net.boyechko.autolint.traverse.PassContext;
import net.boyechko.autolint.traverse.PassResult;
import net.boyechko.autolint.traverse.QueuedEdit;
import net.boyechko.autolint.traverse.RuleExecutionException;
import net.boyechko.autolint.traverse.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lints, fixes and prints syntax trees with one rule set and one configuration. */
public class LintEngine {
    private static final Logger logger = LoggerFactory.getLogger(LintEngine.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final RuleRegistry registry;
    private final EngineConfig config;
    private final LintListener listener;
    private final Printer printer;
    private final TreeWalker walker;
    private final FixApplier fixApplier;

    public static class LintEngineBuilder {
        private RuleRegistry registry;
        private EngineConfig config;
        private LintListener listener;
        private Printer printer;

        public LintEngineBuilder withRegistry(RuleRegistry registry) {
            this.registry = registry;
            return this;
        }

        public LintEngineBuilder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        public LintEngineBuilder withListener(LintListener listener) {
            this.listener = listener;
            return this;
        }

        public LintEngineBuilder withPrinter(Printer printer) {
            this.printer = printer;
            return this;
        }

        public LintEngine build() {
            if (listener == null) {
                throw new IllegalStateException(
                        "LintListener must be provided via withListener(...) before building");
            }
            return new LintEngine(this);
        }
    }

    public static LintEngineBuilder builder() {
        return new LintEngineBuilder();
    }

    private LintEngine(LintEngineBuilder builder) {
        this.registry = builder.registry != null ? builder.registry : DefaultRules.createRegistry();
        this.config = builder.config != null ? builder.config : EngineConfig.defaults();
        this.listener = builder.listener;
        this.printer = builder.printer != null ? builder.printer : Printer.standard();
        this.walker = new TreeWalker(registry, config.enabledCategories());
        this.fixApplier = new FixApplier(config.fixIterationCap());
    }

    public EngineConfig config() {
        return config;
    }

    public RuleRegistry registry() {
        return registry;
    }

    /** Runs a single describe-only pass; the tree is returned unchanged. */
    public LintResult lint(Node root) {
        listener.onPassStart(1);
        PassResult pass;
        try {
            pass = walker.walk(root, PassContext.describing());
        } catch (RuleExecutionException | MalformedTreeException e) {
            listener.onError(e.getMessage());
            throw e;
        }
        reportDiagnosticsGrouped(pass.diagnostics().getReportable());

        LintResult result = LintResult.described(root, pass.diagnostics());
        listener.onSummary(result);
        return result;
    }

    /** Applies fixes until the tree settles or the configured iteration cap is reached. */
    public LintResult fix(Node root) {
        return fix(root, () -> false);
    }

    private LintResult fix(Node root, BooleanSupplier cancelled) {
        FixPointResult fixPoint;
        try {
            fixPoint =
                    fixApplier.applyUntilStable(
                            root,
                            (tree, pass) -> {
                                listener.onPassStart(pass);
                                return walker.walk(tree, PassContext.fixing(pass));
                            },
                            cancelled);
        } catch (RuleExecutionException | MalformedTreeException e) {
            listener.onError(e.getMessage());
            throw e;
        }

        reportDiagnosticsGrouped(fixPoint.diagnostics().getReportable());
        for (QueuedEdit edit : fixPoint.applied()) {
            listener.onFixApplied(edit);
        }
        for (FixConflict conflict : fixPoint.conflicts()) {
            listener.onWarning(conflict.describe());
        }
        if (fixPoint.limitReached()) {
            listener.onWarning(
                    "Fix limit reached after "
                            + fixPoint.iterations()
                            + " iterations; the tree may still have fixable issues");
        }

        LintResult result = LintResult.fixed(fixPoint);
        listener.onSummary(result);
        return result;
    }

    /** Lints or fixes depending on {@link EngineConfig#applyFixes()}. */
    public LintResult run(Node root) {
        return config.applyFixes() ? fix(root) : lint(root);
    }

    /** Renders {@code root} at the configured line width. */
    public String format(Node root) {
        return printer.print(root, new LayoutEngine(config.lineWidth()));
    }

    /**
     * Runs every tree in iteration order.
     *
     * @param cancelled checked before each tree and between fixing passes
     * @throws CancellationException if {@code cancelled} turns true; finished trees are lost
     */
    public Map<String, LintResult> runAll(Map<String, Node> roots, BooleanSupplier cancelled) {
        Map<String, LintResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, Node> entry : roots.entrySet()) {
            if (cancelled.getAsBoolean()) {
                logger.info("Run cancelled after {} of {} targets", results.size(), roots.size());
                listener.onInfo("Run cancelled before " + entry.getKey());
                throw new CancellationException("Run cancelled before " + entry.getKey());
            }
            listener.onTargetStart(entry.getKey());
            LintResult result =
                    config.applyFixes() ? fix(entry.getValue(), cancelled) : lint(entry.getValue());
            results.put(entry.getKey(), result);
        }
        return results;
    }

    // == Reporting helpers ============================================

    private void reportDiagnosticsGrouped(DiagnosticList diagnostics) {
        Map<DiagnosticCategory, List<Diagnostic>> grouped =
                diagnostics.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Diagnostic::category,
                                        LinkedHashMap::new,
                                        Collectors.toList()));

        for (Map.Entry<DiagnosticCategory, List<Diagnostic>> entry : grouped.entrySet()) {
            List<Diagnostic> group = entry.getValue();
            if (group.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onDiagnosticGroup(entry.getKey(), group);
            } else {
                for (Diagnostic diagnostic : group) {
                    listener.onDiagnostic(diagnostic);
                }
            }
        }
    }
}
