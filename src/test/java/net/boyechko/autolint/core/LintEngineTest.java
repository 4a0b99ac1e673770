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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import net.boyechko.autolint.ast.Attribute;
import net.boyechko.autolint.ast.Comment;
import net.boyechko.autolint.ast.Element;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.ast.Program;
import net.boyechko.autolint.ast.Text;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;
import net.boyechko.autolint.diagnostic.FixSuggestion;
import net.boyechko.autolint.diagnostic.LintCategories;
import net.boyechko.autolint.rule.Rule;
import net.boyechko.autolint.rule.RuleRegistry;
import net.boyechko.autolint.rules.AddSelfClosingRule;
import net.boyechko.autolint.rules.PreferSelfClosingRule;
import net.boyechko.autolint.traverse.QueuedEdit;
import net.boyechko.autolint.traverse.RuleExecutionException;
import net.boyechko.autolint.traverse.TransformResult;
import org.junit.jupiter.api.Test;

/** Test suite for LintEngine. */
public class LintEngineTest {
    private static final EngineConfig FIXING = EngineConfig.defaults().withApplyFixes(true);
    private static final DiagnosticCategory ORDERED_LISTS =
            new DiagnosticCategory("test/orderedLists", "TEST_ORDERED_LISTS");
    private static final DiagnosticCategory NO_COMMENTS =
            new DiagnosticCategory("test/noComments", "TEST_NO_COMMENTS");

    private final RecordingListener listener = new RecordingListener();

    private LintEngine engine(EngineConfig config) {
        return LintEngine.builder().withConfig(config).withListener(listener).build();
    }

    @Test
    void voidElementIsClosedWithOneDiagnostic() {
        // <img>
        LintResult result = engine(FIXING).run(Element.html("img"));

        // <img />
        assertEquals(Element.html("img").withSelfClosing(true), result.root());
        assertEquals(1, result.totalDetected());
        Diagnostic d = result.reportable().get(0);
        assertEquals(LintCategories.HTML_PREFER_SELF_CLOSING, d.category());
        assertTrue(d.hasFix());
        assertTrue(d.isApplied());
    }

    @Test
    void emptyElementIsClosed() {
        LintResult result = engine(FIXING).run(Element.html("div"));

        assertEquals(Element.html("div").withSelfClosing(true), result.root());
        assertEquals(1, result.totalDetected());
        assertEquals(LintCategories.AST_ADD_SELF_CLOSING, result.reportable().get(0).category());
        assertTrue(result.reportable().get(0).isApplied());
    }

    @Test
    void selfClosingElementIsANoOp() {
        Element div = Element.html("div").withSelfClosing(true);

        LintResult result = engine(FIXING).run(div);

        assertEquals(div, result.root());
        assertEquals(0, result.totalDetected());
        assertFalse(result.changed());
    }

    @Test
    void independentFixesApplyInRegistrationOrder() {
        Program program = Program.of(Element.html("div"), Element.html("img"));

        LintResult result = engine(FIXING).run(program);

        assertEquals(
                Program.of(
                        Element.html("div").withSelfClosing(true),
                        Element.html("img").withSelfClosing(true)),
                result.root());
        List<QueuedEdit> applied = result.appliedEdits();
        assertEquals(2, applied.size());
        assertEquals(Location.of(1), applied.get(0).location());
        assertEquals(List.of(PreferSelfClosingRule.NAME), applied.get(0).ruleNames());
        assertEquals(Location.of(0), applied.get(1).location());
        assertEquals(List.of(AddSelfClosingRule.NAME), applied.get(1).ruleNames());
        assertEquals(applied, listener.fixed);
    }

    @Test
    void lintLeavesTreeUntouchedAndCountsFixableIssues() {
        Program program = Program.of(Element.html("div"), Element.html("img"));

        LintResult result = engine(EngineConfig.defaults()).run(program);

        assertSame(program, result.root());
        assertEquals(3, result.totalDetected(), "img is reported by both self-closing rules");
        assertEquals(3, result.totalFixable());
        assertEquals(0, result.totalApplied());
        assertEquals(3, result.totalRemaining());
        assertEquals(0, result.iterations());
    }

    @Test
    void fixThenPrintIsIdempotent() {
        LintEngine engine = engine(FIXING);
        Program program =
                Program.of(
                        Element.html("div")
                                .withAttributes(Attribute.of("id", "a"), Attribute.of("id", "b"))
                                .withChildren(Element.html("br"), Element.html("span")));

        LintResult once = engine.fix(program);
        String firstText = engine.format(once.root());
        LintResult twice = engine.fix(once.root());

        assertFalse(twice.changed());
        assertEquals(0, twice.totalDetected());
        assertEquals(firstText, engine.format(twice.root()));
        assertEquals("<div id=\"a\">\n  <br />\n  <span />\n</div>", firstText);
    }

    @Test
    void repeatedRunsAreIdentical() {
        Node tree =
                Program.of(
                        Element.html("ul").withChildren(Element.html("li"), Element.html("li")),
                        Element.html("img"),
                        Element.jsx("Widget"));

        LintResult first = engine(FIXING).run(tree);
        LintResult second = engine(FIXING).run(tree);

        assertEquals(first.root(), second.root());
        assertEquals(first.diagnostics().toString(), second.diagnostics().toString());
        assertEquals(
                engine(FIXING).format(first.root()), engine(FIXING).format(second.root()));
    }

    @Test
    void discardedDescendantFixIsPickedUpByNextPass() {
        LintResult result =
                LintEngine.builder()
                        .withConfig(FIXING)
                        .withRegistry(registryWithListRename())
                        .withListener(listener)
                        .build()
                        .run(Program.of(Element.html("ul").withChildren(Element.html("li"))));

        assertEquals(
                Program.of(
                        Element.html("ol").withChildren(Element.html("li").withSelfClosing(true))),
                result.root());
        assertEquals(2, result.iterations());
        assertEquals(1, result.conflicts().size());
        assertEquals(2, result.totalApplied());
        assertTrue(listener.warnings.stream().anyMatch(w -> w.contains("superseded")));
    }

    @Test
    void iterationCapStopsFixingWithWarning() {
        LintResult result =
                LintEngine.builder()
                        .withConfig(FIXING.withFixIterationCap(1))
                        .withRegistry(registryWithListRename())
                        .withListener(listener)
                        .build()
                        .run(Program.of(Element.html("ul").withChildren(Element.html("li"))));

        assertTrue(result.limitReached());
        assertEquals(
                Program.of(Element.html("ol").withChildren(Element.html("li"))), result.root());
        assertEquals(1, result.totalRemaining());
        assertTrue(listener.warnings.stream().anyMatch(w -> w.startsWith("Fix limit reached")));
    }

    @Test
    void exitReplacementKeepsFixesMadeBeneathIt() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(AddSelfClosingRule.rule());
        registry.register(
                Rule.onExit(
                        "test/noComments",
                        NO_COMMENTS,
                        Set.of(NodeKind.PROGRAM),
                        path -> {
                            Program program = (Program) path.node();
                            List<Node> kept = new ArrayList<>();
                            for (Node n : program.body()) {
                                if (!n.is(NodeKind.COMMENT)) {
                                    kept.add(n);
                                }
                            }
                            if (kept.size() == program.body().size()) {
                                return TransformResult.keep();
                            }
                            return path.replaceWith(
                                    path.addFixableDiagnostic(
                                            new FixSuggestion(program, program.withBody(kept)),
                                            NO_COMMENTS));
                        }));

        LintResult result =
                LintEngine.builder()
                        .withConfig(FIXING.withFixIterationCap(1))
                        .withRegistry(registry)
                        .withListener(listener)
                        .build()
                        .run(Program.of(Comment.of("note"), Element.html("div")));

        assertEquals(Program.of(Element.html("div").withSelfClosing(true)), result.root());
        assertTrue(result.conflicts().isEmpty());
        assertEquals(2, result.totalApplied());
        assertEquals(0, result.totalRemaining());
    }

    @Test
    void disabledCategoriesAreNotChecked() {
        EngineConfig onlyVoid =
                FIXING.withEnabledCategories(Set.of(LintCategories.HTML_PREFER_SELF_CLOSING.id()));

        LintResult result = engine(onlyVoid).run(Program.of(Element.html("div")));

        assertEquals(0, result.totalDetected());
    }

    @Test
    void runAllKeepsInputOrder() {
        Map<String, Node> inputs = new LinkedHashMap<>();
        inputs.put("b.html", Element.html("br"));
        inputs.put("a.html", Element.html("p").withChildren(Text.of("fine")));

        Map<String, LintResult> results = engine(FIXING).runAll(inputs, () -> false);

        assertEquals(List.of("b.html", "a.html"), new ArrayList<>(results.keySet()));
        assertEquals(1, results.get("b.html").totalApplied());
        assertEquals(0, results.get("a.html").totalDetected());
        assertEquals(List.of("b.html", "a.html"), listener.targets);
    }

    @Test
    void runAllCanBeCancelledBetweenTargets() {
        Map<String, Node> inputs = new LinkedHashMap<>();
        inputs.put("first", Element.html("div"));
        inputs.put("second", Element.html("div"));
        AtomicInteger checks = new AtomicInteger();

        assertThrows(
                CancellationException.class,
                () ->
                        engine(EngineConfig.defaults())
                                .runAll(inputs, () -> checks.incrementAndGet() > 1));
        assertEquals(List.of("first"), listener.targets);
        assertEquals(List.of("Run cancelled before second"), listener.infos);
    }

    @Test
    void failingRuleIsReportedToListener() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(
                Rule.onEnter(
                        "test/broken",
                        ORDERED_LISTS,
                        Set.of(NodeKind.ELEMENT),
                        path -> {
                            throw new IllegalStateException("boom");
                        }));
        LintEngine engine =
                LintEngine.builder().withRegistry(registry).withListener(listener).build();

        assertThrows(RuleExecutionException.class, () -> engine.run(Element.html("div")));
        assertEquals(1, listener.errors.size());
        assertTrue(listener.errors.get(0).contains("test/broken"));
        assertTrue(listener.summaries.isEmpty());
    }

    @Test
    void engineExposesItsSetup() {
        LintEngine engine = engine(FIXING);

        assertSame(FIXING, engine.config());
        assertEquals(3, engine.registry().size());
    }

    @Test
    void listenerIsRequired() {
        assertThrows(IllegalStateException.class, () -> LintEngine.builder().build());
    }

    @Test
    void summaryIsReported() {
        engine(FIXING).run(Element.html("img"));

        assertEquals(1, listener.summaries.size());
        assertEquals(1, listener.summaries.get(0).totalApplied());
        assertEquals(2, listener.passes.size());
    }

    /** Renames every ul to ol, then the stock self-closing rule. */
    private static RuleRegistry registryWithListRename() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(
                Rule.onEnter(
                        "test/orderedLists",
                        ORDERED_LISTS,
                        Set.of(NodeKind.ELEMENT),
                        path -> {
                            Element el = (Element) path.node();
                            if (!el.name().equals("ul")) {
                                return TransformResult.keep();
                            }
                            Element ol =
                                    new Element(
                                            el.span(),
                                            el.flavor(),
                                            "ol",
                                            el.attributes(),
                                            el.children(),
                                            el.selfClosing());
                            return path.replaceWith(
                                    path.addFixableDiagnostic(
                                            new FixSuggestion(el, ol), ORDERED_LISTS));
                        }));
        registry.register(AddSelfClosingRule.rule());
        return registry;
    }

    private static class RecordingListener extends NoOpLintListener {
        final List<Integer> passes = new ArrayList<>();
        final List<QueuedEdit> fixed = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        final List<String> targets = new ArrayList<>();
        final List<LintResult> summaries = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        final List<String> infos = new ArrayList<>();

        @Override
        public void onPassStart(int pass) {
            passes.add(pass);
        }

        @Override
        public void onFixApplied(QueuedEdit edit) {
            fixed.add(edit);
        }

        @Override
        public void onWarning(String message) {
            warnings.add(message);
        }

        @Override
        public void onTargetStart(String name) {
            targets.add(name);
        }

        @Override
        public void onSummary(LintResult result) {
            summaries.add(result);
        }

        @Override
        public void onError(String message) {
            errors.add(message);
        }

        @Override
        public void onInfo(String message) {
            infos.add(message);
        }
    }
}
