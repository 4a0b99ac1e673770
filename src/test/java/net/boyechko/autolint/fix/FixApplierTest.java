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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import net.boyechko.autolint.LogCapture;
import net.boyechko.autolint.ast.Element;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.Program;
import net.boyechko.autolint.ast.Text;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticList;
import net.boyechko.autolint.rules.DefaultRules;
import net.boyechko.autolint.traverse.PassContext;
import net.boyechko.autolint.traverse.PassResult;
import net.boyechko.autolint.traverse.QueuedEdit;
import net.boyechko.autolint.traverse.TreeWalker;
import org.junit.jupiter.api.Test;

class FixApplierTest {
    private final FixApplier applier = new FixApplier();

    private static QueuedEdit edit(Location location, Node expected, Node replacement, int order) {
        return new QueuedEdit(location, expected, replacement, List.of("rule" + order), order);
    }

    private static FixApplier.PassRunner defaultRules() {
        TreeWalker walker = new TreeWalker(DefaultRules.createRegistry());
        return (tree, pass) -> walker.walk(tree, PassContext.fixing(pass));
    }

    @Test
    void replacesNodeAtLocation() {
        Element div = Element.html("div");
        Program program = Program.of(div);

        RewriteResult result =
                applier.rewrite(
                        program,
                        List.of(
                                QueuedEdit.replace(
                                        Location.of(0), div, div.withSelfClosing(true))));

        assertTrue(result.changed());
        assertEquals(Program.of(div.withSelfClosing(true)), result.root());
        assertEquals(Program.of(div), program, "Input tree must be left untouched");
    }

    @Test
    void staleEditIsNeverApplied() {
        Program program = Program.of(Element.html("span"));
        Element div = Element.html("div");

        RewriteResult result =
                applier.rewrite(
                        program,
                        List.of(
                                QueuedEdit.replace(
                                        Location.of(0), div, div.withSelfClosing(true))));

        assertFalse(result.changed());
        assertSame(program, result.root());
        assertEquals(1, result.stale().size());
    }

    @Test
    void editAtMissingLocationIsStale() {
        Program program = Program.of();
        RewriteResult result =
                applier.rewrite(program, List.of(QueuedEdit.remove(Location.of(3), Text.of("x"))));

        assertEquals(1, result.stale().size());
        assertSame(program, result.root());
    }

    @Test
    void ancestorEditWinsOverDescendantEdit() {
        Text text = Text.of("inner");
        Element p = Element.html("p").withChildren(text);
        Program program = Program.of(p);
        Element ancestorFix = Element.html("section").withChildren(text);

        try (LogCapture logs = LogCapture.of(FixApplier.class)) {
            RewriteResult result =
                    applier.rewrite(
                            program,
                            List.of(
                                    edit(Location.of(0, 0), text, Text.of("changed"), 0),
                                    edit(Location.of(0), p, ancestorFix, 1)));

            assertEquals(Program.of(ancestorFix), result.root());
            assertEquals(1, result.applied().size());
            assertEquals(1, result.conflicts().size());
            FixConflict conflict = result.conflicts().get(0);
            assertEquals(Location.of(0), conflict.kept().location());
            assertEquals(Location.of(0, 0), conflict.discarded().location());
            assertTrue(logs.hasMessage(Level.WARN, "superseded by edit at /0"));
        }
    }

    @Test
    void firstEditWinsAtSameLocation() {
        Element div = Element.html("div");
        Element first = div.withSelfClosing(true);

        RewriteResult result =
                applier.rewrite(
                        Program.of(div),
                        List.of(
                                edit(Location.of(0), div, first, 0),
                                edit(Location.of(0), div, Element.html("span"), 1)));

        assertEquals(Program.of(first), result.root());
        assertEquals(1, result.conflicts().size());
    }

    @Test
    void untouchedSubtreesAreShared() {
        Element left = Element.html("ul").withChildren(Element.html("li"));
        Element right = Element.html("div");
        Program program = Program.of(left, right);

        RewriteResult result =
                applier.rewrite(
                        program,
                        List.of(
                                QueuedEdit.replace(
                                        Location.of(1), right, right.withSelfClosing(true))));

        Program rebuilt = (Program) result.root();
        assertSame(left, rebuilt.body().get(0));
    }

    @Test
    void removalDropsChild() {
        Text gone = Text.of("gone");
        Program program = Program.of(gone, Element.html("br"));

        RewriteResult result =
                applier.rewrite(program, List.of(QueuedEdit.remove(Location.of(0), gone)));

        assertEquals(Program.of(Element.html("br")), result.root());
    }

    @Test
    void rootRemovalIsRefused() {
        Program program = Program.of();

        RewriteResult result =
                applier.rewrite(program, List.of(QueuedEdit.remove(Location.ROOT, program)));

        assertSame(program, result.root());
        assertFalse(result.changed());
    }

    @Test
    void appliedEditsFollowRuleOrder() {
        Element a = Element.html("a");
        Element b = Element.html("b");

        RewriteResult result =
                applier.rewrite(
                        Program.of(a, b),
                        List.of(
                                edit(Location.of(0), a, a.withSelfClosing(true), 1),
                                edit(Location.of(1), b, b.withSelfClosing(true), 0)));

        assertEquals(Location.of(1), result.applied().get(0).location());
        assertEquals(Location.of(0), result.applied().get(1).location());
    }

    @Test
    void suggestionsFromEarlierRunAreCheckedForStaleness() {
        Program original = Program.of(Element.html("div"), Element.html("p"));
        DiagnosticList diagnostics =
                new TreeWalker(DefaultRules.createRegistry())
                        .walk(original, PassContext.describing())
                        .diagnostics();
        assertEquals(2, diagnostics.getFixable().size());

        // The first element changed after the diagnostics were collected.
        Program edited = Program.of(Element.html("span"), Element.html("p"));
        RewriteResult result = applier.applySuggestions(edited, diagnostics);

        assertEquals(
                Program.of(Element.html("span"), Element.html("p").withSelfClosing(true)),
                result.root());
        Diagnostic stale = diagnostics.get(0);
        assertTrue(stale.isFixSkipped());
        assertEquals("fix skipped: stale", stale.note());
        assertTrue(diagnostics.get(1).isApplied());
    }

    @Test
    void fixingStopsWhenNothingIsLeft() {
        FixPointResult result =
                applier.applyUntilStable(Program.of(Element.html("div")), defaultRules());

        assertEquals(Program.of(Element.html("div").withSelfClosing(true)), result.root());
        assertEquals(1, result.iterations());
        assertFalse(result.limitReached());
        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).isApplied());
    }

    @Test
    void fixingAFixedTreeChangesNothing() {
        Program fixed = Program.of(Element.html("div").withSelfClosing(true));

        FixPointResult result = applier.applyUntilStable(fixed, defaultRules());

        assertSame(fixed, result.root());
        assertEquals(0, result.iterations());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void iterationCapReturnsBestTreeWithWarning() {
        FixApplier capped = new FixApplier(3);
        FixApplier.PassRunner growing =
                (tree, pass) -> {
                    Program program = (Program) tree;
                    List<Node> body = new ArrayList<>(program.body());
                    body.add(Text.of("pass " + pass));
                    QueuedEdit grow =
                            QueuedEdit.replace(Location.ROOT, program, program.withBody(body));
                    return new PassResult(tree, List.of(grow), new DiagnosticList(), 1);
                };

        try (LogCapture logs = LogCapture.of(FixApplier.class)) {
            FixPointResult result = capped.applyUntilStable(Program.of(), growing);

            assertTrue(result.limitReached());
            assertEquals(3, result.iterations());
            assertEquals(3, ((Program) result.root()).body().size());
            assertTrue(logs.hasMessage(Level.WARN, "Fix limit reached"));
        }
    }

    @Test
    void cancellationIsCheckedBetweenPasses() {
        assertThrows(
                CancellationException.class,
                () -> applier.applyUntilStable(Program.of(), defaultRules(), () -> true));
    }

    @Test
    void capMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new FixApplier(0));
    }
}
