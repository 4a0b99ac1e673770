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
package net.boyechko.autolint.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.autolint.ast.Element;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.SourceSpan;
import net.boyechko.autolint.core.LintEngine;
import net.boyechko.autolint.core.LintResult;
import net.boyechko.autolint.core.NoOpLintListener;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;
import net.boyechko.autolint.diagnostic.DiagnosticList;
import net.boyechko.autolint.diagnostic.FixSuggestion;
import net.boyechko.autolint.diagnostic.LintCategories;
import net.boyechko.autolint.diagnostic.MessageCatalog;
import net.boyechko.autolint.diagnostic.YamlMessageCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DiagnosticReportTest {
    private static final String NL = System.lineSeparator();

    private final MessageCatalog catalog = YamlMessageCatalog.fromResource("/test-messages.yaml");

    @TempDir Path tempDir;

    @Test
    void reportGroupsByCategoryAndStatus() {
        String report = DiagnosticReport.render(mixedResult(), catalog, "page.html");

        String expected =
                String.join(
                                NL,
                                "Lint Report",
                                "===========",
                                "Input:    page.html",
                                "",
                                "Summary",
                                "-------",
                                "Issues detected:  3",
                                "Issues fixable:   3",
                                "Issues fixed:     1",
                                "Issues remaining: 2",
                                "",
                                "Issues",
                                "------",
                                "[FIXED] 1 lint/ast/addSelfClosing",
                                "  - /0: Use a self-closing tag.",
                                "[SKIPPED] 1 lint/ast/addSelfClosing",
                                "  - /1: Use a self-closing tag. (fix skipped: stale)",
                                "[REMAINING] 1 lint/html/noDuplicateAttributes",
                                "  - /2: HTML_NO_DUPLICATE_ATTRIBUTES (fixable)")
                        + NL;
        assertEquals(expected, report);
    }

    @Test
    void suppressedDiagnosticsAreLeftOut() {
        List<DiagnosticReport.Entry> entries = DiagnosticReport.entries(mixedResult(), catalog);

        assertEquals(3, entries.size());
        assertTrue(entries.stream().noneMatch(e -> e.location().equals(Location.of(3))));
    }

    @Test
    void cleanRunSaysSo() {
        LintResult clean =
                LintEngine.builder()
                        .withListener(new NoOpLintListener())
                        .build()
                        .lint(Element.html("br").withSelfClosing(true));

        String report = DiagnosticReport.render(clean, catalog, "clean.html");

        assertTrue(report.contains("Issues detected:  0"));
        assertTrue(report.endsWith("No issues were detected." + NL));
        assertFalse(report.contains("[REMAINING]"));
    }

    @Test
    void fixLimitIsMentioned() {
        LintResult limited =
                new LintResult(
                        Element.html("div"), new DiagnosticList(), 10, true, List.of(), List.of());

        assertTrue(
                DiagnosticReport.render(limited, catalog, "x")
                        .contains("Fix limit reached after 10 iterations."));
    }

    @Test
    void writeCreatesParentDirectories() throws IOException {
        Path reportPath = tempDir.resolve("reports/nested/page.txt");

        DiagnosticReport.write(mixedResult(), catalog, "page.html", reportPath);

        assertTrue(Files.exists(reportPath));
        String content = Files.readString(reportPath);
        assertEquals(DiagnosticReport.render(mixedResult(), catalog, "page.html"), content);
    }

    private static LintResult mixedResult() {
        DiagnosticList diagnostics = new DiagnosticList();

        Diagnostic applied = fixable(LintCategories.AST_ADD_SELF_CLOSING, 0);
        applied.markApplied();
        diagnostics.add(applied);

        Diagnostic stale = fixable(LintCategories.AST_ADD_SELF_CLOSING, 1);
        stale.markFixSkipped("fix skipped: stale");
        diagnostics.add(stale);

        diagnostics.add(fixable(LintCategories.HTML_NO_DUPLICATE_ATTRIBUTES, 2));

        Diagnostic suppressed = fixable(LintCategories.AST_ADD_SELF_CLOSING, 3);
        suppressed.markSuppressed();
        diagnostics.add(suppressed);

        return new LintResult(Element.html("div"), diagnostics, 1, false, List.of(), List.of());
    }

    private static Diagnostic fixable(DiagnosticCategory category, int index) {
        Element div = Element.html("div");
        return new Diagnostic(
                category,
                Location.of(index),
                SourceSpan.NONE,
                category.messageId(),
                new FixSuggestion(div, div.withSelfClosing(true)),
                1);
    }
}
