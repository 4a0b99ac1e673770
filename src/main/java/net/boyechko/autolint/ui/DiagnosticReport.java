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

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.core.LintResult;
import net.boyechko.autolint.diagnostic.Diagnostic;
import net.boyechko.autolint.diagnostic.MessageCatalog;

/**
 * Plain-text report of a lint or fix run: what was found, what was fixed, and what remains.
 * Diagnostics hidden by a suppression directive are left out.
 */
public final class DiagnosticReport {

    /** One reported diagnostic, with its message already resolved through the catalog. */
    public record Entry(
            String category,
            Location location,
            String message,
            boolean hasFix,
            boolean applied,
            String note) {}

    private DiagnosticReport() {}

    /** The report entries in collection order. */
    public static List<Entry> entries(LintResult result, MessageCatalog catalog) {
        List<Entry> entries = new ArrayList<>();
        for (Diagnostic d : result.reportable()) {
            entries.add(
                    new Entry(
                            d.category().id(),
                            d.location(),
                            catalog.describe(d),
                            d.hasFix(),
                            d.isApplied(),
                            d.note()));
        }
        return entries;
    }

    public static String render(LintResult result, MessageCatalog catalog, String target) {
        StringWriter buffer = new StringWriter();
        try (PrintWriter out = new PrintWriter(buffer)) {
            writeReport(out, result, catalog, target);
        }
        return buffer.toString();
    }

    /**
     * Writes the report to {@code reportPath}, creating parent directories as needed.
     *
     * @param target name of the linted input, shown in the header
     */
    public static void write(
            LintResult result, MessageCatalog catalog, String target, Path reportPath)
            throws IOException {
        Path reportParent = reportPath.getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(reportPath))) {
            writeReport(out, result, catalog, target);
        }
    }

    private static void writeReport(
            PrintWriter out, LintResult result, MessageCatalog catalog, String target) {
        out.println("Lint Report");
        out.println("===========");
        out.println("Input:    " + target);
        out.println();

        out.println("Summary");
        out.println("-------");
        out.println("Issues detected:  " + result.totalDetected());
        out.println("Issues fixable:   " + result.totalFixable());
        out.println("Issues fixed:     " + result.totalApplied());
        out.println("Issues remaining: " + result.totalRemaining());
        if (result.limitReached()) {
            out.println("Fix limit reached after " + result.iterations() + " iterations.");
        }
        out.println();

        if (result.totalDetected() == 0) {
            out.println("No issues were detected.");
            return;
        }

        out.println("Issues");
        out.println("------");
        Map<String, List<Entry>> grouped =
                entries(result, catalog).stream()
                        .collect(
                                Collectors.groupingBy(
                                        Entry::category, LinkedHashMap::new, Collectors.toList()));

        for (var group : grouped.entrySet()) {
            List<Entry> fixed = group.getValue().stream().filter(Entry::applied).toList();
            List<Entry> open = group.getValue().stream().filter(e -> !e.applied()).toList();
            List<Entry> skipped = open.stream().filter(e -> e.note() != null).toList();
            List<Entry> remaining = open.stream().filter(e -> e.note() == null).toList();

            if (!fixed.isEmpty()) {
                writeGroup(out, "[FIXED]", group.getKey(), fixed);
            }
            if (!skipped.isEmpty()) {
                writeGroup(out, "[SKIPPED]", group.getKey(), skipped);
            }
            if (!remaining.isEmpty()) {
                writeGroup(out, "[REMAINING]", group.getKey(), remaining);
            }
        }
    }

    private static void writeGroup(
            PrintWriter out, String status, String category, List<Entry> entries) {
        out.println(status + " " + entries.size() + " " + category);
        for (Entry entry : entries) {
            StringBuilder line = new StringBuilder("  - ");
            line.append(entry.location()).append(": ").append(entry.message());
            if (entry.note() != null) {
                line.append(" (").append(entry.note()).append(")");
            } else if (entry.hasFix() && !entry.applied()) {
                line.append(" (fixable)");
            }
            out.println(line);
        }
    }
}
