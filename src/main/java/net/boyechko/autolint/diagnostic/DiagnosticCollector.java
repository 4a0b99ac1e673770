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
package net.boyechko.autolint.diagnostic;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.ast.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the diagnostics and fix suggestions of one traversal pass. One collector belongs to
 * one pass; nothing here is shared between engine invocations.
 */
public class DiagnosticCollector {
    private static final Logger logger = LoggerFactory.getLogger(DiagnosticCollector.class);

    private final FixMode mode;
    private final int pass;
    private final DiagnosticList diagnostics = new DiagnosticList();
    private final List<Suppression> suppressions = new ArrayList<>();

    public DiagnosticCollector(FixMode mode) {
        this(mode, 1);
    }

    public DiagnosticCollector(FixMode mode, int pass) {
        this.mode = mode;
        this.pass = pass;
    }

    public FixMode mode() {
        return mode;
    }

    public int pass() {
        return pass;
    }

    public Diagnostic addDiagnostic(DiagnosticCategory category, Location location) {
        return addDiagnostic(category, location, SourceSpan.NONE, category.messageId());
    }

    public Diagnostic addDiagnostic(
            DiagnosticCategory category, Location location, SourceSpan span, String messageId) {
        Diagnostic diagnostic = new Diagnostic(category, location, span, messageId, null, pass);
        diagnostics.add(diagnostic);
        logger.debug("Pass {}: {}", pass, diagnostic);
        return diagnostic;
    }

    /**
     * Records a diagnostic together with its fix and returns the node the calling rule should
     * continue with: {@code patch.old()} when only describing, {@code patch.fixed()} when fixes
     * are applied. The suggestion is recorded either way, so {@link #fixableCount()} reflects it.
     */
    public Node addFixableDiagnostic(
            Location location, FixSuggestion patch, DiagnosticCategory category) {
        Diagnostic diagnostic =
                new Diagnostic(
                        category,
                        location,
                        patch.old().span(),
                        category.messageId(),
                        patch,
                        pass);
        diagnostics.add(diagnostic);
        logger.debug("Pass {}: {}", pass, diagnostic);

        return mode == FixMode.APPLY_FIXES ? patch.fixed() : patch.old();
    }

    public void suppress(Suppression suppression) {
        suppressions.add(suppression);
    }

    public List<Suppression> suppressions() {
        return List.copyOf(suppressions);
    }

    /** Every diagnostic raised in this pass, suppressed ones included, in raise order. */
    public DiagnosticList diagnostics() {
        return diagnostics;
    }

    /** Diagnostics with a fix suggestion, whether or not the fix is applied. */
    public int fixableCount() {
        return diagnostics.getFixable().size();
    }

    /**
     * Marks diagnostics under a suppression directive and returns the rest. Suppressed
     * diagnostics keep their fixes; only the report drops them.
     */
    public DiagnosticList report() {
        for (Diagnostic diagnostic : diagnostics) {
            if (!diagnostic.isSuppressed() && isSuppressed(diagnostic)) {
                diagnostic.markSuppressed();
                logger.debug("Suppressed {}", diagnostic);
            }
        }
        return diagnostics.getReportable();
    }

    private boolean isSuppressed(Diagnostic diagnostic) {
        for (Suppression suppression : suppressions) {
            if (suppression.covers(diagnostic)) {
                return true;
            }
        }
        return false;
    }
}
