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

import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.SourceSpan;

/** A reported issue, optionally paired with a fix for the node at its location. */
public final class Diagnostic {
    private final DiagnosticCategory category;
    private final Location location;
    private final SourceSpan span;
    private final String messageId;
    private final FixSuggestion fix; // null when the issue has no automatic fix
    private final int pass;

    private boolean applied;
    private boolean fixSkipped;
    private boolean suppressed;
    private String note;

    public Diagnostic(DiagnosticCategory category, Location location, SourceSpan span) {
        this(category, location, span, category.messageId(), null, 1);
    }

    public Diagnostic(
            DiagnosticCategory category,
            Location location,
            SourceSpan span,
            String messageId,
            FixSuggestion fix,
            int pass) {
        this.category = category;
        this.location = location;
        this.span = span != null ? span : SourceSpan.NONE;
        this.messageId = messageId != null ? messageId : category.messageId();
        this.fix = fix;
        this.pass = pass;
    }

    public DiagnosticCategory category() {
        return category;
    }

    public Location location() {
        return location;
    }

    public SourceSpan span() {
        return span;
    }

    /** Template id to look up in a {@link MessageCatalog}. */
    public String messageId() {
        return messageId;
    }

    /** Returns the fix suggestion if one exists; null otherwise. */
    public FixSuggestion fix() {
        return fix;
    }

    public boolean hasFix() {
        return fix != null;
    }

    /** 1-based number of the traversal pass that raised this diagnostic. */
    public int pass() {
        return pass;
    }

    public boolean isApplied() {
        return applied;
    }

    public boolean isFixSkipped() {
        return fixSkipped;
    }

    public boolean isSuppressed() {
        return suppressed;
    }

    public String note() {
        return note;
    }

    public void markApplied() {
        this.applied = true;
        this.fixSkipped = false;
        this.note = null;
    }

    public void markFixSkipped(String reason) {
        this.fixSkipped = true;
        this.note = reason;
    }

    public void markSuppressed() {
        this.suppressed = true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(category.id()).append(" at ").append(location);
        if (span.isKnown()) {
            sb.append(" [").append(span).append("]");
        }
        if (applied) {
            sb.append(" (fixed)");
        } else if (fixSkipped) {
            sb.append(" (").append(note).append(")");
        } else if (hasFix()) {
            sb.append(" (fixable)");
        }
        return sb.toString();
    }
}
