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

import java.util.List;

/** Categories raised by the built-in rules. */
public final class LintCategories {
    private LintCategories() {}

    public static final DiagnosticCategory AST_ADD_SELF_CLOSING =
            new DiagnosticCategory("lint/ast/addSelfClosing", "AST_ADD_SELF_CLOSING");

    public static final DiagnosticCategory HTML_PREFER_SELF_CLOSING =
            new DiagnosticCategory("lint/html/preferSelfClosing", "HTML_PREFER_SELF_CLOSING");

    public static final DiagnosticCategory HTML_NO_DUPLICATE_ATTRIBUTES =
            new DiagnosticCategory(
                    "lint/html/noDuplicateAttributes", "HTML_NO_DUPLICATE_ATTRIBUTES");

    public static List<DiagnosticCategory> all() {
        return List.of(
                AST_ADD_SELF_CLOSING, HTML_PREFER_SELF_CLOSING, HTML_NO_DUPLICATE_ATTRIBUTES);
    }
}
