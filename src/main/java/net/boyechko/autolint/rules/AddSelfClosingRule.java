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
package net.boyechko.autolint.rules;

import java.util.Set;
import net.boyechko.autolint.ast.Element;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.diagnostic.FixSuggestion;
import net.boyechko.autolint.diagnostic.LintCategories;
import net.boyechko.autolint.rule.Rule;
import net.boyechko.autolint.traverse.Path;
import net.boyechko.autolint.traverse.TransformResult;

/** Flags HTML and JSX elements written as {@code <div></div>} that could be {@code <div />}. */
public final class AddSelfClosingRule {
    public static final String NAME = "ast/addSelfClosing";

    private AddSelfClosingRule() {}

    public static Rule rule() {
        return Rule.onEnter(
                NAME,
                LintCategories.AST_ADD_SELF_CLOSING,
                Set.of(NodeKind.ELEMENT),
                AddSelfClosingRule::enter);
    }

    static TransformResult enter(Path path) {
        Element element = (Element) path.node();
        if (element.selfClosing() || !element.isEmpty()) {
            return TransformResult.keep();
        }
        FixSuggestion patch = new FixSuggestion(element, element.withSelfClosing(true));
        return path.replaceWith(
                path.addFixableDiagnostic(patch, LintCategories.AST_ADD_SELF_CLOSING));
    }
}
