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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.autolint.ast.Attribute;
import net.boyechko.autolint.ast.Element;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.diagnostic.FixSuggestion;
import net.boyechko.autolint.diagnostic.LintCategories;
import net.boyechko.autolint.rule.Rule;
import net.boyechko.autolint.traverse.Path;
import net.boyechko.autolint.traverse.TransformResult;

/**
 * Flags elements that repeat an attribute name. The fix keeps the first occurrence, since that is
 * the one browsers honour.
 */
public final class NoDuplicateAttributesRule {
    public static final String NAME = "html/noDuplicateAttributes";

    private NoDuplicateAttributesRule() {}

    public static Rule rule() {
        return Rule.onEnter(
                NAME,
                LintCategories.HTML_NO_DUPLICATE_ATTRIBUTES,
                Set.of(NodeKind.ELEMENT),
                NoDuplicateAttributesRule::enter);
    }

    static TransformResult enter(Path path) {
        Element element = (Element) path.node();
        Set<String> seen = new HashSet<>();
        List<Attribute> kept = new ArrayList<>(element.attributes().size());
        for (Attribute attribute : element.attributes()) {
            if (seen.add(attribute.name())) {
                kept.add(attribute);
            }
        }
        if (kept.size() == element.attributes().size()) {
            return TransformResult.keep();
        }
        FixSuggestion patch = new FixSuggestion(element, element.withAttributes(kept));
        return path.replaceWith(
                path.addFixableDiagnostic(patch, LintCategories.HTML_NO_DUPLICATE_ATTRIBUTES));
    }
}
