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

import net.boyechko.autolint.rule.RuleRegistry;

/** The built-in rule set, in the order the rules run on a node. */
public final class DefaultRules {

    private DefaultRules() {}

    // The void-element rule goes first so an <img> is reported once, under its more specific
    // category; when fixing, the generic rule then sees it already closed.
    public static RuleRegistry createRegistry() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(PreferSelfClosingRule.rule());
        registry.register(AddSelfClosingRule.rule());
        registry.register(NoDuplicateAttributesRule.rule());
        return registry;
    }
}
