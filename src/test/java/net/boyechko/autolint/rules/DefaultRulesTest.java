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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.rule.Rule;
import net.boyechko.autolint.rule.RuleRegistry;
import org.junit.jupiter.api.Test;

class DefaultRulesTest {

    @Test
    void voidElementRuleRunsBeforeGenericRule() {
        RuleRegistry registry = DefaultRules.createRegistry();

        List<String> names = registry.lookup(NodeKind.ELEMENT).stream().map(Rule::name).toList();

        assertEquals(
                List.of(
                        PreferSelfClosingRule.NAME,
                        AddSelfClosingRule.NAME,
                        NoDuplicateAttributesRule.NAME),
                names);
    }

    @Test
    void eachCallReturnsAFreshRegistry() {
        assertNotSame(DefaultRules.createRegistry(), DefaultRules.createRegistry());
        assertEquals(3, DefaultRules.createRegistry().size());
    }
}
