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
package net.boyechko.autolint.rule;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;

/**
 * A named analysis or transformation: which node kinds it wants, and what to do on entering and
 * leaving such a node. Rules are plain values, so the same rule can serve a lint pass and a
 * format pass alike.
 *
 * @param enter called before the node's children are visited; may be null
 * @param exit called after the node's children are visited; may be null
 */
public record Rule(
        String name,
        DiagnosticCategory category,
        Predicate<NodeKind> kinds,
        RuleCallback enter,
        RuleCallback exit) {

    public Rule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name is required");
        }
        if (category == null) {
            throw new IllegalArgumentException("Rule " + name + " needs a category");
        }
        if (kinds == null) {
            throw new IllegalArgumentException("Rule " + name + " needs a kind predicate");
        }
        if (enter == null && exit == null) {
            throw new IllegalArgumentException("Rule " + name + " defines neither enter nor exit");
        }
    }

    public static Rule onEnter(
            String name, DiagnosticCategory category, Set<NodeKind> kinds, RuleCallback enter) {
        return new Rule(name, category, EnumSet.copyOf(kinds)::contains, enter, null);
    }

    public static Rule onExit(
            String name, DiagnosticCategory category, Set<NodeKind> kinds, RuleCallback exit) {
        return new Rule(name, category, EnumSet.copyOf(kinds)::contains, null, exit);
    }

    public boolean matches(NodeKind kind) {
        return kinds.test(kind);
    }

    public boolean hasEnter() {
        return enter != null;
    }

    public boolean hasExit() {
        return exit != null;
    }
}
