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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import net.boyechko.autolint.ast.NodeKind;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered table of rules indexed by node kind. Lookup is a single {@link EnumMap} read; each
 * per-kind list keeps registration order, which is the order rules run in.
 */
public class RuleRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RuleRegistry.class);

    private final List<Rule> rules = new ArrayList<>();
    private final Map<String, Integer> indexByName = new HashMap<>();
    private final EnumMap<NodeKind, List<Rule>> byKind = new EnumMap<>(NodeKind.class);

    public RuleRegistry() {
        for (NodeKind kind : NodeKind.values()) {
            byKind.put(kind, new ArrayList<>());
        }
    }

    public Rule register(
            String name,
            DiagnosticCategory category,
            Predicate<NodeKind> kinds,
            RuleCallback enter,
            RuleCallback exit) {
        return register(new Rule(name, category, kinds, enter, exit));
    }

    /**
     * Adds {@code rule} after every rule registered so far.
     *
     * @throws DuplicateRuleException if a rule with the same name is already registered
     */
    public Rule register(Rule rule) {
        if (indexByName.containsKey(rule.name())) {
            throw new DuplicateRuleException(rule.name());
        }
        indexByName.put(rule.name(), rules.size());
        rules.add(rule);

        int kindCount = 0;
        for (NodeKind kind : NodeKind.values()) {
            if (rule.matches(kind)) {
                byKind.get(kind).add(rule);
                kindCount++;
            }
        }
        if (kindCount == 0) {
            logger.warn("Rule {} matches no node kind and will never run", rule.name());
        }
        logger.debug("Registered rule {} for {} node kinds", rule.name(), kindCount);
        return rule;
    }

    /** Rules interested in {@code kind}, in registration order. */
    public List<Rule> lookup(NodeKind kind) {
        List<Rule> matching = byKind.get(kind);
        if (matching == null) {
            throw new IllegalStateException("No dispatch entry for node kind " + kind);
        }
        return Collections.unmodifiableList(matching);
    }

    /** Zero-based registration index of {@code rule}. */
    public int indexOf(Rule rule) {
        Integer index = indexByName.get(rule.name());
        if (index == null) {
            throw new IllegalArgumentException("Rule " + rule.name() + " is not registered");
        }
        return index;
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    public List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    public int size() {
        return rules.size();
    }
}
