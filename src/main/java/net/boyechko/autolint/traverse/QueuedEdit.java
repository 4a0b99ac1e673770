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
package net.boyechko.autolint.traverse;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.autolint.ast.Location;
import net.boyechko.autolint.ast.Node;

/**
 * A pending change to the node at {@code location}, collected during a pass and applied by the
 * fix applier afterwards.
 *
 * @param expected the node that lived at {@code location} when the edit was made
 * @param replacement the new node; null for a removal
 * @param ruleNames rules that contributed to the edit, in the order they ran
 * @param ruleOrder lowest registration index among those rules
 * @param absorbed descendant edits already folded into {@code replacement}
 */
public record QueuedEdit(
        Location location,
        Node expected,
        Node replacement,
        List<String> ruleNames,
        int ruleOrder,
        List<QueuedEdit> absorbed) {

    public QueuedEdit {
        if (location == null || expected == null) {
            throw new IllegalArgumentException("Edit needs a location and the expected node");
        }
        ruleNames = List.copyOf(ruleNames);
        absorbed = absorbed == null ? List.of() : List.copyOf(absorbed);
    }

    public QueuedEdit(
            Location location,
            Node expected,
            Node replacement,
            List<String> ruleNames,
            int ruleOrder) {
        this(location, expected, replacement, ruleNames, ruleOrder, List.of());
    }

    public static QueuedEdit replace(Location location, Node expected, Node replacement) {
        return new QueuedEdit(location, expected, replacement, List.of(), 0);
    }

    public static QueuedEdit remove(Location location, Node expected) {
        return new QueuedEdit(location, expected, null, List.of(), 0);
    }

    public boolean isRemoval() {
        return replacement == null;
    }

    /** Locations whose change this edit carries: its own plus every absorbed one. */
    public List<Location> coveredLocations() {
        List<Location> out = new ArrayList<>();
        out.add(location);
        for (QueuedEdit inner : absorbed) {
            out.addAll(inner.coveredLocations());
        }
        return out;
    }

    @Override
    public String toString() {
        return (isRemoval() ? "remove " : "replace ")
                + expected.kind().label()
                + " at "
                + location
                + (ruleNames.isEmpty() ? "" : " by " + String.join(", ", ruleNames));
    }
}
