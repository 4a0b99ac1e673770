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
package net.boyechko.autolint.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Address of a node as the chain of child indices from the root ({@code /0/2/1}). Indices refer
 * to {@link Nodes#childrenOf} order. Locations sort in document order: an ancestor sorts before
 * each of its descendants.
 */
public record Location(List<Integer> steps) implements Comparable<Location> {
    public static final Location ROOT = new Location(List.of());

    public Location {
        steps = List.copyOf(steps);
    }

    public static Location of(Integer... steps) {
        return new Location(List.of(steps));
    }

    public Location child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Child index must be non-negative: " + index);
        }
        List<Integer> next = new ArrayList<>(steps.size() + 1);
        next.addAll(steps);
        next.add(index);
        return new Location(next);
    }

    public Optional<Location> parent() {
        if (isRoot()) {
            return Optional.empty();
        }
        return Optional.of(new Location(steps.subList(0, steps.size() - 1)));
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    public int depth() {
        return steps.size();
    }

    /** Index of this node within its parent's children; -1 for the root. */
    public int lastIndex() {
        return isRoot() ? -1 : steps.get(steps.size() - 1);
    }

    public boolean isStrictAncestorOf(Location other) {
        return other.steps.size() > steps.size()
                && other.steps.subList(0, steps.size()).equals(steps);
    }

    /** True if {@code this} is {@code scope} or lies underneath it. */
    public boolean isWithin(Location scope) {
        return equals(scope) || scope.isStrictAncestorOf(this);
    }

    @Override
    public int compareTo(Location other) {
        int shared = Math.min(steps.size(), other.steps.size());
        for (int i = 0; i < shared; i++) {
            int cmp = Integer.compare(steps.get(i), other.steps.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(steps.size(), other.steps.size());
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return "/";
        }
        return steps.stream().map(String::valueOf).collect(Collectors.joining("/", "/", ""));
    }
}
