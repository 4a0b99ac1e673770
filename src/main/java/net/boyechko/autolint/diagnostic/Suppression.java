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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import net.boyechko.autolint.ast.Location;

/**
 * An {@code autolint-ignore} directive: silences the listed categories (all of them when the set
 * is empty) for every diagnostic raised within {@code scope}.
 */
public record Suppression(Location scope, Set<String> categoryIds) {
    public static final String DIRECTIVE = "autolint-ignore";

    public Suppression {
        categoryIds = Set.copyOf(categoryIds);
    }

    /**
     * Parses comment text such as {@code autolint-ignore lint/html/preferSelfClosing}. Returns
     * empty if the text is not a directive.
     */
    public static Optional<Suppression> parse(String commentText, Location scope) {
        String text = commentText.strip();
        if (!text.startsWith(DIRECTIVE)) {
            return Optional.empty();
        }
        String rest = text.substring(DIRECTIVE.length());
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0))) {
            return Optional.empty();
        }
        Set<String> ids = new LinkedHashSet<>();
        Arrays.stream(rest.strip().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .forEach(ids::add);
        return Optional.of(new Suppression(scope, ids));
    }

    public boolean covers(Diagnostic diagnostic) {
        if (!diagnostic.location().isWithin(scope)) {
            return false;
        }
        return categoryIds.isEmpty() || categoryIds.contains(diagnostic.category().id());
    }
}
