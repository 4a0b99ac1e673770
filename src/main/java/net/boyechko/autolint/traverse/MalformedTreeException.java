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

import net.boyechko.autolint.ast.Location;

/** The tree handed to the walker is not a tree, e.g. a node is its own ancestor. */
public class MalformedTreeException extends RuntimeException {
    private final Location location;

    public MalformedTreeException(Location location, String message) {
        super(message + " at " + location);
        this.location = location;
    }

    /** Where the walker was when it noticed the problem. */
    public Location location() {
        return location;
    }
}
