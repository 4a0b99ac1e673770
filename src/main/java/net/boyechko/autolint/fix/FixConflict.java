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
package net.boyechko.autolint.fix;

import net.boyechko.autolint.traverse.QueuedEdit;

/**
 * Two edits that could not both be applied: {@code discarded} targets the location of {@code
 * kept} or a location underneath it.
 */
public record FixConflict(QueuedEdit kept, QueuedEdit discarded) {

    public String describe() {
        return "Edit at "
                + discarded.location()
                + " discarded: superseded by edit at "
                + kept.location();
    }
}
