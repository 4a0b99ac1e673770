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

import java.util.Optional;

/** Source of human-readable templates for diagnostic message ids. */
public interface MessageCatalog {

    Optional<String> template(String messageId);

    /** Returns the template for {@code diagnostic}, or its raw message id if none is known. */
    default String describe(Diagnostic diagnostic) {
        return template(diagnostic.messageId()).orElse(diagnostic.messageId());
    }
}
