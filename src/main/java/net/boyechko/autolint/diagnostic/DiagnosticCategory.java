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

/**
 * Stable identity of a diagnostic kind. The human-readable text belongs to a {@link
 * MessageCatalog}; the engine only carries {@code messageId}.
 *
 * @param id category id used for filtering and suppression, e.g. {@code lint/ast/addSelfClosing}
 * @param messageId template id in the message catalog, e.g. {@code AST_ADD_SELF_CLOSING}
 */
public record DiagnosticCategory(String id, String messageId) {

    public DiagnosticCategory {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Category id is required");
        }
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("Message id is required for category " + id);
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
