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

import java.util.List;

public record InterfaceBody(SourceSpan span, List<Node> members) implements Node {

    public InterfaceBody {
        if (span == null) span = SourceSpan.NONE;
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static InterfaceBody of(Node... members) {
        return new InterfaceBody(SourceSpan.NONE, List.of(members));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INTERFACE_BODY;
    }

    public InterfaceBody withMembers(List<Node> newMembers) {
        return new InterfaceBody(span, newMembers);
    }
}
