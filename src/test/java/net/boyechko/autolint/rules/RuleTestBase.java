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
package net.boyechko.autolint.rules;

import net.boyechko.autolint.ast.Node;
import net.boyechko.autolint.diagnostic.DiagnosticList;
import net.boyechko.autolint.fix.FixApplier;
import net.boyechko.autolint.fix.FixPointResult;
import net.boyechko.autolint.rule.Rule;
import net.boyechko.autolint.rule.RuleRegistry;
import net.boyechko.autolint.traverse.PassContext;
import net.boyechko.autolint.traverse.TreeWalker;

/** Base for tests that run a single rule in isolation. */
abstract class RuleTestBase {

    protected abstract Rule rule();

    private TreeWalker walker() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(rule());
        return new TreeWalker(registry);
    }

    /** Reports without fixing; the tree is untouched. */
    protected DiagnosticList lint(Node root) {
        return walker().walk(root, PassContext.describing()).diagnostics();
    }

    /** Fixes until stable. */
    protected FixPointResult fix(Node root) {
        TreeWalker walker = walker();
        return new FixApplier()
                .applyUntilStable(
                        root, (tree, pass) -> walker.walk(tree, PassContext.fixing(pass)));
    }
}
