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
package net.boyechko.autolint.core;

import java.util.Set;
import net.boyechko.autolint.diagnostic.DiagnosticCategory;

/**
 * Settings for one engine.
 *
 * @param lineWidth maximum printed line width
 * @param applyFixes whether {@link LintEngine#run} rewrites the tree or only reports
 * @param fixIterationCap maximum rewrites in one fixing run
 * @param enabledCategories category ids whose rules run; empty enables all of them
 */
public record EngineConfig(
        int lineWidth, boolean applyFixes, int fixIterationCap, Set<String> enabledCategories) {

    public static final int DEFAULT_LINE_WIDTH = 80;
    public static final int DEFAULT_FIX_ITERATION_CAP = 10;

    public EngineConfig {
        if (lineWidth < 1) {
            throw new IllegalArgumentException("line_width must be positive: " + lineWidth);
        }
        if (fixIterationCap < 1) {
            throw new IllegalArgumentException(
                    "fix_iteration_cap must be at least 1: " + fixIterationCap);
        }
        enabledCategories = enabledCategories == null ? Set.of() : Set.copyOf(enabledCategories);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_LINE_WIDTH, false, DEFAULT_FIX_ITERATION_CAP, Set.of());
    }

    public boolean isCategoryEnabled(DiagnosticCategory category) {
        return enabledCategories.isEmpty() || enabledCategories.contains(category.id());
    }

    public EngineConfig withLineWidth(int newLineWidth) {
        return new EngineConfig(newLineWidth, applyFixes, fixIterationCap, enabledCategories);
    }

    public EngineConfig withApplyFixes(boolean newApplyFixes) {
        return new EngineConfig(lineWidth, newApplyFixes, fixIterationCap, enabledCategories);
    }

    public EngineConfig withFixIterationCap(int newCap) {
        return new EngineConfig(lineWidth, applyFixes, newCap, enabledCategories);
    }

    public EngineConfig withEnabledCategories(Set<String> newCategories) {
        return new EngineConfig(lineWidth, applyFixes, fixIterationCap, newCategories);
    }
}
