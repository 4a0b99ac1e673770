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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.autolint.LogCapture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Test suite for ConfigLoader. */
public class ConfigLoaderTest {

    @TempDir Path tempDir;

    @Test
    void classpathDefaultsMatchBuiltIns() {
        assertEquals(EngineConfig.defaults(), ConfigLoader.loadDefault());
    }

    @Test
    void mapOverridesOnlyNamedKeys() {
        EngineConfig config = ConfigLoader.fromMap(Map.of("line_width", 100));

        assertEquals(100, config.lineWidth());
        assertFalse(config.applyFixes());
        assertEquals(EngineConfig.DEFAULT_FIX_ITERATION_CAP, config.fixIterationCap());
    }

    @Test
    void yamlStringIsParsed() {
        EngineConfig config =
                ConfigLoader.fromYaml(
                        "apply_fixes: true\n"
                                + "fix_iteration_cap: 3\n"
                                + "enabled_categories: [lint/ast/addSelfClosing]\n");

        assertTrue(config.applyFixes());
        assertEquals(3, config.fixIterationCap());
        assertEquals(Set.of("lint/ast/addSelfClosing"), config.enabledCategories());
    }

    @Test
    void emptyYamlKeepsDefaults() {
        assertEquals(EngineConfig.defaults(), ConfigLoader.fromYaml(""));
    }

    @Test
    void fileIsLoaded() throws IOException {
        Path file = tempDir.resolve("autolint.yaml");
        try (InputStream in = getClass().getResourceAsStream("/test-config.yaml")) {
            assertNotNull(in, "test-config.yaml should be on the test classpath");
            Files.copy(in, file);
        }

        EngineConfig config = ConfigLoader.fromFile(file);

        assertEquals(40, config.lineWidth());
        assertTrue(config.applyFixes());
        assertEquals(Set.of("lint/html/preferSelfClosing"), config.enabledCategories());
    }

    @Test
    void missingFileThrows() {
        assertThrows(IOException.class, () -> ConfigLoader.fromFile(tempDir.resolve("nope.yaml")));
    }

    @Test
    void wrongTypeIsRejected() {
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> ConfigLoader.fromMap(Map.of("apply_fixes", "yes please")));
        assertTrue(e.getMessage().startsWith("apply_fixes"));

        assertThrows(
                IllegalArgumentException.class,
                () -> ConfigLoader.fromMap(Map.of("enabled_categories", "lint/ast")));
        assertThrows(
                IllegalArgumentException.class,
                () -> ConfigLoader.fromMap(Map.of("enabled_categories", List.of(""))));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> ConfigLoader.fromMap(Map.of("fix_iteration_cap", 0)));
        assertTrue(e.getMessage().contains("fix_iteration_cap"));
        assertThrows(
                IllegalArgumentException.class,
                () -> ConfigLoader.fromMap(Map.of("line_width", -5)));
    }

    @Test
    void nonMappingDocumentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.fromYaml("- a\n- b\n"));
    }

    @Test
    void unknownKeysAreLoggedAndIgnored() {
        Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put("colour", "blue");
        overrides.put("line_width", 60);

        try (LogCapture log = LogCapture.of(ConfigLoader.class)) {
            EngineConfig config = ConfigLoader.fromMap(overrides);

            assertEquals(60, config.lineWidth());
            assertTrue(log.hasMessage(Level.WARN, "colour"));
        }
    }

    @Test
    void laterMergeWins() {
        EngineConfig base = ConfigLoader.fromMap(Map.of("line_width", 60));

        EngineConfig merged = ConfigLoader.merge(base, Map.of("line_width", 120));

        assertEquals(120, merged.lineWidth());
    }
}
