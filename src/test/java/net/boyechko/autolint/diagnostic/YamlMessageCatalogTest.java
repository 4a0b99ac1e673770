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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import net.boyechko.autolint.ast.Location;
import org.junit.jupiter.api.Test;

class YamlMessageCatalogTest {

    @Test
    void defaultCatalogCoversBuiltInCategories() {
        YamlMessageCatalog catalog = YamlMessageCatalog.loadDefault();

        for (DiagnosticCategory category : LintCategories.all()) {
            assertTrue(
                    catalog.template(category.messageId()).isPresent(),
                    "No template for " + category.messageId());
        }
    }

    @Test
    void loadsFromResourceAndSkipsEmptyTemplates() {
        YamlMessageCatalog catalog = YamlMessageCatalog.fromResource("/test-messages.yaml");

        assertEquals(2, catalog.size());
        assertEquals("Custom template.", catalog.template("CUSTOM_MESSAGE").orElseThrow());
        assertTrue(catalog.template("EMPTY_MESSAGE").isEmpty());
    }

    @Test
    void describeFallsBackToMessageId() {
        YamlMessageCatalog catalog = YamlMessageCatalog.fromResource("/test-messages.yaml");
        Diagnostic known =
                new Diagnostic(LintCategories.AST_ADD_SELF_CLOSING, Location.ROOT, null);
        Diagnostic unknown =
                new Diagnostic(LintCategories.HTML_PREFER_SELF_CLOSING, Location.ROOT, null);

        assertEquals("Use a self-closing tag.", catalog.describe(known));
        assertEquals("HTML_PREFER_SELF_CLOSING", catalog.describe(unknown));
    }

    @Test
    void missingResourceIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> YamlMessageCatalog.fromResource("/no-such-catalog.yaml"));
    }

    @Test
    void nonMappingIsRejected() {
        ByteArrayInputStream in =
                new ByteArrayInputStream("- a\n- b\n".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> YamlMessageCatalog.fromStream(in));
    }
}
