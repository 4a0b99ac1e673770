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

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/** {@link MessageCatalog} backed by a flat YAML map of message id to template. */
public final class YamlMessageCatalog implements MessageCatalog {
    private static final String DEFAULT_CATALOG_RESOURCE = "/messages.yaml";
    private static final Logger logger = LoggerFactory.getLogger(YamlMessageCatalog.class);

    private final Map<String, String> templates;

    public YamlMessageCatalog(Map<String, String> templates) {
        this.templates = Map.copyOf(templates);
    }

    /**
     * Load a catalog from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static YamlMessageCatalog fromResource(String resourcePath) {
        try (InputStream inputStream = YamlMessageCatalog.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            YamlMessageCatalog catalog = fromStream(inputStream);
            logger.debug(
                    "Loaded {} message templates from resource {}",
                    catalog.templates.size(),
                    resourcePath);
            return catalog;
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            logger.error(
                    "Failed to load message catalog from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load message catalog from " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load the catalog that ships with the built-in rules. */
    public static YamlMessageCatalog loadDefault() {
        return fromResource(DEFAULT_CATALOG_RESOURCE);
    }

    static YamlMessageCatalog fromStream(InputStream inputStream) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object loaded = yaml.load(inputStream);
        if (loaded == null) {
            return new YamlMessageCatalog(Map.of());
        }
        if (!(loaded instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Message catalog must be a YAML mapping");
        }
        Map<String, String> templates = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (entry.getValue() == null) {
                logger.warn("Message id {} has no template, skipping", entry.getKey());
                continue;
            }
            templates.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
        }
        return new YamlMessageCatalog(templates);
    }

    @Override
    public Optional<String> template(String messageId) {
        return Optional.ofNullable(templates.get(messageId));
    }

    public int size() {
        return templates.size();
    }
}
