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

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Builds an {@link EngineConfig} from the defaults on the classpath plus user overrides.
 *
 * <p>Recognized keys: {@code line_width}, {@code apply_fixes}, {@code fix_iteration_cap} and
 * {@code enabled_categories} (a list of category ids). Unknown keys are logged and ignored.
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULT_CONFIG_RESOURCE = "/autolint.yaml";

    static final String LINE_WIDTH = "line_width";
    static final String APPLY_FIXES = "apply_fixes";
    static final String FIX_ITERATION_CAP = "fix_iteration_cap";
    static final String ENABLED_CATEGORIES = "enabled_categories";

    private ConfigLoader() {}

    /** The classpath defaults, or the built-in defaults if the resource is absent. */
    public static EngineConfig loadDefault() {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                logger.debug(
                        "No {} on the classpath, using built-in defaults",
                        DEFAULT_CONFIG_RESOURCE);
                return EngineConfig.defaults();
            }
            return merge(EngineConfig.defaults(), parse(in));
        } catch (IOException e) {
            logger.error("Failed to read {}: {}", DEFAULT_CONFIG_RESOURCE, e.getMessage());
            throw new IllegalStateException("Failed to read " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    public static EngineConfig fromFile(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file)) {
            logger.debug("Loading configuration from {}", file);
            return merge(loadDefault(), parse(reader));
        }
    }

    public static EngineConfig fromYaml(String yaml) {
        return merge(loadDefault(), parse(yaml));
    }

    public static EngineConfig fromMap(Map<String, ?> overrides) {
        return merge(loadDefault(), overrides);
    }

    /**
     * Applies {@code overrides} on top of {@code base}.
     *
     * @throws IllegalArgumentException if a recognized key has a value of the wrong type or range
     */
    public static EngineConfig merge(EngineConfig base, Map<String, ?> overrides) {
        EngineConfig config = base;
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case LINE_WIDTH:
                    config = config.withLineWidth(asInt(key, value));
                    break;
                case APPLY_FIXES:
                    config = config.withApplyFixes(asBoolean(key, value));
                    break;
                case FIX_ITERATION_CAP:
                    config = config.withFixIterationCap(asInt(key, value));
                    break;
                case ENABLED_CATEGORIES:
                    config = config.withEnabledCategories(asStringSet(key, value));
                    break;
                default:
                    logger.warn("Ignoring unknown configuration key: {}", key);
            }
        }
        return config;
    }

    private static Map<String, Object> parse(Object source) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object loaded;
        if (source instanceof String text) {
            loaded = yaml.load(text);
        } else if (source instanceof Reader reader) {
            loaded = yaml.load(reader);
        } else {
            loaded = yaml.load((InputStream) source);
        }
        if (loaded == null) {
            return Map.of();
        }
        if (!(loaded instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Configuration must be a YAML mapping");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            out.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return out;
    }

    private static int asInt(String key, Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        throw new IllegalArgumentException(key + " must be an integer, got: " + value);
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException(key + " must be true or false, got: " + value);
    }

    private static Set<String> asStringSet(String key, Object value) {
        if (value == null) {
            return Set.of();
        }
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException(key + " must be a list of category ids");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Object item : items) {
            if (!(item instanceof String id) || id.isBlank()) {
                throw new IllegalArgumentException(key + " entries must be category ids: " + item);
            }
            ids.add(id);
        }
        return ids;
    }
}
