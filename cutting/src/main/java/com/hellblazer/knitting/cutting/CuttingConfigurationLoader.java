/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Knitting.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.knitting.cutting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads {@link CuttingConfiguration} from JSON. Recognized fields are {@code seed}, {@code parallel},
 * {@code parallelism} and {@code parallelThreshold}; absent fields take their default values.
 *
 * @author hal.hildebrand
 */
public final class CuttingConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(CuttingConfigurationLoader.class);

    /** Classpath resource holding the library defaults */
    public static final String DEFAULTS_RESOURCE = "/cutting-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CuttingConfigurationLoader() {
    }

    /**
     * Parse a configuration from a JSON stream.
     *
     * @throws IOException              if the stream cannot be read or is not JSON
     * @throws IllegalArgumentException if a value is out of range
     */
    public static CuttingConfiguration load(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input cannot be null");
        var root = MAPPER.readTree(input);
        if (root == null || !root.isObject()) {
            throw new IOException("Cutting configuration must be a JSON object");
        }
        var defaults = CuttingConfiguration.defaultConfig();
        return new CuttingConfiguration(longField(root, "seed", defaults.seed()),
                                        booleanField(root, "parallel", defaults.parallel()),
                                        intField(root, "parallelism", defaults.parallelism()),
                                        intField(root, "parallelThreshold", defaults.parallelThreshold()));
    }

    /**
     * Load a configuration from a classpath resource.
     *
     * @return the configuration, or empty if the resource does not exist
     * @throws IOException if the resource exists but cannot be parsed
     */
    public static Optional<CuttingConfiguration> loadResource(String resource) throws IOException {
        try (var input = CuttingConfigurationLoader.class.getResourceAsStream(resource)) {
            if (input == null) {
                log.debug("Configuration resource not found: {}", resource);
                return Optional.empty();
            }
            var config = load(input);
            log.info("Loaded cutting configuration from {}: {}", resource, config);
            return Optional.of(config);
        }
    }

    /**
     * Load the library defaults from {@value #DEFAULTS_RESOURCE}, falling back to
     * {@link CuttingConfiguration#defaultConfig()} if the resource is missing or unreadable.
     */
    public static CuttingConfiguration loadDefaults() {
        try {
            return loadResource(DEFAULTS_RESOURCE).orElseGet(CuttingConfiguration::defaultConfig);
        } catch (IOException e) {
            log.warn("Failed to load {}, using built-in defaults", DEFAULTS_RESOURCE, e);
            return CuttingConfiguration.defaultConfig();
        }
    }

    private static long longField(JsonNode root, String name, long fallback) throws IOException {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new IOException(String.format("Field '%s' must be an integer: %s", name, node));
        }
        return node.asLong();
    }

    private static int intField(JsonNode root, String name, int fallback) throws IOException {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IOException(String.format("Field '%s' must be an integer: %s", name, node));
        }
        return node.asInt();
    }

    private static boolean booleanField(JsonNode root, String name, boolean fallback) throws IOException {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw new IOException(String.format("Field '%s' must be a boolean: %s", name, node));
        }
        return node.asBoolean();
    }
}
