/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Verity.
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
package com.hellblazer.verity.shader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Shader programs loaded from a JSON description.
 *
 * <pre>
 * { "programs": { "SFX_PBS_0100000008008269": { "discard": false,
 *                                               "vertexAttributes": ["map1.xy"],
 *                                               "materialParameters": ["Texture0", "CustomVector0.x"] } } }
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class ShaderDatabase implements ShaderProgramLookup {
    public static final String DEFAULT_RESOURCE = "/shader-database.json";

    private static final Logger       log          = LoggerFactory.getLogger(ShaderDatabase.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final NavigableMap<String, ShaderProgram> programs;

    private ShaderDatabase(NavigableMap<String, ShaderProgram> programs) {
        this.programs = Collections.unmodifiableNavigableMap(programs);
    }

    public static ShaderDatabase empty() {
        return new ShaderDatabase(new TreeMap<>());
    }

    /**
     * Load the database bundled on the classpath.
     *
     * @return the database, or empty if the resource is missing or unreadable
     */
    public static Optional<ShaderDatabase> fromResource() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load a database from a classpath resource.
     *
     * @return the database, or empty if the resource is missing or unreadable
     */
    public static Optional<ShaderDatabase> fromResource(String resourcePath) {
        try (var is = ShaderDatabase.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                log.warn("Shader database resource not found: {}", resourcePath);
                return Optional.empty();
            }
            return Optional.of(fromStream(is));
        } catch (IOException e) {
            log.warn("Failed to load shader database {}: {}", resourcePath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parse a database from JSON.
     *
     * @throws IOException if the stream is not valid JSON or lacks the {@code programs} object
     */
    public static ShaderDatabase fromStream(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.has("programs") || !root.get("programs").isObject()) {
            throw new IOException("Shader database has no \"programs\" object");
        }

        var programs = new TreeMap<String, ShaderProgram>();
        var fields = root.get("programs").fields();
        while (fields.hasNext()) {
            var field = fields.next();
            programs.put(field.getKey(), parseProgram(field.getValue()));
        }

        log.info("Loaded {} shader programs", programs.size());
        return new ShaderDatabase(programs);
    }

    public static ShaderDatabase of(Map<String, ShaderProgram> programs) {
        return new ShaderDatabase(new TreeMap<>(programs));
    }

    private static ShaderProgram parseProgram(JsonNode node) {
        var discard = node.has("discard") && node.get("discard").asBoolean();
        return new ShaderProgram(discard, parseStrings(node.get("vertexAttributes")),
                                 parseStrings(node.get("materialParameters")));
    }

    private static List<String> parseStrings(JsonNode arrayNode) {
        if (arrayNode == null || !arrayNode.isArray()) {
            return List.of();
        }
        var values = new ArrayList<String>();
        for (var element : arrayNode) {
            values.add(element.asText());
        }
        return values;
    }

    @Override
    public Optional<ShaderProgram> get(String programName) {
        if (programName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(programs.get(programName));
    }

    /**
     * Program names in ascending order.
     */
    public Set<String> programNames() {
        return programs.keySet();
    }

    public int size() {
        return programs.size();
    }
}
