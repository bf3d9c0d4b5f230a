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

import com.hellblazer.verity.model.ParamId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What a shader program requires of the materials and meshes using it.
 *
 * <p>Declared names may carry a channel mask after a dot, e.g. {@code "CustomVector47.xyz"} or {@code "map1.xy"}.
 *
 * @param discard            whether the program uses alpha testing
 * @param vertexAttributes   declared vertex attribute names
 * @param materialParameters declared material parameter names
 * @author hal.hildebrand
 */
public record ShaderProgram(boolean discard, List<String> vertexAttributes, List<String> materialParameters) {

    /**
     * Attributes every mesh object has, so they are never reported as missing.
     */
    public static final Set<String> IMPLICIT_ATTRIBUTES = Set.of("Position0", "Normal0", "Tangent0");

    private static final String CHANNELS = "xyzw";
    private static final String COLORS   = "rgba";

    public ShaderProgram {
        vertexAttributes = List.copyOf(vertexAttributes);
        materialParameters = List.copyOf(materialParameters);
    }

    /**
     * Split a declared name into the name and the channel mask, which is empty when absent.
     */
    static String[] splitChannels(String declared) {
        int dot = declared.indexOf('.');
        if (dot < 0) {
            return new String[] { declared, "" };
        }
        return new String[] { declared.substring(0, dot), declared.substring(dot + 1) };
    }

    /**
     * Which of the four components of {@code param} the program reads. A parameter declared without a mask is read
     * entirely; an undeclared parameter is not read at all.
     */
    public boolean[] accessedChannels(ParamId param) {
        var accessed = new boolean[4];
        for (var declared : materialParameters) {
            var parts = splitChannels(declared);
            if (!parts[0].equals(param.label())) {
                continue;
            }
            if (parts[1].isEmpty()) {
                return new boolean[] { true, true, true, true };
            }
            for (char c : parts[1].toLowerCase().toCharArray()) {
                int index = CHANNELS.indexOf(c);
                if (index < 0) {
                    index = COLORS.indexOf(c);
                }
                if (index >= 0) {
                    accessed[index] = true;
                }
            }
        }
        return accessed;
    }

    /**
     * Declared parameter ids in declaration order. Names that are not known parameters are skipped.
     */
    public List<ParamId> materialParameterIds() {
        var ids = new LinkedHashSet<ParamId>();
        for (var declared : materialParameters) {
            ParamId.fromLabel(splitChannels(declared)[0]).ifPresent(ids::add);
        }
        return new ArrayList<>(ids);
    }

    /**
     * Required attribute names in declaration order, without channel masks or the implicit attributes.
     */
    public List<String> requiredAttributeNames() {
        var names = new LinkedHashSet<String>();
        for (var declared : vertexAttributes) {
            var name = splitChannels(declared)[0];
            if (!IMPLICIT_ATTRIBUTES.contains(name)) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Required attributes not found in {@code attributeNames}, in declaration order.
     */
    public List<String> missingRequiredAttributes(Collection<String> attributeNames) {
        return requiredAttributeNames().stream().filter(name -> !attributeNames.contains(name)).toList();
    }

    public boolean requiresParameter(ParamId param) {
        return materialParameters.stream().anyMatch(p -> splitChannels(p)[0].equals(param.label()));
    }
}
