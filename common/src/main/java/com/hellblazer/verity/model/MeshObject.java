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
package com.hellblazer.verity.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * One object of a mesh file. Objects are identified by {@code (name, subIndex)}; the name alone is not unique.
 *
 * @param name                   object name
 * @param subIndex               index distinguishing objects sharing a name
 * @param textureCoordinateNames names of the texture coordinate attributes, e.g. {@code map1}
 * @param colorSetNames          names of the color set attributes, e.g. {@code colorSet1}
 * @author hal.hildebrand
 */
public record MeshObject(String name, long subIndex, List<String> textureCoordinateNames,
                         List<String> colorSetNames) {

    public MeshObject {
        Objects.requireNonNull(name, "name");
        textureCoordinateNames = List.copyOf(textureCoordinateNames);
        colorSetNames = List.copyOf(colorSetNames);
    }

    public static MeshObject of(String name, long subIndex) {
        return new MeshObject(name, subIndex, List.of(), List.of());
    }

    /**
     * Texture coordinate names followed by color set names.
     */
    public List<String> attributeNames() {
        return Stream.concat(textureCoordinateNames.stream(), colorSetNames.stream()).toList();
    }
}
