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

/**
 * Vertex adjacency for one mesh object, used to recalculate normals of RENORMAL materials.
 *
 * @param meshObjectIndex index of the mesh object
 * @param vertexAdjacency adjacent vertex indices, {@code -1} padded
 * @author hal.hildebrand
 */
public record AdjEntry(int meshObjectIndex, List<Integer> vertexAdjacency) {
    public AdjEntry {
        vertexAdjacency = List.copyOf(vertexAdjacency);
    }

    public static AdjEntry of(int meshObjectIndex) {
        return new AdjEntry(meshObjectIndex, List.of());
    }
}
