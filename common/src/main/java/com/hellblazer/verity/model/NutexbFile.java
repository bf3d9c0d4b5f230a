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

import java.util.Objects;

/**
 * Footer information of a parsed texture file. Pixel data is not needed by any cross-file check.
 *
 * @author hal.hildebrand
 */
public record NutexbFile(String name, int width, int height, int depth, int layerCount, int mipmapCount,
                         NutexbFormat format) {

    public NutexbFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(format, "format");
    }

    /**
     * A single layer 1x1 2D texture.
     */
    public static NutexbFile of(String name, NutexbFormat format) {
        return new NutexbFile(name, 1, 1, 1, 1, 1, format);
    }

    /**
     * A six layer cube map.
     */
    public static NutexbFile cube(String name, NutexbFormat format) {
        return new NutexbFile(name, 64, 64, 1, 6, 1, format);
    }

    /**
     * Depth and cube map textures are assumed to have no array layers.
     */
    public TextureDimension dimension() {
        if (depth > 1) {
            return TextureDimension.TEXTURE_3D;
        }
        if (layerCount == 6) {
            return TextureDimension.TEXTURE_CUBE;
        }
        return TextureDimension.TEXTURE_2D;
    }
}
