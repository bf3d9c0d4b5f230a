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

/**
 * Pixel formats of texture files.
 *
 * @author hal.hildebrand
 */
public enum NutexbFormat {
    R8_UNORM("R8Unorm", false),
    R8G8B8A8_UNORM("R8G8B8A8Unorm", false),
    R8G8B8A8_SRGB("R8G8B8A8Srgb", true),
    R32G32B32A32_FLOAT("R32G32B32A32Float", false),
    B8G8R8A8_UNORM("B8G8R8A8Unorm", false),
    B8G8R8A8_SRGB("B8G8R8A8Srgb", true),
    BC1_UNORM("BC1Unorm", false),
    BC1_SRGB("BC1Srgb", true),
    BC2_UNORM("BC2Unorm", false),
    BC2_SRGB("BC2Srgb", true),
    BC3_UNORM("BC3Unorm", false),
    BC3_SRGB("BC3Srgb", true),
    BC4_UNORM("BC4Unorm", false),
    BC4_SNORM("BC4Snorm", false),
    BC5_UNORM("BC5Unorm", false),
    BC5_SNORM("BC5Snorm", false),
    BC6_UFLOAT("BC6Ufloat", false),
    BC6_SFLOAT("BC6Sfloat", false),
    BC7_UNORM("BC7Unorm", false),
    BC7_SRGB("BC7Srgb", true);

    private final String  label;
    private final boolean srgb;

    NutexbFormat(String label, boolean srgb) {
        this.label = label;
        this.srgb = srgb;
    }

    /**
     * True for the sRGB-tagged variants, which the GPU decodes to linear on sampling.
     */
    public boolean isSrgb() {
        return srgb;
    }

    @Override
    public String toString() {
        return label;
    }
}
