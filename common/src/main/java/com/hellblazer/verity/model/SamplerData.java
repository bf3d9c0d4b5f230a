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

import javax.vecmath.Vector4f;
import java.util.Objects;

/**
 * Texture sampler state stored in a {@code Sampler*} parameter.
 *
 * @author hal.hildebrand
 */
public record SamplerData(WrapMode wrapS, WrapMode wrapT, WrapMode wrapR, MinFilter minFilter, MagFilter magFilter,
                          Vector4f borderColor, float lodBias, int maxAnisotropy) {

    public enum WrapMode {
        REPEAT, CLAMP_TO_EDGE, MIRRORED_REPEAT, CLAMP_TO_BORDER
    }

    public enum MinFilter {
        NEAREST, LINEAR_MIPMAP_LINEAR, LINEAR_MIPMAP_LINEAR2
    }

    public enum MagFilter {
        NEAREST, LINEAR, LINEAR2
    }

    public SamplerData {
        Objects.requireNonNull(wrapS, "wrapS");
        Objects.requireNonNull(wrapT, "wrapT");
        Objects.requireNonNull(wrapR, "wrapR");
        Objects.requireNonNull(minFilter, "minFilter");
        Objects.requireNonNull(magFilter, "magFilter");
        borderColor = new Vector4f(Objects.requireNonNull(borderColor, "borderColor"));
        if (maxAnisotropy < 1) {
            throw new IllegalArgumentException("maxAnisotropy must be at least 1: " + maxAnisotropy);
        }
    }

    /**
     * Repeat wrapping with trilinear filtering and no anisotropy.
     */
    public static SamplerData defaults() {
        return new SamplerData(WrapMode.REPEAT, WrapMode.REPEAT, WrapMode.REPEAT, MinFilter.LINEAR_MIPMAP_LINEAR,
                               MagFilter.LINEAR, new Vector4f(0.0f, 0.0f, 0.0f, 1.0f), 0.0f, 1);
    }

    @Override
    public Vector4f borderColor() {
        return new Vector4f(borderColor);
    }
}
