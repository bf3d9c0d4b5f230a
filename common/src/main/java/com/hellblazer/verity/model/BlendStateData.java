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
 * Blend state stored in a {@code BlendState*} parameter.
 *
 * @author hal.hildebrand
 */
public record BlendStateData(BlendFactor sourceColor, BlendFactor destinationColor, boolean alphaSampleToCoverage) {

    public enum BlendFactor {
        ZERO, ONE, SOURCE_ALPHA, DESTINATION_ALPHA, SOURCE_COLOR, DESTINATION_COLOR, ONE_MINUS_SOURCE_ALPHA,
        ONE_MINUS_DESTINATION_ALPHA, ONE_MINUS_SOURCE_COLOR, ONE_MINUS_DESTINATION_COLOR, SOURCE_ALPHA_SATURATE
    }

    public BlendStateData {
        Objects.requireNonNull(sourceColor, "sourceColor");
        Objects.requireNonNull(destinationColor, "destinationColor");
    }

    /**
     * Opaque blending: source replaces destination.
     */
    public static BlendStateData defaults() {
        return new BlendStateData(BlendFactor.ONE, BlendFactor.ZERO, false);
    }
}
