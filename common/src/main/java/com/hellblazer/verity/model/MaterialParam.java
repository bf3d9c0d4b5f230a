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
 * One {@code (ParamId, value)} pair stored in a material entry.
 *
 * @param paramId the parameter slot
 * @param data    the stored value
 * @param <T>     value type of the parameter kind
 * @author hal.hildebrand
 */
public record MaterialParam<T>(ParamId paramId, T data) {
    public MaterialParam {
        Objects.requireNonNull(paramId, "paramId");
        Objects.requireNonNull(data, "data");
    }

    public static <T> MaterialParam<T> of(ParamId paramId, T data) {
        return new MaterialParam<>(paramId, data);
    }
}
