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
import java.util.Optional;

/**
 * A named file of a model folder and the result of parsing it. Slots are replaced wholesale on save or reload.
 *
 * @author hal.hildebrand
 */
public record FileSlot<T>(String fileName, FileResult<T> result) {
    public FileSlot {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(result, "result");
    }

    public static <T> FileSlot<T> parsed(String fileName, T data) {
        return new FileSlot<>(fileName, FileResult.parsed(data));
    }

    public static <T> FileSlot<T> failed(String fileName, String message) {
        return new FileSlot<>(fileName, FileResult.failed(new ParseException(fileName, message)));
    }

    public Optional<T> data() {
        return result.get();
    }
}
