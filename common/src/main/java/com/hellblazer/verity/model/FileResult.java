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
 * Outcome of parsing one file of a model folder.
 *
 * @param <T> parsed file type
 * @author hal.hildebrand
 */
public sealed interface FileResult<T> permits FileResult.Parsed, FileResult.Failed {

    static <T> FileResult<T> parsed(T data) {
        return new Parsed<>(data);
    }

    static <T> FileResult<T> failed(ParseException error) {
        return new Failed<>(error);
    }

    /**
     * @return the parsed data, or empty if parsing failed
     */
    Optional<T> get();

    default boolean isParsed() {
        return get().isPresent();
    }

    record Parsed<T>(T data) implements FileResult<T> {
        public Parsed {
            Objects.requireNonNull(data, "data");
        }

        @Override
        public Optional<T> get() {
            return Optional.of(data);
        }
    }

    record Failed<T>(ParseException error) implements FileResult<T> {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public Optional<T> get() {
            return Optional.empty();
        }
    }
}
