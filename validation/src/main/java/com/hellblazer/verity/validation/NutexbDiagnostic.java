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
package com.hellblazer.verity.validation;

import com.hellblazer.verity.model.FileKind;
import com.hellblazer.verity.model.NutexbFormat;
import com.hellblazer.verity.model.ParamId;

import static com.hellblazer.verity.validation.Messages.quote;
import static com.hellblazer.verity.validation.Messages.srgbExpectation;

/**
 * Diagnostics reported against texture files, associated by file name.
 *
 * @author hal.hildebrand
 */
public sealed interface NutexbDiagnostic extends Diagnostic permits NutexbDiagnostic.FormatInvalidForUsage {

    @Override
    default FileKind fileKind() {
        return FileKind.NUTEXB;
    }

    String textureName();

    record FormatInvalidForUsage(String textureName, NutexbFormat format, ParamId param) implements NutexbDiagnostic {
        @Override
        public String message() {
            return "Texture " + quote(textureName) + " has format " + format + ", but " + param + " "
            + srgbExpectation(param) + " an sRGB format.";
        }
    }
}
