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

import static com.hellblazer.verity.validation.Messages.quote;

/**
 * Diagnostics reported against {@code model.numdlb}, associated with binding entries by index.
 *
 * @author hal.hildebrand
 */
public sealed interface ModlDiagnostic extends Diagnostic
permits ModlDiagnostic.InvalidMeshObject, ModlDiagnostic.InvalidMaterial {

    int entryIndex();

    @Override
    default FileKind fileKind() {
        return FileKind.MODL;
    }

    /**
     * The binding names a mesh object not found in {@code model.numshb}.
     */
    record InvalidMeshObject(int entryIndex, String meshObjectName, long meshObjectSubIndex)
    implements ModlDiagnostic {
        @Override
        public String message() {
            return "Mesh object " + quote(meshObjectName) + " with subindex " + meshObjectSubIndex
            + " does not exist in the model.numshb.";
        }
    }

    /**
     * The binding names a material label not found in {@code model.numatb}.
     */
    record InvalidMaterial(int entryIndex, String materialLabel) implements ModlDiagnostic {
        @Override
        public String message() {
            return "Material " + quote(materialLabel) + " does not exist in the model.numatb.";
        }
    }
}
