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

import java.util.List;

import static com.hellblazer.verity.validation.Messages.quote;

/**
 * Diagnostics reported against {@code model.numshb}. Mesh object names are not unique, so diagnostics are
 * associated with mesh objects by index.
 *
 * @author hal.hildebrand
 */
public sealed interface MeshDiagnostic extends Diagnostic
permits MeshDiagnostic.MissingRequiredAttributes, MeshDiagnostic.DuplicateSubIndex {

    @Override
    default FileKind fileKind() {
        return FileKind.MESH;
    }

    int meshObjectIndex();

    /**
     * The mesh object lacks vertex attributes the shader of an assigned material reads.
     */
    record MissingRequiredAttributes(int meshObjectIndex, String meshName, String materialLabel,
                                     List<String> missingAttributes) implements MeshDiagnostic {
        public MissingRequiredAttributes {
            missingAttributes = List.copyOf(missingAttributes);
        }

        @Override
        public String message() {
            return "Mesh " + quote(meshName) + " is missing attributes " + String.join(", ", missingAttributes)
            + " required by assigned material " + quote(materialLabel) + ".";
        }
    }

    /**
     * A mesh object repeats the sub-index of an earlier object with the same name, so bindings and vertex weights
     * cannot tell them apart.
     */
    record DuplicateSubIndex(int meshObjectIndex, String meshName, long subIndex) implements MeshDiagnostic {
        @Override
        public String message() {
            return "Mesh " + quote(meshName) + " repeats subindex " + subIndex + ". Subindices must be unique.";
        }
    }
}
