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
 * Diagnostics reported against {@code model.adjb}.
 *
 * @author hal.hildebrand
 */
public sealed interface AdjDiagnostic extends Diagnostic permits AdjDiagnostic.MissingRenormalEntry {

    @Override
    default FileKind fileKind() {
        return FileKind.ADJ;
    }

    int meshObjectIndex();

    /**
     * A mesh object bound to a RENORMAL material has no adjacency entry.
     *
     * @param meshObjectIndex index of the mesh object in {@code model.numshb}
     */
    record MissingRenormalEntry(int meshObjectIndex, String meshName, String materialLabel) implements AdjDiagnostic {
        @Override
        public String message() {
            return "Mesh " + quote(meshName) + " has the RENORMAL material " + quote(materialLabel)
            + " but no corresponding entry in the model.adjb.";
        }
    }
}
