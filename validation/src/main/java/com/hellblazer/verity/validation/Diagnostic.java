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

/**
 * One inconsistency found between the files of a model folder. Diagnostics are advisory: they drive highlighting in
 * the file editors and never prevent a file from being saved.
 *
 * <p>Each diagnostic belongs to the file it should be reported against. A single problem may produce diagnostics
 * for several files, e.g. a mesh missing attributes required by its material is reported on both the mesh and the
 * material.
 *
 * @author hal.hildebrand
 */
public sealed interface Diagnostic permits MeshDiagnostic, MatlDiagnostic, ModlDiagnostic, AdjDiagnostic,
                                           NutexbDiagnostic {

    /**
     * The kind of file this diagnostic is reported against.
     */
    FileKind fileKind();

    /**
     * A human readable description suitable for a tooltip.
     */
    String message();
}
