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

import java.util.Optional;

/**
 * The kinds of file found in a model folder.
 *
 * @author hal.hildebrand
 */
public enum FileKind {
    MESH("numshb", "model.numshb"),
    SKEL("nusktb", "model.nusktb"),
    MATL("numatb", "model.numatb"),
    MODL("numdlb", "model.numdlb"),
    ADJ("adjb", "model.adjb"),
    ANIM("nuanmb", null),
    HLPB("nuhlpb", "model.nuhlpb"),
    MESHEX("numshexb", "model.numshexb"),
    NUTEXB("nutexb", null);

    private final String extension;
    private final String modelFileName;

    FileKind(String extension, String modelFileName) {
        this.extension = extension;
        this.modelFileName = modelFileName;
    }

    public String extension() {
        return extension;
    }

    /**
     * The file name the model uses for this kind, e.g. {@code model.numatb}. Animations and textures have no single
     * well-known name.
     */
    public Optional<String> modelFileName() {
        return Optional.ofNullable(modelFileName);
    }
}
