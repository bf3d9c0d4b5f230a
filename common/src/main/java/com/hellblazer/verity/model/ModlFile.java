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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed model binding file ({@code model.numdlb}). The entry list is edited in place.
 *
 * @author hal.hildebrand
 */
public class ModlFile {
    private final String          modelName;
    private final String          skeletonFileName;
    private final List<String>    materialFileNames;
    private final String          animationFileName;
    private final String          meshFileName;
    private final List<ModlEntry> entries;

    public ModlFile(List<ModlEntry> entries) {
        this("model", FileKind.SKEL.modelFileName().orElseThrow(), List.of(FileKind.MATL.modelFileName().orElseThrow()),
             null, FileKind.MESH.modelFileName().orElseThrow(), entries);
    }

    public ModlFile(String modelName, String skeletonFileName, List<String> materialFileNames,
                    String animationFileName, String meshFileName, List<ModlEntry> entries) {
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.skeletonFileName = Objects.requireNonNull(skeletonFileName, "skeletonFileName");
        this.materialFileNames = List.copyOf(materialFileNames);
        this.animationFileName = animationFileName;
        this.meshFileName = Objects.requireNonNull(meshFileName, "meshFileName");
        this.entries = new ArrayList<>(entries);
    }

    public Optional<String> animationFileName() {
        return Optional.ofNullable(animationFileName);
    }

    public List<ModlEntry> entries() {
        return entries;
    }

    public List<String> materialFileNames() {
        return materialFileNames;
    }

    public String meshFileName() {
        return meshFileName;
    }

    public String modelName() {
        return modelName;
    }

    public String skeletonFileName() {
        return skeletonFileName;
    }
}
