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
package com.hellblazer.verity.folder;

import com.hellblazer.verity.model.MaterialEntry;
import com.hellblazer.verity.model.MatlFile;
import com.hellblazer.verity.model.MeshFile;
import com.hellblazer.verity.model.MeshObject;
import com.hellblazer.verity.model.ModlEntry;
import com.hellblazer.verity.model.ModlFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Edits to the model binding file that keep it consistent with the mesh and material files.
 *
 * @author hal.hildebrand
 */
public final class ModelBindingRepair {
    public static final String PLACEHOLDER = "PLACEHOLDER";

    private static final Logger log = LoggerFactory.getLogger(ModelBindingRepair.class);

    private ModelBindingRepair() {
    }

    /**
     * Bind every unbound mesh object so it becomes visible. The material is arbitrary: the first material of the
     * material file, or {@value #PLACEHOLDER} when there is none.
     *
     * @return the number of bindings added
     */
    public static int addMissingEntries(ModlFile modl, MeshFile mesh, Optional<MatlFile> matl) {
        var missing = missingEntries(modl, mesh);
        var label = matl.flatMap(m -> m.entries().stream().findFirst())
                        .map(MaterialEntry::getMaterialLabel)
                        .orElse(PLACEHOLDER);
        for (var object : missing) {
            modl.entries().add(new ModlEntry(object.name(), object.subIndex(), label));
        }
        log.debug("Bound {} mesh objects to {}", missing.size(), label);
        return missing.size();
    }

    /**
     * Mesh objects with no binding, in mesh order.
     */
    public static List<MeshObject> missingEntries(ModlFile modl, MeshFile mesh) {
        return mesh.objects()
                   .stream()
                   .filter(object -> modl.entries().stream().noneMatch(e -> e.binds(object)))
                   .toList();
    }

    /**
     * Point the bindings of a renamed material at its new label.
     *
     * @return the number of bindings updated
     */
    public static int renameMaterial(ModlFile modl, String oldLabel, String newLabel) {
        Objects.requireNonNull(newLabel, "newLabel");
        int renamed = 0;
        var entries = modl.entries();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).materialLabel().equals(oldLabel)) {
                entries.set(i, entries.get(i).withMaterialLabel(newLabel));
                renamed++;
            }
        }
        return renamed;
    }
}
