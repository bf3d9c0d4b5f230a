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
package com.hellblazer.verity.material;

import com.hellblazer.verity.model.BlendStateData;
import com.hellblazer.verity.model.MaterialEntry;
import com.hellblazer.verity.model.MaterialParam;
import com.hellblazer.verity.model.ParamId;
import com.hellblazer.verity.model.RasterizerStateData;
import com.hellblazer.verity.model.SamplerData;
import com.hellblazer.verity.shader.ShaderProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector4f;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Reconciles the parameters stored in a material entry with the parameters its shader program declares.
 *
 * <p>{@link #add} and {@link #remove} mutate the entry in place and leave every parameter list sorted ascending by
 * {@link ParamId#code()}. Neither operation fails; {@link ParamKind#OTHER} ids are ignored throughout.
 *
 * @author hal.hildebrand
 */
public final class ParameterReconciler {
    private static final Logger log = LoggerFactory.getLogger(ParameterReconciler.class);

    private ParameterReconciler() {
    }

    /**
     * Add a default valued parameter for each id. Ids already stored in the entry are left alone.
     *
     * @return the number of parameters added
     */
    public static int add(MaterialEntry entry, Collection<ParamId> ids) {
        Objects.requireNonNull(entry, "entry");
        int added = 0;
        for (var id : ids) {
            if (entry.contains(id)) {
                continue;
            }
            switch (ParamClassifier.kindOf(id)) {
                case BOOLEAN -> entry.booleans().add(MaterialParam.of(id, false));
                case FLOAT -> entry.floats().add(MaterialParam.of(id, 0.0f));
                case VECTOR4 -> entry.vectors().add(MaterialParam.of(id, new Vector4f()));
                case TEXTURE -> entry.textures().add(MaterialParam.of(id, ParamClassifier.defaultTexture(id)));
                case SAMPLER -> entry.samplers().add(MaterialParam.of(id, SamplerData.defaults()));
                case BLEND_STATE -> entry.blendStates().add(MaterialParam.of(id, BlendStateData.defaults()));
                case RASTERIZER_STATE -> entry.rasterizerStates()
                                              .add(MaterialParam.of(id, RasterizerStateData.defaults()));
                case OTHER -> {
                    continue;
                }
            }
            added++;
        }
        sort(entry);
        log.debug("Added {} parameters to {}", added, entry.getMaterialLabel());
        return added;
    }

    /**
     * Ids declared by the program but stored in none of the entry's lists, in declaration order.
     */
    public static List<ParamId> missing(MaterialEntry entry, ShaderProgram program) {
        return program.materialParameterIds()
                      .stream()
                      .filter(id -> ParamClassifier.kindOf(id) != ParamKind.OTHER)
                      .filter(id -> !entry.contains(id))
                      .toList();
    }

    /**
     * Remove each id from the entry. Ids the entry does not store are ignored, as are unclassified ids even when the
     * entry stores them.
     *
     * @return the number of parameters removed
     */
    public static int remove(MaterialEntry entry, Collection<ParamId> ids) {
        Objects.requireNonNull(entry, "entry");
        int removed = 0;
        for (var id : ids) {
            if (ParamClassifier.kindOf(id) == ParamKind.OTHER) {
                continue;
            }
            if (swapRemove(entry.blendStates(), id) || swapRemove(entry.floats(), id)
                || swapRemove(entry.booleans(), id) || swapRemove(entry.vectors(), id)
                || swapRemove(entry.rasterizerStates(), id) || swapRemove(entry.samplers(), id)
                || swapRemove(entry.textures(), id)) {
                removed++;
            }
        }
        sort(entry);
        log.debug("Removed {} parameters from {}", removed, entry.getMaterialLabel());
        return removed;
    }

    /**
     * Sort every parameter list of the entry ascending by code.
     */
    public static void sort(MaterialEntry entry) {
        entry.booleans().sort(ParamClassifier.BY_CODE);
        entry.floats().sort(ParamClassifier.BY_CODE);
        entry.vectors().sort(ParamClassifier.BY_CODE);
        entry.textures().sort(ParamClassifier.BY_CODE);
        entry.samplers().sort(ParamClassifier.BY_CODE);
        entry.blendStates().sort(ParamClassifier.BY_CODE);
        entry.rasterizerStates().sort(ParamClassifier.BY_CODE);
    }

    /**
     * Stored ids the program does not declare, in entry order. Unclassified ids are never reported.
     */
    public static List<ParamId> unused(MaterialEntry entry, ShaderProgram program) {
        return entry.paramIds()
                    .filter(id -> ParamClassifier.kindOf(id) != ParamKind.OTHER)
                    .filter(id -> !program.requiresParameter(id))
                    .toList();
    }

    // Order is restored by the caller's sort
    private static <T> boolean swapRemove(List<MaterialParam<T>> params, ParamId id) {
        for (int i = 0; i < params.size(); i++) {
            if (params.get(i).paramId() == id) {
                int last = params.size() - 1;
                params.set(i, params.get(last));
                params.remove(last);
                return true;
            }
        }
        return false;
    }
}
