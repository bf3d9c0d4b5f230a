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

import com.hellblazer.verity.material.ParamClassifier;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Selects the checks a {@link ConsistencyValidator} runs.
 *
 * @param checkMeshSubIndices     report mesh objects repeating the sub-index of an object with the same name
 * @param checkRequiredAttributes report meshes lacking vertex attributes the shader of a bound material reads
 * @param checkTextureFormats     report textures whose color space does not match the parameter
 * @param checkTextureDimensions  report 2D textures in cube map slots and the reverse
 * @param checkTextureAssignments report texture names with no texture file and no default texture
 * @param checkRenormalAdjacency  report RENORMAL materials lacking adjacency data
 * @param checkModelBindings      report bindings naming a missing mesh object or material
 * @param defaultTextureNames     texture names the renderer provides without a texture file
 * @author hal.hildebrand
 */
public record ValidationConfiguration(boolean checkMeshSubIndices, boolean checkRequiredAttributes,
                                      boolean checkTextureFormats, boolean checkTextureDimensions,
                                      boolean checkTextureAssignments, boolean checkRenormalAdjacency,
                                      boolean checkModelBindings, Set<String> defaultTextureNames) {

    public ValidationConfiguration {
        defaultTextureNames = Set.copyOf(Objects.requireNonNull(defaultTextureNames, "defaultTextureNames"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Every check, with the built-in default textures.
     */
    public static ValidationConfiguration defaultConfig() {
        return new Builder().build();
    }

    /**
     * Only the checks of material textures, for validating a material file edited outside of its model folder.
     */
    public static ValidationConfiguration materialOnlyConfig() {
        return new Builder().withMeshSubIndices(false)
                            .withRequiredAttributes(false)
                            .withRenormalAdjacency(false)
                            .withModelBindings(false)
                            .build();
    }

    public Builder toBuilder() {
        return new Builder().withMeshSubIndices(checkMeshSubIndices)
                            .withRequiredAttributes(checkRequiredAttributes)
                            .withTextureFormats(checkTextureFormats)
                            .withTextureDimensions(checkTextureDimensions)
                            .withTextureAssignments(checkTextureAssignments)
                            .withRenormalAdjacency(checkRenormalAdjacency)
                            .withModelBindings(checkModelBindings)
                            .withDefaultTextureNames(defaultTextureNames);
    }

    public static class Builder {
        private boolean            meshSubIndices      = true;
        private boolean            requiredAttributes  = true;
        private boolean            textureFormats      = true;
        private boolean            textureDimensions   = true;
        private boolean            textureAssignments  = true;
        private boolean            renormalAdjacency   = true;
        private boolean            modelBindings       = true;
        private Collection<String> defaultTextureNames = ParamClassifier.defaultTextureNames();

        public ValidationConfiguration build() {
            for (var name : defaultTextureNames) {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("Default texture names must not be blank");
                }
            }
            return new ValidationConfiguration(meshSubIndices, requiredAttributes, textureFormats, textureDimensions,
                                               textureAssignments, renormalAdjacency, modelBindings,
                                               Set.copyOf(defaultTextureNames));
        }

        public Builder withDefaultTextureNames(Collection<String> names) {
            this.defaultTextureNames = Objects.requireNonNull(names, "names");
            return this;
        }

        public Builder withMeshSubIndices(boolean check) {
            this.meshSubIndices = check;
            return this;
        }

        public Builder withModelBindings(boolean check) {
            this.modelBindings = check;
            return this;
        }

        public Builder withRenormalAdjacency(boolean check) {
            this.renormalAdjacency = check;
            return this;
        }

        public Builder withRequiredAttributes(boolean check) {
            this.requiredAttributes = check;
            return this;
        }

        public Builder withTextureAssignments(boolean check) {
            this.textureAssignments = check;
            return this;
        }

        public Builder withTextureDimensions(boolean check) {
            this.textureDimensions = check;
            return this;
        }

        public Builder withTextureFormats(boolean check) {
            this.textureFormats = check;
            return this;
        }
    }
}
