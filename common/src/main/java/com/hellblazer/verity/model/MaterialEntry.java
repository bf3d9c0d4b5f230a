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

import javax.vecmath.Vector4f;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One material of a material file. Parameters are held in seven lists, one per parameter kind. The lists are live
 * and are edited in place by the material editor and by parameter reconciliation; within each list parameter ids
 * are unique and kept sorted ascending by {@link ParamId#code()}.
 *
 * @author hal.hildebrand
 */
public class MaterialEntry {

    private final List<MaterialParam<Boolean>>             booleans         = new ArrayList<>();
    private final List<MaterialParam<Float>>               floats           = new ArrayList<>();
    private final List<MaterialParam<Vector4f>>            vectors          = new ArrayList<>();
    private final List<MaterialParam<String>>              textures         = new ArrayList<>();
    private final List<MaterialParam<SamplerData>>         samplers         = new ArrayList<>();
    private final List<MaterialParam<BlendStateData>>      blendStates      = new ArrayList<>();
    private final List<MaterialParam<RasterizerStateData>> rasterizerStates = new ArrayList<>();
    private       String                                   materialLabel;
    private       String                                   shaderLabel;

    public MaterialEntry(String materialLabel, String shaderLabel) {
        this.materialLabel = Objects.requireNonNull(materialLabel, "materialLabel");
        this.shaderLabel = Objects.requireNonNull(shaderLabel, "shaderLabel");
    }

    public List<MaterialParam<BlendStateData>> blendStates() {
        return blendStates;
    }

    public List<MaterialParam<Boolean>> booleans() {
        return booleans;
    }

    public boolean contains(ParamId paramId) {
        return paramIds().anyMatch(p -> p == paramId);
    }

    /**
     * Deep copy, including the vector values.
     */
    public MaterialEntry copy() {
        var copy = new MaterialEntry(materialLabel, shaderLabel);
        copy.booleans.addAll(booleans);
        copy.floats.addAll(floats);
        vectors.forEach(v -> copy.vectors.add(MaterialParam.of(v.paramId(), new Vector4f(v.data()))));
        copy.textures.addAll(textures);
        copy.samplers.addAll(samplers);
        copy.blendStates.addAll(blendStates);
        copy.rasterizerStates.addAll(rasterizerStates);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MaterialEntry other)) {
            return false;
        }
        return materialLabel.equals(other.materialLabel)
               && shaderLabel.equals(other.shaderLabel)
               && booleans.equals(other.booleans)
               && floats.equals(other.floats)
               && vectors.equals(other.vectors)
               && textures.equals(other.textures)
               && samplers.equals(other.samplers)
               && blendStates.equals(other.blendStates)
               && rasterizerStates.equals(other.rasterizerStates);
    }

    public List<MaterialParam<Float>> floats() {
        return floats;
    }

    public String getMaterialLabel() {
        return materialLabel;
    }

    public String getShaderLabel() {
        return shaderLabel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(materialLabel, shaderLabel, booleans, floats, vectors, textures, samplers, blendStates,
                            rasterizerStates);
    }

    /**
     * Every stored parameter id, list by list in the order booleans, floats, vectors, textures, samplers, blend
     * states, rasterizer states.
     */
    public Stream<ParamId> paramIds() {
        return Stream.of(booleans, floats, vectors, textures, samplers, blendStates, rasterizerStates)
                     .flatMap(List::stream)
                     .map(MaterialParam::paramId);
    }

    public List<MaterialParam<RasterizerStateData>> rasterizerStates() {
        return rasterizerStates;
    }

    public List<MaterialParam<SamplerData>> samplers() {
        return samplers;
    }

    public void setMaterialLabel(String materialLabel) {
        this.materialLabel = Objects.requireNonNull(materialLabel, "materialLabel");
    }

    public void setShaderLabel(String shaderLabel) {
        this.shaderLabel = Objects.requireNonNull(shaderLabel, "shaderLabel");
    }

    public List<MaterialParam<String>> textures() {
        return textures;
    }

    @Override
    public String toString() {
        var params = paramIds().map(ParamId::label).collect(Collectors.joining(","));
        return "MaterialEntry[" + materialLabel + ", shader=" + shaderLabel + ", params=" + params + "]";
    }

    public List<MaterialParam<Vector4f>> vectors() {
        return vectors;
    }
}
