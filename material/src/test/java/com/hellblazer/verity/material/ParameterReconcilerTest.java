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
import org.junit.jupiter.api.Test;

import javax.vecmath.Vector4f;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParameterReconciler
 */
public class ParameterReconcilerTest {

    private static ShaderProgram program(String... params) {
        return new ShaderProgram(false, List.of(), List.of(params));
    }

    @Test
    void testAddAllMissing() {
        var entry = new MaterialEntry("", "");
        var program = program("BlendState0", "CustomFloat0", "CustomBoolean0", "CustomVector0", "RasterizerState0",
                              "Sampler0", "Texture0");

        var missing = ParameterReconciler.missing(entry, program);
        assertEquals(List.of(ParamId.BLEND_STATE0, ParamId.CUSTOM_FLOAT0, ParamId.CUSTOM_BOOLEAN0,
                             ParamId.CUSTOM_VECTOR0, ParamId.RASTERIZER_STATE0, ParamId.SAMPLER0, ParamId.TEXTURE0),
                     missing);

        assertEquals(7, ParameterReconciler.add(entry, missing));

        assertEquals(List.of(MaterialParam.of(ParamId.BLEND_STATE0, BlendStateData.defaults())), entry.blendStates());
        assertEquals(List.of(MaterialParam.of(ParamId.CUSTOM_FLOAT0, 0.0f)), entry.floats());
        assertEquals(List.of(MaterialParam.of(ParamId.CUSTOM_BOOLEAN0, false)), entry.booleans());
        assertEquals(List.of(MaterialParam.of(ParamId.CUSTOM_VECTOR0, new Vector4f())), entry.vectors());
        assertEquals(List.of(MaterialParam.of(ParamId.RASTERIZER_STATE0, RasterizerStateData.defaults())),
                     entry.rasterizerStates());
        assertEquals(List.of(MaterialParam.of(ParamId.SAMPLER0, SamplerData.defaults())), entry.samplers());
        assertEquals(List.of(MaterialParam.of(ParamId.TEXTURE0, "/common/shader/sfxpbs/default_white")),
                     entry.textures());
        assertTrue(ParameterReconciler.missing(entry, program).isEmpty());
    }

    @Test
    void testMissingUsesDeclaredOrderAndStripsChannels() {
        var entry = new MaterialEntry("a", "");
        entry.vectors().add(MaterialParam.of(ParamId.CUSTOM_VECTOR13, new Vector4f()));
        var program = program("Texture4", "CustomVector13", "CustomVector0.x", "Texture0", "UvTransform0");

        assertEquals(List.of(ParamId.TEXTURE4, ParamId.CUSTOM_VECTOR0, ParamId.TEXTURE0),
                     ParameterReconciler.missing(entry, program));
    }

    @Test
    void testAddSortsByCode() {
        var entry = new MaterialEntry("a", "");
        ParameterReconciler.add(entry, List.of(ParamId.TEXTURE15, ParamId.TEXTURE4, ParamId.TEXTURE0,
                                               ParamId.CUSTOM_VECTOR47, ParamId.CUSTOM_VECTOR8));

        assertEquals(List.of(ParamId.TEXTURE0, ParamId.TEXTURE4, ParamId.TEXTURE15),
                     entry.textures().stream().map(MaterialParam::paramId).toList());
        assertEquals(List.of(ParamId.CUSTOM_VECTOR8, ParamId.CUSTOM_VECTOR47),
                     entry.vectors().stream().map(MaterialParam::paramId).toList());
        assertEquals("/common/shader/sfxpbs/fighter/default_normal", entry.textures().get(1).data());
    }

    @Test
    void testAddSkipsPresentAndOtherIds() {
        var entry = new MaterialEntry("a", "");
        entry.floats().add(MaterialParam.of(ParamId.CUSTOM_FLOAT8, 0.4f));

        var ids = List.of(ParamId.CUSTOM_FLOAT8, ParamId.DIFFUSE, ParamId.CUSTOM_FLOAT1, ParamId.CUSTOM_FLOAT1);
        assertEquals(1, ParameterReconciler.add(entry, ids));
        assertEquals(List.of(MaterialParam.of(ParamId.CUSTOM_FLOAT1, 0.0f), MaterialParam.of(ParamId.CUSTOM_FLOAT8, 0.4f)),
                     entry.floats());
    }

    @Test
    void testRemoveAllUnused() {
        var entry = new MaterialEntry("", "");
        ParameterReconciler.add(entry, List.of(ParamId.BLEND_STATE0, ParamId.CUSTOM_FLOAT0, ParamId.CUSTOM_BOOLEAN0,
                                               ParamId.CUSTOM_VECTOR0, ParamId.RASTERIZER_STATE0, ParamId.SAMPLER0,
                                               ParamId.TEXTURE0));
        var program = program();

        var unused = ParameterReconciler.unused(entry, program);
        assertEquals(List.of(ParamId.CUSTOM_BOOLEAN0, ParamId.CUSTOM_FLOAT0, ParamId.CUSTOM_VECTOR0,
                             ParamId.TEXTURE0, ParamId.SAMPLER0, ParamId.BLEND_STATE0, ParamId.RASTERIZER_STATE0),
                     unused);

        assertEquals(7, ParameterReconciler.remove(entry, unused));
        assertEquals(0, entry.paramIds().count());
        assertTrue(ParameterReconciler.unused(entry, program).isEmpty());
    }

    @Test
    void testRemoveKeepsOrder() {
        var entry = new MaterialEntry("a", "");
        ParameterReconciler.add(entry, List.of(ParamId.TEXTURE0, ParamId.TEXTURE1, ParamId.TEXTURE4, ParamId.TEXTURE6,
                                               ParamId.TEXTURE7));

        assertEquals(2, ParameterReconciler.remove(entry, List.of(ParamId.TEXTURE1, ParamId.TEXTURE19,
                                                                  ParamId.TEXTURE4)));
        assertEquals(List.of(ParamId.TEXTURE0, ParamId.TEXTURE6, ParamId.TEXTURE7),
                     entry.textures().stream().map(MaterialParam::paramId).toList());
    }

    @Test
    void testUnusedIgnoresChannelMask() {
        var entry = new MaterialEntry("a", "");
        ParameterReconciler.add(entry, List.of(ParamId.CUSTOM_VECTOR0, ParamId.CUSTOM_VECTOR47));

        assertEquals(List.of(ParamId.CUSTOM_VECTOR47),
                     ParameterReconciler.unused(entry, program("CustomVector0.x", "CustomVector4.xyz")));
    }

    @Test
    void testStoredOtherIdsAreLeftAlone() {
        var entry = new MaterialEntry("a", "");
        entry.floats().add(MaterialParam.of(ParamId.DIFFUSE, 1.0f));
        entry.floats().add(MaterialParam.of(ParamId.CUSTOM_FLOAT8, 0.4f));
        var before = entry.copy();

        assertEquals(List.of(ParamId.CUSTOM_FLOAT8), ParameterReconciler.unused(entry, program()));
        assertEquals(0, ParameterReconciler.remove(entry, List.of(ParamId.DIFFUSE)));
        assertEquals(before, entry);

        assertEquals(1, ParameterReconciler.remove(entry, ParameterReconciler.unused(entry, program())));
        assertEquals(List.of(MaterialParam.of(ParamId.DIFFUSE, 1.0f)), entry.floats());
        assertTrue(ParameterReconciler.unused(entry, program()).isEmpty());
    }
}
