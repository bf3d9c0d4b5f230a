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
package com.hellblazer.verity.shader;

import com.hellblazer.verity.model.ParamId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ShaderProgram
 */
public class ShaderProgramTest {

    private final ShaderProgram program = new ShaderProgram(false,
                                                            List.of("Position0", "Normal0", "Tangent0", "map1.xy",
                                                                    "uvSet.xy", "colorSet1"),
                                                            List.of("CustomVector0.x", "CustomVector47.xyz",
                                                                    "CustomVector13", "Texture0", "NotAParameter",
                                                                    "Texture0", "CustomVector8.rgb"));

    @Test
    void testAccessedChannelsWithMask() {
        assertArrayEquals(new boolean[] { true, false, false, false }, program.accessedChannels(ParamId.CUSTOM_VECTOR0));
        assertArrayEquals(new boolean[] { true, true, true, false },
                          program.accessedChannels(ParamId.CUSTOM_VECTOR47));
    }

    @Test
    void testAccessedChannelsColorMask() {
        assertArrayEquals(new boolean[] { true, true, true, false }, program.accessedChannels(ParamId.CUSTOM_VECTOR8));
    }

    @Test
    void testAccessedChannelsWithoutMask() {
        assertArrayEquals(new boolean[] { true, true, true, true }, program.accessedChannels(ParamId.CUSTOM_VECTOR13));
    }

    @Test
    void testAccessedChannelsUndeclared() {
        assertArrayEquals(new boolean[4], program.accessedChannels(ParamId.CUSTOM_VECTOR3));
    }

    @Test
    void testMaterialParameterIds() {
        assertEquals(List.of(ParamId.CUSTOM_VECTOR0, ParamId.CUSTOM_VECTOR47, ParamId.CUSTOM_VECTOR13,
                             ParamId.TEXTURE0, ParamId.CUSTOM_VECTOR8), program.materialParameterIds());
    }

    @Test
    void testRequiredAttributesSkipImplicit() {
        assertEquals(List.of("map1", "uvSet", "colorSet1"), program.requiredAttributeNames());
    }

    @Test
    void testMissingRequiredAttributes() {
        assertEquals(List.of("map1", "uvSet", "colorSet1"), program.missingRequiredAttributes(List.of()));
        assertEquals(List.of("uvSet"), program.missingRequiredAttributes(List.of("map1", "colorSet1", "bake1")));
        assertTrue(program.missingRequiredAttributes(List.of("colorSet1", "uvSet", "map1")).isEmpty());
    }

    @Test
    void testRequiresParameter() {
        assertTrue(program.requiresParameter(ParamId.CUSTOM_VECTOR47));
        assertFalse(program.requiresParameter(ParamId.TEXTURE4));
    }

    @Test
    void testListsAreImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> program.materialParameters().add("Texture4"));
    }
}
