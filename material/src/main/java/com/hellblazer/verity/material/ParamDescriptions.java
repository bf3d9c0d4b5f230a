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

import com.hellblazer.verity.model.ParamId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.hellblazer.verity.model.ParamId.*;

/**
 * Human readable names for parameters shown next to the raw parameter labels in the material editor.
 *
 * @author hal.hildebrand
 */
public final class ParamDescriptions {

    private static final List<String> XYZW       = List.of("X", "Y", "Z", "W");
    private static final List<String> RGBA       = List.of("R", "G", "B", "A");
    private static final List<String> RGBA_LONG  = List.of("Red", "Green", "Blue", "Alpha");
    private static final List<String> UV_LONG    = List.of("Scale U", "Scale V", "Translate U", "Translate V");
    private static final Set<ParamId> COLOR_VECTORS;

    private static final Map<ParamId, String>       DESCRIPTIONS;
    private static final Map<ParamId, List<String>> LONG_LABELS;

    static {
        COLOR_VECTORS = Collections.unmodifiableSet(
        EnumSet.of(CUSTOM_VECTOR1, CUSTOM_VECTOR2, CUSTOM_VECTOR3, CUSTOM_VECTOR5, CUSTOM_VECTOR7, CUSTOM_VECTOR8,
                   CUSTOM_VECTOR9, CUSTOM_VECTOR10, CUSTOM_VECTOR13, CUSTOM_VECTOR15, CUSTOM_VECTOR19,
                   CUSTOM_VECTOR20, CUSTOM_VECTOR21, CUSTOM_VECTOR22, CUSTOM_VECTOR23, CUSTOM_VECTOR24,
                   CUSTOM_VECTOR35, CUSTOM_VECTOR43, CUSTOM_VECTOR44, CUSTOM_VECTOR45));

        var descriptions = new EnumMap<ParamId, String>(ParamId.class);
        descriptions.put(CUSTOM_VECTOR0, "Alpha Params");
        descriptions.put(CUSTOM_VECTOR3, "Emission Color Scale");
        descriptions.put(CUSTOM_VECTOR6, "UV Transform Layer 1");
        descriptions.put(CUSTOM_VECTOR8, "Final Color Scale");
        descriptions.put(CUSTOM_VECTOR11, "Subsurface Color");
        descriptions.put(CUSTOM_VECTOR13, "Diffuse Color Scale");
        descriptions.put(CUSTOM_VECTOR14, "Rim Color");
        descriptions.put(CUSTOM_VECTOR18, "Sprite Sheet Params");
        descriptions.put(CUSTOM_VECTOR30, "Subsurface Params");
        descriptions.put(CUSTOM_VECTOR31, "UV Transform Layer 2");
        descriptions.put(CUSTOM_VECTOR32, "UV Transform Layer 3");
        descriptions.put(CUSTOM_VECTOR47, "Prm Color");
        descriptions.put(TEXTURE0, "Col Layer 1");
        descriptions.put(TEXTURE1, "Col Layer 2");
        descriptions.put(TEXTURE2, "Irradiance Cube");
        descriptions.put(TEXTURE3, "Ambient Occlusion");
        descriptions.put(TEXTURE4, "Nor");
        descriptions.put(TEXTURE5, "Emissive Layer 1");
        descriptions.put(TEXTURE6, "Prm");
        descriptions.put(TEXTURE7, "Specular Cube");
        descriptions.put(TEXTURE8, "Diffuse Cube");
        descriptions.put(TEXTURE9, "Baked Lighting");
        descriptions.put(TEXTURE10, "Diffuse Layer 1");
        descriptions.put(TEXTURE11, "Diffuse Layer 2");
        descriptions.put(TEXTURE12, "Diffuse Layer 3");
        descriptions.put(TEXTURE14, "Emissive Layer 2");
        descriptions.put(CUSTOM_FLOAT1, "Ambient Occlusion Map Intensity");
        descriptions.put(CUSTOM_FLOAT10, "Anisotropy");
        descriptions.put(CUSTOM_BOOLEAN1, "PRM Alpha");
        descriptions.put(CUSTOM_BOOLEAN2, "Alpha Override");
        descriptions.put(CUSTOM_BOOLEAN3, "Direct Specular");
        descriptions.put(CUSTOM_BOOLEAN4, "Indirect Specular");
        descriptions.put(CUSTOM_BOOLEAN9, "Sprite Sheet");
        DESCRIPTIONS = Collections.unmodifiableMap(descriptions);

        var longLabels = new EnumMap<ParamId, List<String>>(ParamId.class);
        longLabels.put(CUSTOM_VECTOR0, List.of("Min Texture Alpha", "Y", "Z", "W"));
        longLabels.put(CUSTOM_VECTOR6, UV_LONG);
        longLabels.put(CUSTOM_VECTOR31, UV_LONG);
        longLabels.put(CUSTOM_VECTOR32, UV_LONG);
        longLabels.put(CUSTOM_VECTOR11, List.of("Red", "Green", "Blue", ""));
        longLabels.put(CUSTOM_VECTOR14, List.of("Red", "Green", "Blue", "Blend Factor"));
        longLabels.put(CUSTOM_VECTOR18, List.of("Column Count", "Row Count", "Frames per Sprite", "Sprite Count"));
        longLabels.put(CUSTOM_VECTOR30, List.of("Blend Factor", "Smooth Factor", "", ""));
        longLabels.put(CUSTOM_VECTOR47, List.of("Metalness", "Roughness", "Ambient Occlusion", "Specular"));
        LONG_LABELS = Collections.unmodifiableMap(longLabels);
    }

    private ParamDescriptions() {
    }

    /**
     * Description of the parameter, or the empty string when it has none.
     */
    public static String description(ParamId id) {
        return DESCRIPTIONS.getOrDefault(id, "");
    }

    /**
     * Component names for the editor's tooltips, e.g. {@code Metalness} for the x component of
     * {@code CustomVector47}.
     */
    public static List<String> vectorLabelsLong(ParamId id) {
        if (COLOR_VECTORS.contains(id)) {
            return RGBA_LONG;
        }
        return LONG_LABELS.getOrDefault(id, XYZW);
    }

    /**
     * Single letter component names.
     */
    public static List<String> vectorLabelsShort(ParamId id) {
        if (COLOR_VECTORS.contains(id) || id == CUSTOM_VECTOR11 || id == CUSTOM_VECTOR14) {
            return RGBA;
        }
        return XYZW;
    }
}
