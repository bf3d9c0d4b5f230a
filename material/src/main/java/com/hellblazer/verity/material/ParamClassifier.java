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

import com.hellblazer.verity.model.MaterialParam;
import com.hellblazer.verity.model.ParamId;
import com.hellblazer.verity.model.TextureDimension;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.hellblazer.verity.model.ParamId.*;

/**
 * Static classification of parameter ids.
 *
 * @author hal.hildebrand
 */
public final class ParamClassifier {

    public static final String DEFAULT_WHITE   = "/common/shader/sfxpbs/default_white";
    public static final String DEFAULT_BLACK   = "/common/shader/sfxpbs/default_black";
    public static final String DEFAULT_NORMAL  = "/common/shader/sfxpbs/fighter/default_normal";
    public static final String DEFAULT_PARAMS  = "/common/shader/sfxpbs/fighter/default_params";
    public static final String REPLACE_CUBEMAP = "#replace_cubemap";

    /**
     * Orders parameters ascending by numeric code.
     */
    public static final Comparator<MaterialParam<?>> BY_CODE = Comparator.comparingInt(p -> p.paramId().code());

    private static final Map<ParamId, ParamKind> KINDS;
    private static final Set<ParamId>            CUBE_MAPS    = EnumSet.of(TEXTURE2, TEXTURE7, TEXTURE8);
    private static final Set<ParamId>            LINEAR_SLOTS = EnumSet.of(TEXTURE2, TEXTURE4, TEXTURE6, TEXTURE7,
                                                                           TEXTURE16);
    private static final Set<ParamId>            BLACK_SLOTS  = EnumSet.of(TEXTURE5, TEXTURE9, TEXTURE14);

    static {
        var kinds = new EnumMap<ParamId, ParamKind>(ParamId.class);
        for (var id : ParamId.values()) {
            kinds.put(id, ParamKind.OTHER);
        }
        put(kinds, ParamKind.BOOLEAN, EnumSet.range(CUSTOM_BOOLEAN0, CUSTOM_BOOLEAN19));
        put(kinds, ParamKind.FLOAT, EnumSet.range(CUSTOM_FLOAT0, CUSTOM_FLOAT19));
        put(kinds, ParamKind.VECTOR4, EnumSet.range(CUSTOM_VECTOR0, CUSTOM_VECTOR19));
        put(kinds, ParamKind.VECTOR4, EnumSet.range(CUSTOM_VECTOR20, CUSTOM_VECTOR63));
        put(kinds, ParamKind.TEXTURE, EnumSet.range(TEXTURE0, TEXTURE14));
        put(kinds, ParamKind.TEXTURE, EnumSet.range(TEXTURE15, TEXTURE19));
        put(kinds, ParamKind.SAMPLER, EnumSet.range(SAMPLER0, SAMPLER14));
        put(kinds, ParamKind.SAMPLER, EnumSet.range(SAMPLER15, SAMPLER19));
        put(kinds, ParamKind.BLEND_STATE, EnumSet.range(BLEND_STATE0, BLEND_STATE10));
        put(kinds, ParamKind.RASTERIZER_STATE, EnumSet.range(RASTERIZER_STATE0, RASTERIZER_STATE10));
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private ParamClassifier() {
    }

    /**
     * The placeholder texture closest to having no effect in the given slot: white for color and mask slots, black
     * for emissive and baked lighting slots, a flat normal map, neutral PRM params, or the cube map replacement
     * token for environment slots. Non texture ids get white.
     */
    public static String defaultTexture(ParamId id) {
        if (CUBE_MAPS.contains(id)) {
            return REPLACE_CUBEMAP;
        }
        if (BLACK_SLOTS.contains(id)) {
            return DEFAULT_BLACK;
        }
        if (id == TEXTURE4) {
            return DEFAULT_NORMAL;
        }
        if (id == TEXTURE6) {
            return DEFAULT_PARAMS;
        }
        return DEFAULT_WHITE;
    }

    /**
     * Every distinct placeholder texture name, sorted.
     */
    public static Set<String> defaultTextureNames() {
        var names = new TreeSet<String>();
        for (var id : KINDS.keySet()) {
            if (isTexture(id)) {
                names.add(defaultTexture(id));
            }
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Cube map for the environment slots, 2D for every other texture slot.
     */
    public static TextureDimension expectedDimension(ParamId id) {
        return CUBE_MAPS.contains(id) ? TextureDimension.TEXTURE_CUBE : TextureDimension.TEXTURE_2D;
    }

    /**
     * Whether a texture in this slot holds color data. Normal maps, PRM maps and the linear lighting slots must use
     * a non sRGB format.
     */
    public static boolean expectsSrgb(ParamId id) {
        return !LINEAR_SLOTS.contains(id);
    }

    public static boolean isTexture(ParamId id) {
        return kindOf(id) == ParamKind.TEXTURE;
    }

    public static ParamKind kindOf(ParamId id) {
        if (id == null) {
            return ParamKind.OTHER;
        }
        return KINDS.get(id);
    }

    private static void put(Map<ParamId, ParamKind> kinds, ParamKind kind, Set<ParamId> ids) {
        ids.forEach(id -> kinds.put(id, kind));
    }
}
