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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector4f;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Material presets: complete material entries a user can apply to an existing material.
 *
 * @author hal.hildebrand
 */
public final class MaterialPresets {
    public static final String DEFAULT_RESOURCE = "/default-presets.json";
    public static final String NEW_MATERIAL     = "NEW_MATERIAL";

    private static final Logger log = LoggerFactory.getLogger(MaterialPresets.class);

    private MaterialPresets() {
    }

    /**
     * Apply a preset to an entry. The result takes everything from the preset except the material label, which is
     * kept so model bindings and material animations still match, and the texture paths of slots present in both,
     * which are specific to the model. Preset texture slots the entry lacks get the default texture.
     */
    public static MaterialEntry applyPreset(MaterialEntry entry, MaterialEntry preset) {
        var result = preset.copy();
        result.setMaterialLabel(entry.getMaterialLabel());
        result.textures().replaceAll(t -> MaterialParam.of(t.paramId(), textureOf(entry, t.paramId())));
        return result;
    }

    /**
     * A standard PRM material suitable as a starting point for new materials.
     */
    public static MaterialEntry defaultMaterial() {
        var entry = new MaterialEntry(NEW_MATERIAL, "SFX_PBS_0100000008008269_opaque");
        entry.booleans().add(MaterialParam.of(ParamId.CUSTOM_BOOLEAN1, true));
        entry.booleans().add(MaterialParam.of(ParamId.CUSTOM_BOOLEAN3, true));
        entry.booleans().add(MaterialParam.of(ParamId.CUSTOM_BOOLEAN4, true));
        entry.floats().add(MaterialParam.of(ParamId.CUSTOM_FLOAT8, 0.4f));
        // Zero alpha params allow for transparency
        entry.vectors().add(MaterialParam.of(ParamId.CUSTOM_VECTOR0, new Vector4f(0.0f, 0.0f, 0.0f, 0.0f)));
        entry.vectors().add(MaterialParam.of(ParamId.CUSTOM_VECTOR8, new Vector4f(1.0f, 1.0f, 1.0f, 1.0f)));
        entry.vectors().add(MaterialParam.of(ParamId.CUSTOM_VECTOR13, new Vector4f(1.0f, 1.0f, 1.0f, 1.0f)));
        entry.vectors().add(MaterialParam.of(ParamId.CUSTOM_VECTOR14, new Vector4f(1.0f, 1.0f, 1.0f, 1.0f)));
        for (var id : List.of(ParamId.TEXTURE0, ParamId.TEXTURE4, ParamId.TEXTURE6, ParamId.TEXTURE7)) {
            entry.textures().add(MaterialParam.of(id, ParamClassifier.defaultTexture(id)));
        }
        for (var id : List.of(ParamId.SAMPLER0, ParamId.SAMPLER4, ParamId.SAMPLER6, ParamId.SAMPLER7)) {
            entry.samplers().add(MaterialParam.of(id, SamplerData.defaults()));
        }
        entry.blendStates().add(MaterialParam.of(ParamId.BLEND_STATE0, BlendStateData.defaults()));
        entry.rasterizerStates().add(MaterialParam.of(ParamId.RASTERIZER_STATE0, RasterizerStateData.defaults()));
        return entry;
    }

    /**
     * The presets bundled with the application.
     *
     * @throws UncheckedIOException if the bundled resource is missing or invalid
     */
    public static List<MaterialEntry> defaultPresets() {
        try (var is = MaterialPresets.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IOException("Missing resource " + DEFAULT_RESOURCE);
            }
            return MaterialJson.readEntries(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read bundled presets", e);
        }
    }

    /**
     * Load the user's presets. A missing file is first created with the bundled presets. Any failure to read or
     * parse the file is logged and the bundled presets are returned instead.
     */
    public static List<MaterialEntry> load(Path path) {
        if (!Files.exists(path)) {
            try {
                save(path, defaultPresets());
                log.info("Wrote default presets to {}", path);
            } catch (IOException e) {
                log.error("Failed to write default presets to {}: {}", path, e.getMessage());
                return defaultPresets();
            }
        }

        try (var is = Files.newInputStream(path)) {
            var presets = MaterialJson.readEntries(is);
            log.info("Loaded {} presets from {}", presets.size(), path);
            return presets;
        } catch (IOException e) {
            log.warn("Failed to load presets from {}: {}", path, e.getMessage());
            return defaultPresets();
        }
    }

    public static void save(Path path, List<MaterialEntry> presets) throws IOException {
        try (var os = Files.newOutputStream(path)) {
            MaterialJson.writeEntries(os, presets);
        }
    }

    private static String textureOf(MaterialEntry entry, ParamId id) {
        return entry.textures()
                    .stream()
                    .filter(t -> t.paramId() == id)
                    .map(MaterialParam::data)
                    .findFirst()
                    .orElseGet(() -> ParamClassifier.defaultTexture(id));
    }
}
