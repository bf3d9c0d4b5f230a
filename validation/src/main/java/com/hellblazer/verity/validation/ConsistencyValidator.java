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
import com.hellblazer.verity.model.AdjFile;
import com.hellblazer.verity.model.FileSlot;
import com.hellblazer.verity.model.MaterialEntry;
import com.hellblazer.verity.model.MatlFile;
import com.hellblazer.verity.model.MeshFile;
import com.hellblazer.verity.model.MeshObject;
import com.hellblazer.verity.model.ModelFolder;
import com.hellblazer.verity.model.ModlFile;
import com.hellblazer.verity.model.NutexbFile;
import com.hellblazer.verity.shader.ShaderProgramLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the inconsistencies between the files of a model folder.
 *
 * <p>Every check needs a parsed {@code model.numatb}; without one the report is empty. Checks needing other files
 * are skipped when those files are absent or failed to parse. Validation never modifies the folder and never fails
 * for a well formed folder: lookup misses mean a check does not apply.
 *
 * <p>Diagnostics are ordered by check, then by material entry, then by parameter or mesh object. Instances hold no
 * mutable state and may validate several folders concurrently.
 *
 * @author hal.hildebrand
 */
public class ConsistencyValidator {
    public static final String RENORMAL = "RENORMAL";

    private static final Logger log = LoggerFactory.getLogger(ConsistencyValidator.class);

    private final ValidationConfiguration config;

    public ConsistencyValidator() {
        this(ValidationConfiguration.defaultConfig());
    }

    public ConsistencyValidator(ValidationConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * The first slot whose file name, without extension and ignoring case, equals {@code textureName}.
     */
    static Optional<FileSlot<NutexbFile>> findTexture(List<FileSlot<NutexbFile>> nutexbs, String textureName) {
        return nutexbs.stream().filter(slot -> matchesTexture(slot.fileName(), textureName)).findFirst();
    }

    static boolean matchesTexture(String fileName, String textureName) {
        return stripExtension(fileName).equalsIgnoreCase(textureName);
    }

    static String stripExtension(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1) {
            return fileName;
        }
        return fileName.substring(0, dot);
    }

    public ValidationConfiguration getConfig() {
        return config;
    }

    public ValidationReport validate(ModelFolder folder, ShaderProgramLookup lookup) {
        Objects.requireNonNull(folder, "folder");
        Objects.requireNonNull(lookup, "lookup");

        var matl = folder.findMatl();
        if (matl.isEmpty()) {
            log.debug("No parsed material file in {}, skipping validation", folder.folderPath());
            return ValidationReport.empty();
        }

        var pass = new Pass(matl.get(), folder.findMesh().orElse(null), folder.findModl().orElse(null),
                            folder.findAdj().orElse(null), folder.nutexbs());
        if (config.checkMeshSubIndices()) {
            pass.meshSubIndices();
        }
        if (config.checkRequiredAttributes()) {
            pass.requiredAttributes(lookup);
        }
        if (config.checkTextureFormats()) {
            pass.textureFormats();
        }
        if (config.checkTextureDimensions()) {
            pass.textureDimensions();
        }
        if (config.checkTextureAssignments()) {
            pass.textureAssignments(config.defaultTextureNames());
        }
        if (config.checkRenormalAdjacency()) {
            pass.renormalAdjacency();
        }
        if (config.checkModelBindings()) {
            pass.modelBindings();
        }

        var report = pass.report();
        log.debug("Validated {}: {} mesh, {} matl, {} modl, {} adj, {} nutexb diagnostics", folder.folderPath(),
                  report.mesh().size(), report.matl().size(), report.modl().size(), report.adj().size(),
                  report.nutexb().size());
        return report;
    }

    private record MeshObjectKey(String name, long subIndex) {
        static MeshObjectKey of(MeshObject object) {
            return new MeshObjectKey(object.name(), object.subIndex());
        }
    }

    /**
     * State of a single validation pass. The mesh object index is only used for lookups; output order always
     * follows the order of the files.
     */
    private static class Pass {
        private final MatlFile                   matl;
        private final MeshFile                   mesh;
        private final ModlFile                   modl;
        private final AdjFile                    adj;
        private final List<FileSlot<NutexbFile>> nutexbs;
        private final Map<MeshObjectKey, Integer> meshObjectIndex = new HashMap<>();

        private final List<MeshDiagnostic>   meshDiagnostics   = new ArrayList<>();
        private final List<MatlDiagnostic>   matlDiagnostics   = new ArrayList<>();
        private final List<ModlDiagnostic>   modlDiagnostics   = new ArrayList<>();
        private final List<AdjDiagnostic>    adjDiagnostics    = new ArrayList<>();
        private final List<NutexbDiagnostic> nutexbDiagnostics = new ArrayList<>();

        Pass(MatlFile matl, MeshFile mesh, ModlFile modl, AdjFile adj, List<FileSlot<NutexbFile>> nutexbs) {
            this.matl = matl;
            this.mesh = mesh;
            this.modl = modl;
            this.adj = adj;
            this.nutexbs = nutexbs;
            if (mesh != null) {
                var objects = mesh.objects();
                for (int i = 0; i < objects.size(); i++) {
                    meshObjectIndex.putIfAbsent(MeshObjectKey.of(objects.get(i)), i);
                }
            }
        }

        void meshSubIndices() {
            if (mesh == null) {
                return;
            }
            var subIndicesByName = new HashMap<String, Set<Long>>();
            var objects = mesh.objects();
            for (int i = 0; i < objects.size(); i++) {
                var object = objects.get(i);
                if (!subIndicesByName.computeIfAbsent(object.name(), n -> new HashSet<>()).add(object.subIndex())) {
                    meshDiagnostics.add(new MeshDiagnostic.DuplicateSubIndex(i, object.name(), object.subIndex()));
                }
            }
        }

        void modelBindings() {
            if (modl == null) {
                return;
            }
            var entries = modl.entries();
            for (int i = 0; i < entries.size(); i++) {
                var binding = entries.get(i);
                var key = new MeshObjectKey(binding.meshObjectName(), binding.meshObjectSubIndex());
                if (mesh != null && !meshObjectIndex.containsKey(key)) {
                    modlDiagnostics.add(new ModlDiagnostic.InvalidMeshObject(i, binding.meshObjectName(),
                                                                             binding.meshObjectSubIndex()));
                }
                if (matl.findEntry(binding.materialLabel()).isEmpty()) {
                    modlDiagnostics.add(new ModlDiagnostic.InvalidMaterial(i, binding.materialLabel()));
                }
            }
        }

        void renormalAdjacency() {
            var entries = matl.entries();
            for (int entryIndex = 0; entryIndex < entries.size(); entryIndex++) {
                var entry = entries.get(entryIndex);
                if (!entry.getMaterialLabel().contains(RENORMAL)) {
                    continue;
                }
                if (adj == null) {
                    matlDiagnostics.add(new MatlDiagnostic.RenormalMissingAdj(entryIndex, entry.getMaterialLabel()));
                    continue;
                }
                var bound = boundObjectIndices(entry);
                // Adjacency entries are matched by position among the bound objects
                for (int position = 0; position < bound.size(); position++) {
                    if (adj.hasEntryFor(position)) {
                        continue;
                    }
                    int objectIndex = bound.get(position);
                    var meshName = mesh.objects().get(objectIndex).name();
                    matlDiagnostics.add(new MatlDiagnostic.RenormalMissingAdjEntry(entryIndex,
                                                                                   entry.getMaterialLabel(),
                                                                                   meshName));
                    adjDiagnostics.add(new AdjDiagnostic.MissingRenormalEntry(objectIndex, meshName,
                                                                              entry.getMaterialLabel()));
                }
            }
        }

        ValidationReport report() {
            return new ValidationReport(meshDiagnostics, matlDiagnostics, modlDiagnostics, adjDiagnostics,
                                        nutexbDiagnostics);
        }

        void requiredAttributes(ShaderProgramLookup lookup) {
            if (modl == null || mesh == null) {
                log.debug("Skipping required attributes: model or mesh file unavailable");
                return;
            }
            var entries = matl.entries();
            for (int entryIndex = 0; entryIndex < entries.size(); entryIndex++) {
                var entry = entries.get(entryIndex);
                var program = lookup.programForShaderLabel(entry.getShaderLabel());
                if (program.isEmpty()) {
                    continue;
                }
                var bound = boundKeys(entry);
                var objects = mesh.objects();
                for (int i = 0; i < objects.size(); i++) {
                    var object = objects.get(i);
                    if (!bound.contains(MeshObjectKey.of(object))) {
                        continue;
                    }
                    var missing = program.get().missingRequiredAttributes(object.attributeNames());
                    if (!missing.isEmpty()) {
                        matlDiagnostics.add(new MatlDiagnostic.MissingRequiredAttributes(entryIndex,
                                                                                         entry.getMaterialLabel(),
                                                                                         object.name(), missing));
                        meshDiagnostics.add(new MeshDiagnostic.MissingRequiredAttributes(i, object.name(),
                                                                                         entry.getMaterialLabel(),
                                                                                         missing));
                    }
                }
            }
        }

        void textureAssignments(Set<String> defaultTextureNames) {
            var entries = matl.entries();
            for (int entryIndex = 0; entryIndex < entries.size(); entryIndex++) {
                var entry = entries.get(entryIndex);
                for (var texture : entry.textures()) {
                    var name = texture.data();
                    if (findTexture(nutexbs, name).isPresent() || isDefaultTexture(defaultTextureNames, name)) {
                        continue;
                    }
                    matlDiagnostics.add(new MatlDiagnostic.MissingTexture(entryIndex, entry.getMaterialLabel(),
                                                                          texture.paramId(), name));
                }
            }
        }

        void textureDimensions() {
            var entries = matl.entries();
            for (int entryIndex = 0; entryIndex < entries.size(); entryIndex++) {
                var entry = entries.get(entryIndex);
                for (var texture : entry.textures()) {
                    var slot = findTexture(nutexbs, texture.data());
                    var nutexb = slot.flatMap(FileSlot::data);
                    if (nutexb.isEmpty()) {
                        continue;
                    }
                    var expected = ParamClassifier.expectedDimension(texture.paramId());
                    var actual = nutexb.get().dimension();
                    if (actual != expected) {
                        matlDiagnostics.add(new MatlDiagnostic.UnexpectedTextureDimension(entryIndex,
                                                                                          entry.getMaterialLabel(),
                                                                                          texture.paramId(),
                                                                                          slot.get().fileName(),
                                                                                          expected, actual));
                    }
                }
            }
        }

        void textureFormats() {
            var entries = matl.entries();
            for (int entryIndex = 0; entryIndex < entries.size(); entryIndex++) {
                var entry = entries.get(entryIndex);
                for (var texture : entry.textures()) {
                    var slot = findTexture(nutexbs, texture.data());
                    var nutexb = slot.flatMap(FileSlot::data);
                    if (nutexb.isEmpty()) {
                        continue;
                    }
                    var format = nutexb.get().format();
                    if (ParamClassifier.expectsSrgb(texture.paramId()) != format.isSrgb()) {
                        var fileName = slot.get().fileName();
                        matlDiagnostics.add(new MatlDiagnostic.UnexpectedTextureFormat(entryIndex,
                                                                                       entry.getMaterialLabel(),
                                                                                       texture.paramId(), fileName,
                                                                                       format));
                        nutexbDiagnostics.add(new NutexbDiagnostic.FormatInvalidForUsage(fileName, format,
                                                                                         texture.paramId()));
                    }
                }
            }
        }

        /**
         * Mesh object indices bound to the entry, in binding order. Bindings naming no mesh object are skipped.
         */
        private List<Integer> boundObjectIndices(MaterialEntry entry) {
            var indices = new ArrayList<Integer>();
            if (modl == null || mesh == null) {
                return indices;
            }
            for (var binding : modl.entries()) {
                if (!binding.materialLabel().equals(entry.getMaterialLabel())) {
                    continue;
                }
                var index = meshObjectIndex.get(new MeshObjectKey(binding.meshObjectName(),
                                                                  binding.meshObjectSubIndex()));
                if (index != null) {
                    indices.add(index);
                }
            }
            return indices;
        }

        private Set<MeshObjectKey> boundKeys(MaterialEntry entry) {
            var keys = new HashSet<MeshObjectKey>();
            for (var binding : modl.entries()) {
                if (binding.materialLabel().equals(entry.getMaterialLabel())) {
                    keys.add(new MeshObjectKey(binding.meshObjectName(), binding.meshObjectSubIndex()));
                }
            }
            return keys;
        }

        private boolean isDefaultTexture(Set<String> defaultTextureNames, String name) {
            for (var defaultName : defaultTextureNames) {
                if (matchesTexture(defaultName, name)) {
                    return true;
                }
            }
            return false;
        }
    }
}
