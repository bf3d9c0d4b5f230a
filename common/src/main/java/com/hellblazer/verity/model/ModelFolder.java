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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The parsed files of one folder on disk. Every file occupies a slot whether or not it parsed; only parsed slots
 * take part in cross-file checks. A folder value is never modified after construction: saving or reloading a file
 * produces a new folder through {@link #toBuilder()}.
 *
 * @author hal.hildebrand
 */
public final class ModelFolder {

    private final Path                         folderPath;
    private final List<FileSlot<MeshFile>>     meshes;
    private final List<FileSlot<SkelFile>>     skels;
    private final List<FileSlot<MatlFile>>     matls;
    private final List<FileSlot<ModlFile>>     modls;
    private final List<FileSlot<AdjFile>>      adjs;
    private final List<FileSlot<AnimFile>>     anims;
    private final List<FileSlot<HlpbFile>>     hlpbs;
    private final List<FileSlot<MeshExFile>>   meshExes;
    private final List<FileSlot<NutexbFile>>   nutexbs;

    private ModelFolder(Builder builder) {
        this.folderPath = builder.folderPath;
        this.meshes = List.copyOf(builder.meshes);
        this.skels = List.copyOf(builder.skels);
        this.matls = List.copyOf(builder.matls);
        this.modls = List.copyOf(builder.modls);
        this.adjs = List.copyOf(builder.adjs);
        this.anims = List.copyOf(builder.anims);
        this.hlpbs = List.copyOf(builder.hlpbs);
        this.meshExes = List.copyOf(builder.meshExes);
        this.nutexbs = List.copyOf(builder.nutexbs);
    }

    public static Builder builder(Path folderPath) {
        return new Builder(folderPath);
    }

    /**
     * An empty folder at the given path.
     */
    public static ModelFolder empty(Path folderPath) {
        return builder(folderPath).build();
    }

    private static <T> Optional<T> find(List<FileSlot<T>> slots, FileKind kind) {
        var name = kind.modelFileName().orElseThrow();
        return slots.stream().filter(s -> s.fileName().equals(name)).findFirst().flatMap(FileSlot::data);
    }

    public List<FileSlot<AdjFile>> adjs() {
        return adjs;
    }

    public List<FileSlot<AnimFile>> anims() {
        return anims;
    }

    public Optional<AdjFile> findAdj() {
        return find(adjs, FileKind.ADJ);
    }

    public Optional<HlpbFile> findHlpb() {
        return find(hlpbs, FileKind.HLPB);
    }

    public Optional<MatlFile> findMatl() {
        return find(matls, FileKind.MATL);
    }

    /**
     * The parsed {@code model.numshb}, if present. Other mesh files in the folder are not used by the model.
     */
    public Optional<MeshFile> findMesh() {
        return find(meshes, FileKind.MESH);
    }

    public Optional<MeshExFile> findMeshEx() {
        return find(meshExes, FileKind.MESHEX);
    }

    public Optional<ModlFile> findModl() {
        return find(modls, FileKind.MODL);
    }

    public Optional<SkelFile> findSkel() {
        return find(skels, FileKind.SKEL);
    }

    public Path folderPath() {
        return folderPath;
    }

    public List<FileSlot<HlpbFile>> hlpbs() {
        return hlpbs;
    }

    public boolean isEmpty() {
        return meshes.isEmpty() && skels.isEmpty() && matls.isEmpty() && modls.isEmpty() && adjs.isEmpty()
               && anims.isEmpty() && hlpbs.isEmpty() && meshExes.isEmpty() && nutexbs.isEmpty();
    }

    public List<FileSlot<MatlFile>> matls() {
        return matls;
    }

    public List<FileSlot<MeshExFile>> meshExes() {
        return meshExes;
    }

    public List<FileSlot<MeshFile>> meshes() {
        return meshes;
    }

    public List<FileSlot<ModlFile>> modls() {
        return modls;
    }

    public List<FileSlot<NutexbFile>> nutexbs() {
        return nutexbs;
    }

    public List<FileSlot<SkelFile>> skels() {
        return skels;
    }

    /**
     * Number of slots, parsed or not, of the given kind.
     */
    public int slotCount(FileKind kind) {
        return switch (kind) {
            case MESH -> meshes.size();
            case SKEL -> skels.size();
            case MATL -> matls.size();
            case MODL -> modls.size();
            case ADJ -> adjs.size();
            case ANIM -> anims.size();
            case HLPB -> hlpbs.size();
            case MESHEX -> meshExes.size();
            case NUTEXB -> nutexbs.size();
        };
    }

    public Builder toBuilder() {
        var builder = new Builder(folderPath);
        builder.meshes.addAll(meshes);
        builder.skels.addAll(skels);
        builder.matls.addAll(matls);
        builder.modls.addAll(modls);
        builder.adjs.addAll(adjs);
        builder.anims.addAll(anims);
        builder.hlpbs.addAll(hlpbs);
        builder.meshExes.addAll(meshExes);
        builder.nutexbs.addAll(nutexbs);
        return builder;
    }

    @Override
    public String toString() {
        return "ModelFolder[" + folderPath + "]";
    }

    public static class Builder {
        private final Path                       folderPath;
        private final List<FileSlot<MeshFile>>   meshes   = new ArrayList<>();
        private final List<FileSlot<SkelFile>>   skels    = new ArrayList<>();
        private final List<FileSlot<MatlFile>>   matls    = new ArrayList<>();
        private final List<FileSlot<ModlFile>>   modls    = new ArrayList<>();
        private final List<FileSlot<AdjFile>>    adjs     = new ArrayList<>();
        private final List<FileSlot<AnimFile>>   anims    = new ArrayList<>();
        private final List<FileSlot<HlpbFile>>   hlpbs    = new ArrayList<>();
        private final List<FileSlot<MeshExFile>> meshExes = new ArrayList<>();
        private final List<FileSlot<NutexbFile>> nutexbs  = new ArrayList<>();

        private Builder(Path folderPath) {
            this.folderPath = Objects.requireNonNull(folderPath, "folderPath");
        }

        private static <T> void replace(List<FileSlot<T>> slots, FileSlot<T> slot) {
            for (int i = 0; i < slots.size(); i++) {
                if (slots.get(i).fileName().equals(slot.fileName())) {
                    slots.set(i, slot);
                    return;
                }
            }
            slots.add(slot);
        }

        public Builder adj(FileSlot<AdjFile> slot) {
            replace(adjs, slot);
            return this;
        }

        public Builder adj(AdjFile adj) {
            return adj(FileSlot.parsed(FileKind.ADJ.modelFileName().orElseThrow(), adj));
        }

        public Builder anim(FileSlot<AnimFile> slot) {
            replace(anims, slot);
            return this;
        }

        public ModelFolder build() {
            return new ModelFolder(this);
        }

        public Builder hlpb(FileSlot<HlpbFile> slot) {
            replace(hlpbs, slot);
            return this;
        }

        public Builder matl(FileSlot<MatlFile> slot) {
            replace(matls, slot);
            return this;
        }

        public Builder matl(MatlFile matl) {
            return matl(FileSlot.parsed(FileKind.MATL.modelFileName().orElseThrow(), matl));
        }

        public Builder mesh(FileSlot<MeshFile> slot) {
            replace(meshes, slot);
            return this;
        }

        public Builder mesh(MeshFile mesh) {
            return mesh(FileSlot.parsed(FileKind.MESH.modelFileName().orElseThrow(), mesh));
        }

        public Builder meshEx(FileSlot<MeshExFile> slot) {
            replace(meshExes, slot);
            return this;
        }

        public Builder modl(FileSlot<ModlFile> slot) {
            replace(modls, slot);
            return this;
        }

        public Builder modl(ModlFile modl) {
            return modl(FileSlot.parsed(FileKind.MODL.modelFileName().orElseThrow(), modl));
        }

        public Builder nutexb(FileSlot<NutexbFile> slot) {
            replace(nutexbs, slot);
            return this;
        }

        public Builder skel(FileSlot<SkelFile> slot) {
            replace(skels, slot);
            return this;
        }
    }
}
