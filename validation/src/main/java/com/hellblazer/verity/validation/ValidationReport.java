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

import com.hellblazer.verity.model.FileKind;

import java.util.List;
import java.util.stream.Stream;

/**
 * The diagnostics of one validation pass, one ordered list per kind of file. A report is replaced wholesale whenever
 * a folder is validated again.
 *
 * @author hal.hildebrand
 */
public record ValidationReport(List<MeshDiagnostic> mesh, List<MatlDiagnostic> matl, List<ModlDiagnostic> modl,
                               List<AdjDiagnostic> adj, List<NutexbDiagnostic> nutexb) {

    private static final ValidationReport EMPTY = new ValidationReport(List.of(), List.of(), List.of(), List.of(),
                                                                       List.of());

    public ValidationReport {
        mesh = List.copyOf(mesh);
        matl = List.copyOf(matl);
        modl = List.copyOf(modl);
        adj = List.copyOf(adj);
        nutexb = List.copyOf(nutexb);
    }

    public static ValidationReport empty() {
        return EMPTY;
    }

    /**
     * Every diagnostic, bucket by bucket in the order mesh, matl, modl, adj, nutexb.
     */
    public Stream<Diagnostic> all() {
        return Stream.of(mesh, matl, modl, adj, nutexb).flatMap(List::stream);
    }

    /**
     * Diagnostics reported against files of the given kind. Kinds without checks have none.
     */
    public List<? extends Diagnostic> forKind(FileKind kind) {
        return switch (kind) {
            case MESH -> mesh;
            case MATL -> matl;
            case MODL -> modl;
            case ADJ -> adj;
            case NUTEXB -> nutexb;
            case SKEL, ANIM, HLPB, MESHEX -> List.of();
        };
    }

    public List<MatlDiagnostic> forMaterialEntry(int entryIndex) {
        return matl.stream().filter(d -> d.entryIndex() == entryIndex).toList();
    }

    /**
     * Mesh diagnostics for the object at {@code meshObjectIndex}. Adjacency diagnostics for the object are returned
     * by {@link #forAdjacency(int)}.
     */
    public List<MeshDiagnostic> forMeshObject(int meshObjectIndex) {
        return mesh.stream().filter(d -> d.meshObjectIndex() == meshObjectIndex).toList();
    }

    public List<AdjDiagnostic.MissingRenormalEntry> forAdjacency(int meshObjectIndex) {
        return adj.stream()
                  .map(AdjDiagnostic.MissingRenormalEntry.class::cast)
                  .filter(d -> d.meshObjectIndex() == meshObjectIndex)
                  .toList();
    }

    public List<ModlDiagnostic> forModlEntry(int entryIndex) {
        return modl.stream().filter(d -> d.entryIndex() == entryIndex).toList();
    }

    public List<NutexbDiagnostic> forTexture(String textureName) {
        return nutexb.stream().filter(d -> d.textureName().equals(textureName)).toList();
    }

    public boolean isEmpty() {
        return mesh.isEmpty() && matl.isEmpty() && modl.isEmpty() && adj.isEmpty() && nutexb.isEmpty();
    }

    public int size() {
        return mesh.size() + matl.size() + modl.size() + adj.size() + nutexb.size();
    }
}
