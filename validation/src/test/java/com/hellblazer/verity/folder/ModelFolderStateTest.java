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
package com.hellblazer.verity.folder;

import com.hellblazer.verity.model.AnimFile;
import com.hellblazer.verity.model.FileKind;
import com.hellblazer.verity.model.FileSlot;
import com.hellblazer.verity.model.MaterialEntry;
import com.hellblazer.verity.model.MaterialParam;
import com.hellblazer.verity.model.MatlFile;
import com.hellblazer.verity.model.MeshFile;
import com.hellblazer.verity.model.MeshObject;
import com.hellblazer.verity.model.ModelFolder;
import com.hellblazer.verity.model.NutexbFile;
import com.hellblazer.verity.model.NutexbFormat;
import com.hellblazer.verity.model.ParamId;
import com.hellblazer.verity.shader.ShaderDatabase;
import com.hellblazer.verity.validation.ConsistencyValidator;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ModelFolderStateTest {

    private static final Path PATH = Path.of("/fighter/mario/model/body/c00");

    private static ModelFolder folderWithMissingTexture() {
        var entry = new MaterialEntry("a", "SFX_PBS_0100000008008269_opaque");
        entry.textures().add(MaterialParam.of(ParamId.TEXTURE0, "missing"));
        return ModelFolder.builder(PATH).matl(new MatlFile(List.of(entry))).build();
    }

    @Test
    void testIsModelFolder() {
        assertFalse(new ModelFolderState(ModelFolder.empty(PATH)).isModelFolder());

        var textures = ModelFolder.builder(PATH)
                                  .nutexb(FileSlot.parsed("t.nutexb", NutexbFile.of("t", NutexbFormat.BC7_SRGB)))
                                  .anim(FileSlot.parsed("model.nuanmb", new AnimFile(1.0f, List.of())))
                                  .build();
        assertFalse(new ModelFolderState(textures).isModelFolder());

        var mesh = ModelFolder.builder(PATH).mesh(new MeshFile(List.of(MeshObject.of("a", 0)))).build();
        assertTrue(new ModelFolderState(mesh).isModelFolder());

        var failedMatl = ModelFolder.builder(PATH).matl(FileSlot.failed("model.numatb", "bad")).build();
        assertTrue(new ModelFolderState(failedMatl).isModelFolder());
    }

    @Test
    void testValidateReplacesReport() {
        var state = new ModelFolderState(folderWithMissingTexture());
        assertTrue(state.getReport().isEmpty());

        var report = state.validate(new ConsistencyValidator(), ShaderDatabase.empty());

        assertEquals(1, report.matl().size());
        assertSame(report, state.getReport());
    }

    @Test
    void testChangeFlags() {
        var folder = ModelFolder.builder(PATH)
                                .matl(new MatlFile(List.of()))
                                .mesh(new MeshFile(List.of()))
                                .nutexb(FileSlot.parsed("t.nutexb", NutexbFile.of("t", NutexbFormat.BC7_SRGB)))
                                .build();
        var state = new ModelFolderState(folder);
        assertFalse(state.getChanged().anyChanged());
        assertEquals(1, state.getChanged().slotCount(FileKind.NUTEXB));
        assertEquals(0, state.getChanged().slotCount(FileKind.ADJ));

        state.markChanged(FileKind.MATL, 0);
        state.markChanged(FileKind.ADJ, 0);

        assertTrue(state.getChanged().anyChanged());
        assertTrue(state.getChanged().isChanged(FileKind.MATL, 0));
        assertFalse(state.getChanged().isChanged(FileKind.MESH, 0));
        assertFalse(state.getChanged().isChanged(FileKind.ADJ, 0));
        assertFalse(state.getChanged().isChanged(FileKind.MATL, -1));

        state.getChanged().set(FileKind.MATL, 0, false);
        assertFalse(state.getChanged().anyChanged());
    }

    @Test
    void testReloadResetsChanges() throws IOException {
        var state = new ModelFolderState(folderWithMissingTexture());
        state.markChanged(FileKind.MATL, 0);
        var reloaded = ModelFolder.builder(PATH).matl(new MatlFile(List.of())).build();
        var loader = mock(FolderLoader.class);
        when(loader.load(PATH)).thenReturn(reloaded);

        state.reload(loader);

        assertSame(reloaded, state.getFolder());
        assertFalse(state.getChanged().anyChanged());
        verify(loader).load(PATH);
    }

    @Test
    void testFailedReloadKeepsState() throws IOException {
        var folder = folderWithMissingTexture();
        var state = new ModelFolderState(folder);
        state.markChanged(FileKind.MATL, 0);
        FolderLoader loader = path -> {
            throw new IOException("permission denied");
        };

        assertThrows(IOException.class, () -> state.reload(loader));

        assertSame(folder, state.getFolder());
        assertTrue(state.getChanged().isChanged(FileKind.MATL, 0));
    }

    @Test
    void testSwingPrc() {
        assertTrue(new ModelFolderState(ModelFolder.empty(PATH)).getSwingPrc().isEmpty());
        assertEquals(PATH.resolve("swing.prc"),
                     new ModelFolderState(ModelFolder.empty(PATH), PATH.resolve("swing.prc")).getSwingPrc()
                                                                                           .orElseThrow());
    }
}
