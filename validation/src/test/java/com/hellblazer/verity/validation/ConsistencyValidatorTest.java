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
import com.hellblazer.verity.model.AdjEntry;
import com.hellblazer.verity.model.AdjFile;
import com.hellblazer.verity.model.FileKind;
import com.hellblazer.verity.model.FileSlot;
import com.hellblazer.verity.model.MaterialEntry;
import com.hellblazer.verity.model.MaterialParam;
import com.hellblazer.verity.model.MatlFile;
import com.hellblazer.verity.model.MeshFile;
import com.hellblazer.verity.model.MeshObject;
import com.hellblazer.verity.model.ModelFolder;
import com.hellblazer.verity.model.ModlEntry;
import com.hellblazer.verity.model.ModlFile;
import com.hellblazer.verity.model.NutexbFile;
import com.hellblazer.verity.model.NutexbFormat;
import com.hellblazer.verity.model.ParamId;
import com.hellblazer.verity.model.TextureDimension;
import com.hellblazer.verity.shader.ShaderDatabase;
import com.hellblazer.verity.shader.ShaderProgram;
import com.hellblazer.verity.shader.ShaderProgramLookup;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for ConsistencyValidator against small hand built folders
 *
 * @author hal.hildebrand
 */
public class ConsistencyValidatorTest {

    private static final String SHADER = "SFX_PBS_010002000800824f_opaque";
    private static final Path   FOLDER = Path.of("/fighter/mario/model/body/c00");

    private static ShaderDatabase database;

    private final ConsistencyValidator validator = new ConsistencyValidator();

    @BeforeAll
    static void loadDatabase() {
        database = ShaderDatabase.fromResource().orElseThrow();
    }

    private static MaterialEntry entry(String label, String shaderLabel) {
        return new MaterialEntry(label, shaderLabel);
    }

    private static MaterialEntry entryWithTextures(String label, Object... paramsAndNames) {
        var entry = entry(label, SHADER);
        for (int i = 0; i < paramsAndNames.length; i += 2) {
            entry.textures().add(MaterialParam.of((ParamId) paramsAndNames[i], (String) paramsAndNames[i + 1]));
        }
        return entry;
    }

    private static ModelFolder.Builder folder(MaterialEntry... entries) {
        return ModelFolder.builder(FOLDER).matl(new MatlFile(List.of(entries)));
    }

    private static MeshObject meshObject(String name, String... attributes) {
        return new MeshObject(name, 0, List.of(attributes), List.of());
    }

    private static FileSlot<NutexbFile> texture(String name, NutexbFormat format) {
        return FileSlot.parsed(name, NutexbFile.of(name, format));
    }

    private static FileSlot<NutexbFile> cubeTexture(String name, NutexbFormat format) {
        return FileSlot.parsed(name, NutexbFile.cube(name, format));
    }

    @Test
    void testRequiredAttributesAllMissing() {
        var folder = folder(entry("a", SHADER)).mesh(new MeshFile(List.of(MeshObject.of("object1", 0))))
                                               .modl(new ModlFile(List.of(new ModlEntry("object1", 0, "a"))))
                                               .build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.MissingRequiredAttributes(0, "a", "object1",
                                                                          List.of("map1", "uvSet"))), report.matl());
        assertEquals(List.of(new MeshDiagnostic.MissingRequiredAttributes(0, "object1", "a",
                                                                          List.of("map1", "uvSet"))), report.mesh());
        assertEquals("Mesh \"object1\" is missing attributes map1, uvSet required by assigned material \"a\".",
                     report.matl().get(0).message());
        assertEquals(report.matl().get(0).message(), report.mesh().get(0).message());
        assertTrue(report.modl().isEmpty());
    }

    @Test
    void testRequiredAttributesPresent() {
        var folder = folder(entry("a", SHADER)).mesh(new MeshFile(List.of(meshObject("object1", "map1", "uvSet"))))
                                               .modl(new ModlFile(List.of(new ModlEntry("object1", 0, "a"))))
                                               .build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testRequiredAttributesOnlyForBoundObjects() {
        var objects = List.of(meshObject("bound"), meshObject("unbound"), meshObject("other"));
        var bindings = List.of(new ModlEntry("bound", 0, "a"), new ModlEntry("unbound", 0, "b"),
                               new ModlEntry("other", 0, "a"));
        var folder = folder(entry("a", SHADER), entry("b", "SFX_PBS_0000000000000000_opaque")).mesh(
        new MeshFile(objects)).modl(new ModlFile(bindings)).build();

        var report = validator.validate(folder, database);

        assertEquals(2, report.matl().size());
        assertEquals(List.of(0, 2), report.mesh().stream().map(MeshDiagnostic::meshObjectIndex).toList());
        assertEquals(2, report.forMaterialEntry(0).size());
        assertTrue(report.forMaterialEntry(1).isEmpty());
        assertTrue(report.forMeshObject(1).isEmpty());
    }

    @Test
    void testRequiredAttributesUseColorSets() {
        var folder = folder(entry("a", "SFX_PBS_0100080008008269_opaque")).mesh(
        new MeshFile(List.of(new MeshObject("object1", 0, List.of("map1"), List.of("colorSet1"))))).modl(
        new ModlFile(List.of(new ModlEntry("object1", 0, "a")))).build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testRequiredAttributesUsesLookup() {
        var lookup = mock(ShaderProgramLookup.class);
        var program = new ShaderProgram(false, List.of("map1.xy"), List.of());
        when(lookup.get(anyString())).thenReturn(Optional.empty());
        when(lookup.get("SFX_PBS_010002000800824f")).thenReturn(Optional.of(program));
        when(lookup.programForShaderLabel(anyString())).thenCallRealMethod();

        var folder = folder(entry("a", SHADER)).mesh(new MeshFile(List.of(MeshObject.of("object1", 0))))
                                               .modl(new ModlFile(List.of(new ModlEntry("object1", 0, "a"))))
                                               .build();
        var report = validator.validate(folder, lookup);

        assertEquals(List.of("map1"),
                     ((MatlDiagnostic.MissingRequiredAttributes) report.matl().get(0)).missingAttributes());
        verify(lookup).get("SFX_PBS_010002000800824f");
    }

    @Test
    void testLookupNotNeededWithoutBindings() {
        var lookup = mock(ShaderProgramLookup.class);
        var folder = folder(entry("a", SHADER)).mesh(new MeshFile(List.of(MeshObject.of("object1", 0)))).build();

        assertTrue(validator.validate(folder, lookup).isEmpty());
        verifyNoInteractions(lookup);
    }

    @Test
    void testUnknownShaderIsNotAnError() {
        var folder = folder(entry("a", "SFX_PBS_ffffffffffffffff_opaque"), entry("b", "short")).mesh(
        new MeshFile(List.of(MeshObject.of("object1", 0)))).modl(
        new ModlFile(List.of(new ModlEntry("object1", 0, "a"), new ModlEntry("object1", 0, "b")))).build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testRenormalMaterialMissingAdj() {
        var folder = folder(entry("a_RENORMAL", SHADER)).mesh(
        new MeshFile(List.of(meshObject("object1", "map1", "uvSet")))).modl(
        new ModlFile(List.of(new ModlEntry("object1", 0, "a_RENORMAL")))).build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.RenormalMissingAdj(0, "a_RENORMAL")), report.matl());
        assertEquals("Material \"a_RENORMAL\" is a RENORMAL material, but the model.adjb file is missing.",
                     report.matl().get(0).message());
        assertEquals(1, report.size());
    }

    @Test
    void testRenormalMaterialMissingAdjEntry() {
        var folder = folder(entry("a_RENORMAL", SHADER)).mesh(
        new MeshFile(List.of(meshObject("object1", "map1", "uvSet")))).modl(
        new ModlFile(List.of(new ModlEntry("object1", 0, "a_RENORMAL")))).adj(new AdjFile(List.of())).build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.RenormalMissingAdjEntry(0, "a_RENORMAL", "object1")),
                     report.matl());
        assertEquals(List.of(new AdjDiagnostic.MissingRenormalEntry(0, "object1", "a_RENORMAL")), report.adj());
        assertEquals("Mesh \"object1\" has the RENORMAL material \"a_RENORMAL\" but no corresponding entry in the "
                     + "model.adjb.", report.matl().get(0).message());
        assertEquals(1, report.forAdjacency(0).size());
        assertEquals(report.adj(), report.forKind(FileKind.ADJ));
    }

    @Test
    void testRenormalMaterialWithAdjEntry() {
        var folder = folder(entry("a_RENORMAL", SHADER)).mesh(
        new MeshFile(List.of(meshObject("object1", "map1", "uvSet")))).modl(
        new ModlFile(List.of(new ModlEntry("object1", 0, "a_RENORMAL")))).adj(
        new AdjFile(List.of(AdjEntry.of(0)))).build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testRenormalDiagnosticUsesEntryIndex() {
        var folder = folder(entry("a", SHADER), entry("b_RENORMAL", SHADER)).mesh(
        new MeshFile(List.of(meshObject("object1", "map1", "uvSet"), meshObject("object2", "map1", "uvSet")))).modl(
        new ModlFile(List.of(new ModlEntry("object1", 0, "a"), new ModlEntry("object2", 0, "b_RENORMAL")))).adj(
        new AdjFile(List.of())).build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.RenormalMissingAdjEntry(1, "b_RENORMAL", "object2")),
                     report.matl());
        assertEquals(List.of(new AdjDiagnostic.MissingRenormalEntry(1, "object2", "b_RENORMAL")), report.adj());
    }

    @Test
    void testTextureFormatUsageAllInvalid() {
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE0, "texture0", ParamId.TEXTURE4,
                                              "texture4")).nutexb(texture("texture0", NutexbFormat.BC1_UNORM))
                                                          .nutexb(texture("texture4", NutexbFormat.BC2_SRGB))
                                                          .build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.UnexpectedTextureFormat(0, "a", ParamId.TEXTURE0, "texture0",
                                                                        NutexbFormat.BC1_UNORM),
                             new MatlDiagnostic.UnexpectedTextureFormat(0, "a", ParamId.TEXTURE4, "texture4",
                                                                        NutexbFormat.BC2_SRGB)), report.matl());
        assertEquals(List.of(new NutexbDiagnostic.FormatInvalidForUsage("texture0", NutexbFormat.BC1_UNORM,
                                                                        ParamId.TEXTURE0),
                             new NutexbDiagnostic.FormatInvalidForUsage("texture4", NutexbFormat.BC2_SRGB,
                                                                        ParamId.TEXTURE4)), report.nutexb());
        assertEquals("Texture \"texture0\" for material \"a\" has format BC1Unorm, but Texture0 expects an sRGB "
                     + "format.", report.matl().get(0).message());
        assertEquals("Texture \"texture4\" for material \"a\" has format BC2Srgb, but Texture4 does not expect an "
                     + "sRGB format.", report.matl().get(1).message());
        assertEquals("Texture \"texture0\" has format BC1Unorm, but Texture0 expects an sRGB format.",
                     report.nutexb().get(0).message());
        assertEquals("Texture \"texture4\" has format BC2Srgb, but Texture4 does not expect an sRGB format.",
                     report.nutexb().get(1).message());
    }

    @Test
    void testTextureFormatMirroredIntoNutexb() {
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE4, "texture4")).nutexb(
        texture("texture4.nutexb", NutexbFormat.BC7_SRGB)).build();

        var report = validator.validate(folder, database);

        assertEquals(1, report.matl().size());
        assertEquals(List.of(new NutexbDiagnostic.FormatInvalidForUsage("texture4.nutexb", NutexbFormat.BC7_SRGB,
                                                                        ParamId.TEXTURE4)), report.nutexb());
        assertEquals(1, report.forTexture("texture4.nutexb").size());
        assertEquals(2, report.size());
    }

    @Test
    void testTextureNamesIgnoreCaseAndExtension() {
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE0, "Texture0_col")).nutexb(
        texture("texture0_COL.nutexb", NutexbFormat.BC7_SRGB)).build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testFailedTextureOnlyChecksAssignment() {
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE4, "texture4")).nutexb(
        FileSlot.failed("texture4.nutexb", "unsupported format")).build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testTexturesOneMissing() {
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE0, "texture0", ParamId.TEXTURE4, "texture4",
                                              ParamId.TEXTURE7, ParamClassifier.REPLACE_CUBEMAP)).nutexb(
        texture("texture2", NutexbFormat.BC7_SRGB)).nutexb(texture("texture4", NutexbFormat.BC7_UNORM)).build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.MissingTexture(0, "a", ParamId.TEXTURE0, "texture0")), report.matl());
        assertEquals("Texture \"texture0\" assigned to param Texture0 for material \"a\" is missing.",
                     report.matl().get(0).message());
        assertTrue(report.nutexb().isEmpty());
    }

    @Test
    void testDefaultTexturesAreNotMissing() {
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE0, ParamClassifier.DEFAULT_WHITE, ParamId.TEXTURE4,
                                              ParamClassifier.DEFAULT_NORMAL, ParamId.TEXTURE5,
                                              ParamClassifier.DEFAULT_BLACK.toUpperCase())).build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testConfiguredDefaultTextures() {
        var config = ValidationConfiguration.builder().withDefaultTextureNames(List.of("custom_default")).build();
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE0, "custom_default", ParamId.TEXTURE7,
                                              ParamClassifier.REPLACE_CUBEMAP)).build();

        var report = new ConsistencyValidator(config).validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.MissingTexture(0, "a", ParamId.TEXTURE7,
                                                               ParamClassifier.REPLACE_CUBEMAP)), report.matl());
    }

    @Test
    void testTextureDimensionInvalid() {
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE0, "texture0", ParamId.TEXTURE7,
                                              "texture7")).nutexb(cubeTexture("texture0", NutexbFormat.BC1_SRGB))
                                                          .nutexb(texture("texture7", NutexbFormat.BC7_UNORM))
                                                          .build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.UnexpectedTextureDimension(0, "a", ParamId.TEXTURE0, "texture0",
                                                                           TextureDimension.TEXTURE_2D,
                                                                           TextureDimension.TEXTURE_CUBE),
                             new MatlDiagnostic.UnexpectedTextureDimension(0, "a", ParamId.TEXTURE7, "texture7",
                                                                           TextureDimension.TEXTURE_CUBE,
                                                                           TextureDimension.TEXTURE_2D)),
                     report.matl());
        assertEquals("Texture \"texture0\" for material \"a\" has dimensions TextureCube, but Texture0 requires "
                     + "Texture2d.", report.matl().get(0).message());
        assertEquals("Texture \"texture7\" for material \"a\" has dimensions Texture2d, but Texture7 requires "
                     + "TextureCube.", report.matl().get(1).message());
        assertTrue(report.nutexb().isEmpty());
    }

    @Test
    void testMeshSubIndicesSingleDuplicate() {
        var objects = List.of(MeshObject.of("a", 0), MeshObject.of("b", 1), MeshObject.of("a", 0),
                              MeshObject.of("c", 0));
        var folder = folder().mesh(new MeshFile(objects)).build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MeshDiagnostic.DuplicateSubIndex(2, "a", 0)), report.mesh());
        assertEquals("Mesh \"a\" repeats subindex 0. Subindices must be unique.", report.mesh().get(0).message());
        assertEquals(report.mesh(), report.forMeshObject(2));
    }

    @Test
    void testModelBindings() {
        var folder = folder(entry("a", "short")).mesh(new MeshFile(List.of(MeshObject.of("object1", 0)))).modl(
        new ModlFile(List.of(new ModlEntry("missing", 3, "a"), new ModlEntry("object1", 0, "b"),
                             new ModlEntry("object1", 0, "a")))).build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new ModlDiagnostic.InvalidMeshObject(0, "missing", 3),
                             new ModlDiagnostic.InvalidMaterial(1, "b")), report.modl());
        assertEquals("Mesh object \"missing\" with subindex 3 does not exist in the model.numshb.",
                     report.modl().get(0).message());
        assertEquals("Material \"b\" does not exist in the model.numatb.", report.modl().get(1).message());
        assertEquals(1, report.forModlEntry(1).size());
        assertTrue(report.forModlEntry(2).isEmpty());
    }

    @Test
    void testEmptyFolder() {
        assertTrue(validator.validate(ModelFolder.empty(FOLDER), database).isEmpty());
    }

    @Test
    void testNoMaterialFileSkipsEverything() {
        var duplicates = new MeshFile(List.of(MeshObject.of("a", 0), MeshObject.of("a", 0)));
        var folder = ModelFolder.builder(FOLDER).mesh(duplicates).build();

        assertSame(ValidationReport.empty(), validator.validate(folder, database));
    }

    @Test
    void testFailedMaterialFileSkipsEverything() {
        var duplicates = new MeshFile(List.of(MeshObject.of("a", 0), MeshObject.of("a", 0)));
        var folder = ModelFolder.builder(FOLDER)
                                .mesh(duplicates)
                                .matl(FileSlot.failed("model.numatb", "unexpected end of file"))
                                .build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testOnlyWellKnownMaterialFileIsValidated() {
        var other = new MatlFile(List.of(entryWithTextures("a", ParamId.TEXTURE0, "missing")));
        var folder = ModelFolder.builder(FOLDER).matl(FileSlot.parsed("alt.numatb", other)).build();

        assertTrue(validator.validate(folder, database).isEmpty());
    }

    @Test
    void testMaterialOnlyConfig() {
        var objects = List.of(MeshObject.of("a", 0), MeshObject.of("a", 0));
        var folder = folder(entryWithTextures("a", ParamId.TEXTURE0, "missing")).mesh(new MeshFile(objects))
                                                                                .modl(new ModlFile(List.of(
                                                                                new ModlEntry("b", 0, "c"))))
                                                                                .build();

        var full = validator.validate(folder, database);
        var materialOnly = new ConsistencyValidator(ValidationConfiguration.materialOnlyConfig()).validate(folder,
                                                                                                           database);

        assertEquals(1, full.mesh().size());
        assertEquals(2, full.modl().size());
        assertEquals(1, full.matl().size());
        assertTrue(materialOnly.mesh().isEmpty());
        assertTrue(materialOnly.modl().isEmpty());
        assertEquals(full.matl(), materialOnly.matl());
    }

    @Test
    void testValidationDoesNotModifyFolder() {
        var entry = entryWithTextures("a_RENORMAL", ParamId.TEXTURE0, "texture0");
        var before = entry.copy();
        var folder = folder(entry).mesh(new MeshFile(List.of(MeshObject.of("object1", 0)))).modl(
        new ModlFile(List.of(new ModlEntry("object1", 0, "a_RENORMAL")))).build();

        var first = validator.validate(folder, database);
        var second = validator.validate(folder, database);

        assertEquals(first, second);
        assertEquals(before, folder.findMatl().orElseThrow().entries().get(0));
    }

    @Test
    void testFailedMeshWithRenormalBindings() {
        var folder = folder(entry("a_RENORMAL", SHADER)).mesh(FileSlot.failed("model.numshb", "bad header"))
                                                         .modl(new ModlFile(List.of(new ModlEntry("object1", 0,
                                                                                                  "a_RENORMAL"))))
                                                         .adj(FileSlot.failed("model.adjb", "bad header"))
                                                         .build();

        var report = validator.validate(folder, database);

        assertEquals(List.of(new MatlDiagnostic.RenormalMissingAdj(0, "a_RENORMAL")), report.matl());
        assertTrue(report.mesh().isEmpty());
        assertTrue(report.modl().isEmpty());
        assertTrue(report.adj().isEmpty());
    }

    @Test
    void testConfig() {
        assertEquals(ValidationConfiguration.defaultConfig(), validator.getConfig());

        var config = ValidationConfiguration.materialOnlyConfig();
        assertSame(config, new ConsistencyValidator(config).getConfig());
    }

    @Test
    void testStripExtension() {
        assertEquals("texture0", ConsistencyValidator.stripExtension("texture0.nutexb"));
        assertEquals("texture0", ConsistencyValidator.stripExtension("texture0"));
        assertEquals(".hidden", ConsistencyValidator.stripExtension(".hidden"));
        assertEquals("/common/shader/sfxpbs/default_white",
                     ConsistencyValidator.stripExtension("/common/shader/sfxpbs/default_white"));
        assertTrue(ConsistencyValidator.matchesTexture("DEF_mario_001_col.nutexb", "def_mario_001_col"));
    }
}
