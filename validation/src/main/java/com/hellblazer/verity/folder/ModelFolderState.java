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

import com.hellblazer.verity.model.FileKind;
import com.hellblazer.verity.model.ModelFolder;
import com.hellblazer.verity.shader.ShaderProgramLookup;
import com.hellblazer.verity.validation.ConsistencyValidator;
import com.hellblazer.verity.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * An open model folder together with its latest validation report and unsaved change flags.
 *
 * @author hal.hildebrand
 */
public class ModelFolderState {
    private static final Logger log = LoggerFactory.getLogger(ModelFolderState.class);

    private final Path             swingPrc;
    private       ModelFolder      folder;
    private       ValidationReport report = ValidationReport.empty();
    private       FileChanged      changed;

    public ModelFolderState(ModelFolder folder) {
        this(folder, null);
    }

    /**
     * @param swingPrc physics configuration ({@code swing.prc}) found for the folder, or null
     */
    public ModelFolderState(ModelFolder folder, Path swingPrc) {
        this.folder = Objects.requireNonNull(folder, "folder");
        this.swingPrc = swingPrc;
        this.changed = FileChanged.from(folder);
    }

    public FileChanged getChanged() {
        return changed;
    }

    public ModelFolder getFolder() {
        return folder;
    }

    public ValidationReport getReport() {
        return report;
    }

    public Optional<Path> getSwingPrc() {
        return Optional.ofNullable(swingPrc);
    }

    /**
     * Whether the folder has any of the files used to render a model. Folders with only animations or textures are
     * not model folders.
     */
    public boolean isModelFolder() {
        return !folder.meshes().isEmpty() || !folder.modls().isEmpty() || !folder.skels().isEmpty()
               || !folder.matls().isEmpty();
    }

    public void markChanged(FileKind kind, int index) {
        changed.set(kind, index, true);
    }

    /**
     * Read the folder again, discarding unsaved changes. The report is kept until the next {@link #validate}.
     *
     * @throws IOException if the folder cannot be read, in which case the state is unchanged
     */
    public void reload(FolderLoader loader) throws IOException {
        var reloaded = loader.load(folder.folderPath());
        folder = reloaded;
        changed = FileChanged.from(reloaded);
        log.debug("Reloaded {}", folder.folderPath());
    }

    /**
     * Replace the report with a fresh validation of the current folder.
     */
    public ValidationReport validate(ConsistencyValidator validator, ShaderProgramLookup lookup) {
        report = validator.validate(folder, lookup);
        return report;
    }
}
