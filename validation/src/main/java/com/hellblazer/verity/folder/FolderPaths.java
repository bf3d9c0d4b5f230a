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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;

/**
 * Short names for folders and files shown in editor titles and the folder list.
 *
 * @author hal.hildebrand
 */
public final class FolderPaths {

    private FolderPaths() {
    }

    /**
     * Enough trailing components to tell folders apart: {@code fighter/mario/motion/body/c00} becomes
     * {@code mario/motion/body/c00}.
     */
    public static String displayName(Path folder) {
        var components = new ArrayList<String>();
        for (int i = folder.getNameCount() - 1; i >= 0 && components.size() < 4; i--) {
            components.add(folder.getName(i).toString());
        }
        Collections.reverse(components);
        var name = String.join("/", components);
        if (components.size() < 4 && folder.getRoot() != null) {
            var root = folder.getRoot().toString();
            return root.endsWith("/") || root.endsWith("\\") ? root + name : root + "/" + name;
        }
        return name;
    }

    /**
     * The folder name and file name: {@code fighter/mario/motion/body/c00} and {@code model.numatb} give
     * {@code c00/model.numatb}.
     */
    public static String editorTitle(Path folder, String fileName) {
        var folderName = folder.getFileName();
        return (folderName == null ? "" : folderName.toString()) + "/" + fileName;
    }
}
