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

import java.util.EnumMap;
import java.util.Map;

/**
 * Unsaved change flags, one per file slot of a model folder.
 *
 * @author hal.hildebrand
 */
public class FileChanged {
    private final Map<FileKind, boolean[]> flags = new EnumMap<>(FileKind.class);

    private FileChanged(ModelFolder folder) {
        for (var kind : FileKind.values()) {
            flags.put(kind, new boolean[folder.slotCount(kind)]);
        }
    }

    /**
     * No changes for any slot of the folder.
     */
    public static FileChanged from(ModelFolder folder) {
        return new FileChanged(folder);
    }

    public boolean anyChanged() {
        for (var changed : flags.values()) {
            for (var flag : changed) {
                if (flag) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean isChanged(FileKind kind, int index) {
        var changed = flags.get(kind);
        return index >= 0 && index < changed.length && changed[index];
    }

    /**
     * Mark or clear a slot. Indices outside the folder's slots are ignored.
     */
    public void set(FileKind kind, int index, boolean changed) {
        var slots = flags.get(kind);
        if (index >= 0 && index < slots.length) {
            slots[index] = changed;
        }
    }

    public int slotCount(FileKind kind) {
        return flags.get(kind).length;
    }
}
