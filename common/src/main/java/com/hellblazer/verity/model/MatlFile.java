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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed material file ({@code model.numatb}). Entries are edited in place.
 *
 * @author hal.hildebrand
 */
public class MatlFile {
    private final int                 majorVersion;
    private final int                 minorVersion;
    private final List<MaterialEntry> entries;

    public MatlFile(List<MaterialEntry> entries) {
        this(1, 6, entries);
    }

    public MatlFile(int majorVersion, int minorVersion, List<MaterialEntry> entries) {
        this.majorVersion = majorVersion;
        this.minorVersion = minorVersion;
        this.entries = new ArrayList<>(entries);
    }

    public List<MaterialEntry> entries() {
        return entries;
    }

    /**
     * First entry with the given label. Labels in user created files are not always unique.
     */
    public Optional<MaterialEntry> findEntry(String materialLabel) {
        return entries.stream().filter(e -> e.getMaterialLabel().equals(materialLabel)).findFirst();
    }

    public int majorVersion() {
        return majorVersion;
    }

    public int minorVersion() {
        return minorVersion;
    }
}
