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
package com.hellblazer.verity.shader;

import java.util.Optional;

/**
 * Read-only source of shader programs keyed by program name. A material's shader label is the program name followed
 * by a render pass suffix, e.g. {@code SFX_PBS_0100000008008269_opaque}.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ShaderProgramLookup {

    /**
     * Length of the program name prefix of a shader label.
     */
    int PROGRAM_NAME_LENGTH = 24;

    /**
     * The program name of a shader label. Labels shorter than the prefix have no program name and map to the empty
     * string.
     */
    static String programName(String shaderLabel) {
        if (shaderLabel == null || shaderLabel.length() < PROGRAM_NAME_LENGTH) {
            return "";
        }
        return shaderLabel.substring(0, PROGRAM_NAME_LENGTH);
    }

    /**
     * The render pass suffix of a shader label, e.g. {@code opaque}, or empty when the label has none.
     */
    static String renderPass(String shaderLabel) {
        if (shaderLabel == null || shaderLabel.length() <= PROGRAM_NAME_LENGTH + 1) {
            return "";
        }
        return shaderLabel.substring(PROGRAM_NAME_LENGTH + 1);
    }

    Optional<ShaderProgram> get(String programName);

    default boolean isValidShaderLabel(String shaderLabel) {
        return programForShaderLabel(shaderLabel).isPresent();
    }

    default Optional<ShaderProgram> programForShaderLabel(String shaderLabel) {
        return get(programName(shaderLabel));
    }
}
