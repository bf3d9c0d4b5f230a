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
import com.hellblazer.verity.model.NutexbFormat;
import com.hellblazer.verity.model.ParamId;
import com.hellblazer.verity.model.TextureDimension;

import java.util.List;

import static com.hellblazer.verity.validation.Messages.quote;
import static com.hellblazer.verity.validation.Messages.srgbExpectation;

/**
 * Diagnostics reported against {@code model.numatb}. Material labels in user created files are not always unique,
 * so diagnostics are associated with material entries by index.
 *
 * @author hal.hildebrand
 */
public sealed interface MatlDiagnostic extends Diagnostic
permits MatlDiagnostic.MissingRequiredAttributes, MatlDiagnostic.UnexpectedTextureFormat,
        MatlDiagnostic.UnexpectedTextureDimension, MatlDiagnostic.MissingTexture,
        MatlDiagnostic.RenormalMissingAdjEntry, MatlDiagnostic.RenormalMissingAdj {

    int entryIndex();

    @Override
    default FileKind fileKind() {
        return FileKind.MATL;
    }

    String materialLabel();

    record MissingRequiredAttributes(int entryIndex, String materialLabel, String meshName,
                                     List<String> missingAttributes) implements MatlDiagnostic {
        public MissingRequiredAttributes {
            missingAttributes = List.copyOf(missingAttributes);
        }

        @Override
        public String message() {
            return "Mesh " + quote(meshName) + " is missing attributes " + String.join(", ", missingAttributes)
            + " required by assigned material " + quote(materialLabel) + ".";
        }
    }

    /**
     * The texture's color space does not match the parameter: color textures should be sRGB, data textures linear.
     */
    record UnexpectedTextureFormat(int entryIndex, String materialLabel, ParamId param, String textureName,
                                   NutexbFormat format) implements MatlDiagnostic {
        @Override
        public String message() {
            return "Texture " + quote(textureName) + " for material " + quote(materialLabel) + " has format " + format
            + ", but " + param + " " + srgbExpectation(param) + " an sRGB format.";
        }
    }

    record UnexpectedTextureDimension(int entryIndex, String materialLabel, ParamId param, String textureName,
                                      TextureDimension expected, TextureDimension actual) implements MatlDiagnostic {
        @Override
        public String message() {
            return "Texture " + quote(textureName) + " for material " + quote(materialLabel) + " has dimensions "
            + actual + ", but " + param + " requires " + expected + ".";
        }
    }

    /**
     * The texture name matches neither a texture file in the folder nor a built-in default texture.
     */
    record MissingTexture(int entryIndex, String materialLabel, ParamId param, String textureName)
    implements MatlDiagnostic {
        @Override
        public String message() {
            return "Texture " + quote(textureName) + " assigned to param " + param + " for material "
            + quote(materialLabel) + " is missing.";
        }
    }

    record RenormalMissingAdjEntry(int entryIndex, String materialLabel, String meshName) implements MatlDiagnostic {
        @Override
        public String message() {
            return "Mesh " + quote(meshName) + " has the RENORMAL material " + quote(materialLabel)
            + " but no corresponding entry in the model.adjb.";
        }
    }

    record RenormalMissingAdj(int entryIndex, String materialLabel) implements MatlDiagnostic {
        @Override
        public String message() {
            return "Material " + quote(materialLabel) + " is a RENORMAL material, but the model.adjb file is missing.";
        }
    }
}
