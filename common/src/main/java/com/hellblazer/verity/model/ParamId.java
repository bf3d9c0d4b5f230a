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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Identifier of a material parameter slot.
 *
 * <p>Each constant carries the numeric code used by the material file format. Constants are declared in ascending
 * code order, so {@link #compareTo} and {@link #code()} agree. Parameter lists are kept sorted by this code.
 *
 * <p>The {@link #label()} is the name used by the shader database and by JSON presets, e.g. {@code "CustomVector47"}.
 *
 * @author hal.hildebrand
 */
public enum ParamId {
    DIFFUSE(0x0, "Diffuse"),
    SPECULAR(0x1, "Specular"),
    AMBIENT(0x2, "Ambient"),
    BLEND_MAP(0x3, "BlendMap"),
    TRANSPARENCY(0x4, "Transparency"),
    DIFFUSE_MAP_LAYER1(0x5, "DiffuseMapLayer1"),
    COSINE_POWER(0x6, "CosinePower"),
    SPECULAR_POWER(0x7, "SpecularPower"),
    FRESNEL(0x8, "Fresnel"),
    ROUGHNESS(0x9, "Roughness"),
    EMISSIVE_SCALE(0xA, "EmissiveScale"),
    ENABLE_DIFFUSE(0xB, "EnableDiffuse"),
    ENABLE_SPECULAR(0xC, "EnableSpecular"),
    ENABLE_AMBIENT(0xD, "EnableAmbient"),
    DIFFUSE_MAP_LAYER2(0xE, "DiffuseMapLayer2"),
    ENABLE_TRANSPARENCY(0xF, "EnableTransparency"),
    ENABLE_OPACITY(0x10, "EnableOpacity"),
    ENABLE_COSINE_POWER(0x11, "EnableCosinePower"),
    ENABLE_SPECULAR_POWER(0x12, "EnableSpecularPower"),
    ENABLE_FRESNEL(0x13, "EnableFresnel"),
    ENABLE_ROUGHNESS(0x14, "EnableRoughness"),
    ENABLE_EMISSIVE_SCALE(0x15, "EnableEmissiveScale"),
    WORLD_MATRIX(0x16, "WorldMatrix"),
    VIEW_MATRIX(0x17, "ViewMatrix"),
    PROJECTION_MATRIX(0x18, "ProjectionMatrix"),
    WORLD_VIEW_MATRIX(0x19, "WorldViewMatrix"),
    VIEW_INVERSE_MATRIX(0x1A, "ViewInverseMatrix"),
    VIEW_PROJECTION_MATRIX(0x1B, "ViewProjectionMatrix"),
    WORLD_VIEW_PROJECTION_MATRIX(0x1C, "WorldViewProjectionMatrix"),
    WORLD_INVERSE_TRANSPOSE_MATRIX(0x1D, "WorldInverseTransposeMatrix"),
    DIFFUSE_MAP(0x1E, "DiffuseMap"),
    SPECULAR_MAP(0x1F, "SpecularMap"),
    AMBIENT_MAP(0x20, "AmbientMap"),
    EMISSIVE_MAP(0x21, "EmissiveMap"),
    SPECULAR_MAP_LAYER1(0x22, "SpecularMapLayer1"),
    TRANSPARENCY_MAP(0x23, "TransparencyMap"),
    NORMAL_MAP(0x24, "NormalMap"),
    DIFFUSE_CUBE_MAP(0x25, "DiffuseCubeMap"),
    REFLECTION_MAP(0x26, "ReflectionMap"),
    REFLECTION_CUBE_MAP(0x27, "ReflectionCubeMap"),
    REFRACTION_MAP(0x28, "RefractionMap"),
    AMBIENT_OCCLUSION_MAP(0x29, "AmbientOcclusionMap"),
    LIGHT_MAP(0x2A, "LightMap"),
    ANISOTROPIC_MAP(0x2B, "AnisotropicMap"),
    ROUGHNESS_MAP(0x2C, "RoughnessMap"),
    REFLECTION_MASK(0x2D, "ReflectionMask"),
    OPACITY_MASK(0x2E, "OpacityMask"),
    USE_DIFFUSE_MAP(0x2F, "UseDiffuseMap"),
    USE_SPECULAR_MAP(0x30, "UseSpecularMap"),
    USE_AMBIENT_MAP(0x31, "UseAmbientMap"),
    USE_EMISSIVE_MAP(0x32, "UseEmissiveMap"),
    USE_TRANSLUCENCY_MAP(0x33, "UseTranslucencyMap"),
    USE_TRANSPARENCY_MAP(0x34, "UseTransparencyMap"),
    USE_NORMAL_MAP(0x35, "UseNormalMap"),
    USE_DIFFUSE_CUBE_MAP(0x36, "UseDiffuseCubeMap"),
    USE_REFLECTION_MAP(0x37, "UseReflectionMap"),
    USE_REFLECTION_CUBE_MAP(0x38, "UseReflectionCubeMap"),
    USE_REFRACTION_MAP(0x39, "UseRefractionMap"),
    USE_AMBIENT_OCCLUSION_MAP(0x3A, "UseAmbientOcclusionMap"),
    USE_LIGHT_MAP(0x3B, "UseLightMap"),
    USE_ANISOTROPIC_MAP(0x3C, "UseAnisotropicMap"),
    USE_ROUGHNESS_MAP(0x3D, "UseRoughnessMap"),
    USE_REFLECTION_MASK(0x3E, "UseReflectionMask"),
    USE_OPACITY_MASK(0x3F, "UseOpacityMask"),
    DIFFUSE_SAMPLER(0x40, "DiffuseSampler"),
    SPECULAR_SAMPLER(0x41, "SpecularSampler"),
    NORMAL_SAMPLER(0x42, "NormalSampler"),
    REFLECTION_SAMPLER(0x43, "ReflectionSampler"),
    SPECULAR_MAP_LAYER2(0x44, "SpecularMapLayer2"),
    NORMAL_MAP_LAYER1(0x45, "NormalMapLayer1"),
    NORMAL_MAP_BC5(0x46, "NormalMapBc5"),
    NORMAL_MAP_LAYER2(0x47, "NormalMapLayer2"),
    ROUGHNESS_MAP_LAYER1(0x48, "RoughnessMapLayer1"),
    ROUGHNESS_MAP_LAYER2(0x49, "RoughnessMapLayer2"),
    USE_DIFFUSE_UV_TRANSFORM1(0x4A, "UseDiffuseUvTransform1"),
    USE_DIFFUSE_UV_TRANSFORM2(0x4B, "UseDiffuseUvTransform2"),
    USE_SPECULAR_UV_TRANSFORM1(0x4C, "UseSpecularUvTransform1"),
    USE_SPECULAR_UV_TRANSFORM2(0x4D, "UseSpecularUvTransform2"),
    USE_NORMAL_UV_TRANSFORM1(0x4E, "UseNormalUvTransform1"),
    USE_NORMAL_UV_TRANSFORM2(0x4F, "UseNormalUvTransform2"),
    SHADOW_DEPTH_BIAS(0x50, "ShadowDepthBias"),
    SHADOW_MAP0(0x51, "ShadowMap0"),
    SHADOW_MAP1(0x52, "ShadowMap1"),
    SHADOW_MAP2(0x53, "ShadowMap2"),
    SHADOW_MAP3(0x54, "ShadowMap3"),
    SHADOW_MAP4(0x55, "ShadowMap4"),
    SHADOW_MAP5(0x56, "ShadowMap5"),
    SHADOW_MAP6(0x57, "ShadowMap6"),
    SHADOW_MAP7(0x58, "ShadowMap7"),
    CAST_SHADOW(0x59, "CastShadow"),
    RECEIVE_SHADOW(0x5A, "ReceiveShadow"),
    SHADOW_MAP_SAMPLER(0x5B, "ShadowMapSampler"),
    TEXTURE0(0x5C, "Texture0"),
    TEXTURE1(0x5D, "Texture1"),
    TEXTURE2(0x5E, "Texture2"),
    TEXTURE3(0x5F, "Texture3"),
    TEXTURE4(0x60, "Texture4"),
    TEXTURE5(0x61, "Texture5"),
    TEXTURE6(0x62, "Texture6"),
    TEXTURE7(0x63, "Texture7"),
    TEXTURE8(0x64, "Texture8"),
    TEXTURE9(0x65, "Texture9"),
    TEXTURE10(0x66, "Texture10"),
    TEXTURE11(0x67, "Texture11"),
    TEXTURE12(0x68, "Texture12"),
    TEXTURE13(0x69, "Texture13"),
    TEXTURE14(0x6A, "Texture14"),
    SAMPLER0(0x6B, "Sampler0"),
    SAMPLER1(0x6C, "Sampler1"),
    SAMPLER2(0x6D, "Sampler2"),
    SAMPLER3(0x6E, "Sampler3"),
    SAMPLER4(0x6F, "Sampler4"),
    SAMPLER5(0x70, "Sampler5"),
    SAMPLER6(0x71, "Sampler6"),
    SAMPLER7(0x72, "Sampler7"),
    SAMPLER8(0x73, "Sampler8"),
    SAMPLER9(0x74, "Sampler9"),
    SAMPLER10(0x75, "Sampler10"),
    SAMPLER11(0x76, "Sampler11"),
    SAMPLER12(0x77, "Sampler12"),
    SAMPLER13(0x78, "Sampler13"),
    SAMPLER14(0x79, "Sampler14"),
    CUSTOM_BUFFER0(0x7A, "CustomBuffer0"),
    CUSTOM_BUFFER1(0x7B, "CustomBuffer1"),
    CUSTOM_BUFFER2(0x7C, "CustomBuffer2"),
    CUSTOM_BUFFER3(0x7D, "CustomBuffer3"),
    CUSTOM_BUFFER4(0x7E, "CustomBuffer4"),
    CUSTOM_BUFFER5(0x7F, "CustomBuffer5"),
    CUSTOM_BUFFER6(0x80, "CustomBuffer6"),
    CUSTOM_BUFFER7(0x81, "CustomBuffer7"),
    CUSTOM_BUFFER8(0x82, "CustomBuffer8"),
    CUSTOM_BUFFER9(0x83, "CustomBuffer9"),
    CUSTOM_MATRIX0(0x84, "CustomMatrix0"),
    CUSTOM_MATRIX1(0x85, "CustomMatrix1"),
    CUSTOM_MATRIX2(0x86, "CustomMatrix2"),
    CUSTOM_MATRIX3(0x87, "CustomMatrix3"),
    CUSTOM_MATRIX4(0x88, "CustomMatrix4"),
    CUSTOM_MATRIX5(0x89, "CustomMatrix5"),
    CUSTOM_MATRIX6(0x8A, "CustomMatrix6"),
    CUSTOM_MATRIX7(0x8B, "CustomMatrix7"),
    CUSTOM_MATRIX8(0x8C, "CustomMatrix8"),
    CUSTOM_MATRIX9(0x8D, "CustomMatrix9"),
    CUSTOM_MATRIX10(0x8E, "CustomMatrix10"),
    CUSTOM_MATRIX11(0x8F, "CustomMatrix11"),
    CUSTOM_MATRIX12(0x90, "CustomMatrix12"),
    CUSTOM_MATRIX13(0x91, "CustomMatrix13"),
    CUSTOM_MATRIX14(0x92, "CustomMatrix14"),
    CUSTOM_MATRIX15(0x93, "CustomMatrix15"),
    CUSTOM_MATRIX16(0x94, "CustomMatrix16"),
    CUSTOM_MATRIX17(0x95, "CustomMatrix17"),
    CUSTOM_MATRIX18(0x96, "CustomMatrix18"),
    CUSTOM_MATRIX19(0x97, "CustomMatrix19"),
    CUSTOM_VECTOR0(0x98, "CustomVector0"),
    CUSTOM_VECTOR1(0x99, "CustomVector1"),
    CUSTOM_VECTOR2(0x9A, "CustomVector2"),
    CUSTOM_VECTOR3(0x9B, "CustomVector3"),
    CUSTOM_VECTOR4(0x9C, "CustomVector4"),
    CUSTOM_VECTOR5(0x9D, "CustomVector5"),
    CUSTOM_VECTOR6(0x9E, "CustomVector6"),
    CUSTOM_VECTOR7(0x9F, "CustomVector7"),
    CUSTOM_VECTOR8(0xA0, "CustomVector8"),
    CUSTOM_VECTOR9(0xA1, "CustomVector9"),
    CUSTOM_VECTOR10(0xA2, "CustomVector10"),
    CUSTOM_VECTOR11(0xA3, "CustomVector11"),
    CUSTOM_VECTOR12(0xA4, "CustomVector12"),
    CUSTOM_VECTOR13(0xA5, "CustomVector13"),
    CUSTOM_VECTOR14(0xA6, "CustomVector14"),
    CUSTOM_VECTOR15(0xA7, "CustomVector15"),
    CUSTOM_VECTOR16(0xA8, "CustomVector16"),
    CUSTOM_VECTOR17(0xA9, "CustomVector17"),
    CUSTOM_VECTOR18(0xAA, "CustomVector18"),
    CUSTOM_VECTOR19(0xAB, "CustomVector19"),
    CUSTOM_INTEGER0(0xAC, "CustomInteger0"),
    CUSTOM_INTEGER1(0xAD, "CustomInteger1"),
    CUSTOM_INTEGER2(0xAE, "CustomInteger2"),
    CUSTOM_INTEGER3(0xAF, "CustomInteger3"),
    CUSTOM_INTEGER4(0xB0, "CustomInteger4"),
    CUSTOM_INTEGER5(0xB1, "CustomInteger5"),
    CUSTOM_INTEGER6(0xB2, "CustomInteger6"),
    CUSTOM_INTEGER7(0xB3, "CustomInteger7"),
    CUSTOM_INTEGER8(0xB4, "CustomInteger8"),
    CUSTOM_INTEGER9(0xB5, "CustomInteger9"),
    CUSTOM_INTEGER10(0xB6, "CustomInteger10"),
    CUSTOM_INTEGER11(0xB7, "CustomInteger11"),
    CUSTOM_INTEGER12(0xB8, "CustomInteger12"),
    CUSTOM_INTEGER13(0xB9, "CustomInteger13"),
    CUSTOM_INTEGER14(0xBA, "CustomInteger14"),
    CUSTOM_INTEGER15(0xBB, "CustomInteger15"),
    CUSTOM_INTEGER16(0xBC, "CustomInteger16"),
    CUSTOM_INTEGER17(0xBD, "CustomInteger17"),
    CUSTOM_INTEGER18(0xBE, "CustomInteger18"),
    CUSTOM_INTEGER19(0xBF, "CustomInteger19"),
    CUSTOM_FLOAT0(0xC0, "CustomFloat0"),
    CUSTOM_FLOAT1(0xC1, "CustomFloat1"),
    CUSTOM_FLOAT2(0xC2, "CustomFloat2"),
    CUSTOM_FLOAT3(0xC3, "CustomFloat3"),
    CUSTOM_FLOAT4(0xC4, "CustomFloat4"),
    CUSTOM_FLOAT5(0xC5, "CustomFloat5"),
    CUSTOM_FLOAT6(0xC6, "CustomFloat6"),
    CUSTOM_FLOAT7(0xC7, "CustomFloat7"),
    CUSTOM_FLOAT8(0xC8, "CustomFloat8"),
    CUSTOM_FLOAT9(0xC9, "CustomFloat9"),
    CUSTOM_FLOAT10(0xCA, "CustomFloat10"),
    CUSTOM_FLOAT11(0xCB, "CustomFloat11"),
    CUSTOM_FLOAT12(0xCC, "CustomFloat12"),
    CUSTOM_FLOAT13(0xCD, "CustomFloat13"),
    CUSTOM_FLOAT14(0xCE, "CustomFloat14"),
    CUSTOM_FLOAT15(0xCF, "CustomFloat15"),
    CUSTOM_FLOAT16(0xD0, "CustomFloat16"),
    CUSTOM_FLOAT17(0xD1, "CustomFloat17"),
    CUSTOM_FLOAT18(0xD2, "CustomFloat18"),
    CUSTOM_FLOAT19(0xD3, "CustomFloat19"),
    CUSTOM_STRING0(0xD4, "CustomString0"),
    CUSTOM_STRING1(0xD5, "CustomString1"),
    CUSTOM_STRING2(0xD6, "CustomString2"),
    CUSTOM_STRING3(0xD7, "CustomString3"),
    CUSTOM_STRING4(0xD8, "CustomString4"),
    CUSTOM_STRING5(0xD9, "CustomString5"),
    CUSTOM_STRING6(0xDA, "CustomString6"),
    CUSTOM_STRING7(0xDB, "CustomString7"),
    CUSTOM_STRING8(0xDC, "CustomString8"),
    CUSTOM_STRING9(0xDD, "CustomString9"),
    CUSTOM_STRING10(0xDE, "CustomString10"),
    CUSTOM_STRING11(0xDF, "CustomString11"),
    CUSTOM_STRING12(0xE0, "CustomString12"),
    CUSTOM_STRING13(0xE1, "CustomString13"),
    CUSTOM_STRING14(0xE2, "CustomString14"),
    CUSTOM_STRING15(0xE3, "CustomString15"),
    CUSTOM_STRING16(0xE4, "CustomString16"),
    CUSTOM_STRING17(0xE5, "CustomString17"),
    CUSTOM_STRING18(0xE6, "CustomString18"),
    CUSTOM_STRING19(0xE7, "CustomString19"),
    CUSTOM_BOOLEAN0(0xE8, "CustomBoolean0"),
    CUSTOM_BOOLEAN1(0xE9, "CustomBoolean1"),
    CUSTOM_BOOLEAN2(0xEA, "CustomBoolean2"),
    CUSTOM_BOOLEAN3(0xEB, "CustomBoolean3"),
    CUSTOM_BOOLEAN4(0xEC, "CustomBoolean4"),
    CUSTOM_BOOLEAN5(0xED, "CustomBoolean5"),
    CUSTOM_BOOLEAN6(0xEE, "CustomBoolean6"),
    CUSTOM_BOOLEAN7(0xEF, "CustomBoolean7"),
    CUSTOM_BOOLEAN8(0xF0, "CustomBoolean8"),
    CUSTOM_BOOLEAN9(0xF1, "CustomBoolean9"),
    CUSTOM_BOOLEAN10(0xF2, "CustomBoolean10"),
    CUSTOM_BOOLEAN11(0xF3, "CustomBoolean11"),
    CUSTOM_BOOLEAN12(0xF4, "CustomBoolean12"),
    CUSTOM_BOOLEAN13(0xF5, "CustomBoolean13"),
    CUSTOM_BOOLEAN14(0xF6, "CustomBoolean14"),
    CUSTOM_BOOLEAN15(0xF7, "CustomBoolean15"),
    CUSTOM_BOOLEAN16(0xF8, "CustomBoolean16"),
    CUSTOM_BOOLEAN17(0xF9, "CustomBoolean17"),
    CUSTOM_BOOLEAN18(0xFA, "CustomBoolean18"),
    CUSTOM_BOOLEAN19(0xFB, "CustomBoolean19"),
    UV_TRANSFORM0(0xFC, "UvTransform0"),
    UV_TRANSFORM1(0xFD, "UvTransform1"),
    UV_TRANSFORM2(0xFE, "UvTransform2"),
    UV_TRANSFORM3(0xFF, "UvTransform3"),
    UV_TRANSFORM4(0x100, "UvTransform4"),
    UV_TRANSFORM5(0x101, "UvTransform5"),
    UV_TRANSFORM6(0x102, "UvTransform6"),
    UV_TRANSFORM7(0x103, "UvTransform7"),
    UV_TRANSFORM8(0x104, "UvTransform8"),
    UV_TRANSFORM9(0x105, "UvTransform9"),
    BLEND_STATE0(0x118, "BlendState0"),
    BLEND_STATE1(0x119, "BlendState1"),
    BLEND_STATE2(0x11A, "BlendState2"),
    BLEND_STATE3(0x11B, "BlendState3"),
    BLEND_STATE4(0x11C, "BlendState4"),
    BLEND_STATE5(0x11D, "BlendState5"),
    BLEND_STATE6(0x11E, "BlendState6"),
    BLEND_STATE7(0x11F, "BlendState7"),
    BLEND_STATE8(0x120, "BlendState8"),
    BLEND_STATE9(0x121, "BlendState9"),
    BLEND_STATE10(0x122, "BlendState10"),
    RASTERIZER_STATE0(0x123, "RasterizerState0"),
    RASTERIZER_STATE1(0x124, "RasterizerState1"),
    RASTERIZER_STATE2(0x125, "RasterizerState2"),
    RASTERIZER_STATE3(0x126, "RasterizerState3"),
    RASTERIZER_STATE4(0x127, "RasterizerState4"),
    RASTERIZER_STATE5(0x128, "RasterizerState5"),
    RASTERIZER_STATE6(0x129, "RasterizerState6"),
    RASTERIZER_STATE7(0x12A, "RasterizerState7"),
    RASTERIZER_STATE8(0x12B, "RasterizerState8"),
    RASTERIZER_STATE9(0x12C, "RasterizerState9"),
    RASTERIZER_STATE10(0x12D, "RasterizerState10"),
    CUSTOM_VECTOR20(0x136, "CustomVector20"),
    CUSTOM_VECTOR21(0x137, "CustomVector21"),
    CUSTOM_VECTOR22(0x138, "CustomVector22"),
    CUSTOM_VECTOR23(0x139, "CustomVector23"),
    CUSTOM_VECTOR24(0x13A, "CustomVector24"),
    CUSTOM_VECTOR25(0x13B, "CustomVector25"),
    CUSTOM_VECTOR26(0x13C, "CustomVector26"),
    CUSTOM_VECTOR27(0x13D, "CustomVector27"),
    CUSTOM_VECTOR28(0x13E, "CustomVector28"),
    CUSTOM_VECTOR29(0x13F, "CustomVector29"),
    CUSTOM_VECTOR30(0x140, "CustomVector30"),
    CUSTOM_VECTOR31(0x141, "CustomVector31"),
    CUSTOM_VECTOR32(0x142, "CustomVector32"),
    CUSTOM_VECTOR33(0x143, "CustomVector33"),
    CUSTOM_VECTOR34(0x144, "CustomVector34"),
    CUSTOM_VECTOR35(0x145, "CustomVector35"),
    CUSTOM_VECTOR36(0x146, "CustomVector36"),
    CUSTOM_VECTOR37(0x147, "CustomVector37"),
    CUSTOM_VECTOR38(0x148, "CustomVector38"),
    CUSTOM_VECTOR39(0x149, "CustomVector39"),
    CUSTOM_VECTOR40(0x14A, "CustomVector40"),
    CUSTOM_VECTOR41(0x14B, "CustomVector41"),
    CUSTOM_VECTOR42(0x14C, "CustomVector42"),
    CUSTOM_VECTOR43(0x14D, "CustomVector43"),
    CUSTOM_VECTOR44(0x14E, "CustomVector44"),
    CUSTOM_VECTOR45(0x14F, "CustomVector45"),
    CUSTOM_VECTOR46(0x150, "CustomVector46"),
    CUSTOM_VECTOR47(0x151, "CustomVector47"),
    CUSTOM_VECTOR48(0x152, "CustomVector48"),
    CUSTOM_VECTOR49(0x153, "CustomVector49"),
    CUSTOM_VECTOR50(0x154, "CustomVector50"),
    CUSTOM_VECTOR51(0x155, "CustomVector51"),
    CUSTOM_VECTOR52(0x156, "CustomVector52"),
    CUSTOM_VECTOR53(0x157, "CustomVector53"),
    CUSTOM_VECTOR54(0x158, "CustomVector54"),
    CUSTOM_VECTOR55(0x159, "CustomVector55"),
    CUSTOM_VECTOR56(0x15A, "CustomVector56"),
    CUSTOM_VECTOR57(0x15B, "CustomVector57"),
    CUSTOM_VECTOR58(0x15C, "CustomVector58"),
    CUSTOM_VECTOR59(0x15D, "CustomVector59"),
    CUSTOM_VECTOR60(0x15E, "CustomVector60"),
    CUSTOM_VECTOR61(0x15F, "CustomVector61"),
    CUSTOM_VECTOR62(0x160, "CustomVector62"),
    CUSTOM_VECTOR63(0x161, "CustomVector63"),
    TEXTURE15(0x162, "Texture15"),
    TEXTURE16(0x163, "Texture16"),
    TEXTURE17(0x164, "Texture17"),
    TEXTURE18(0x165, "Texture18"),
    TEXTURE19(0x166, "Texture19"),
    SAMPLER15(0x167, "Sampler15"),
    SAMPLER16(0x168, "Sampler16"),
    SAMPLER17(0x169, "Sampler17"),
    SAMPLER18(0x16A, "Sampler18"),
    SAMPLER19(0x16B, "Sampler19");

    private static final Map<String, ParamId> BY_LABEL;

    static {
        var byLabel = new HashMap<String, ParamId>();
        for (var id : values()) {
            byLabel.put(id.label, id);
        }
        BY_LABEL = Collections.unmodifiableMap(byLabel);
    }

    private final int    code;
    private final String label;

    ParamId(int code, String label) {
        this.code = code;
        this.label = label;
    }

    /**
     * Resolve a parameter by its label, e.g. {@code "Texture4"}.
     */
    public static Optional<ParamId> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    /**
     * The numeric code from the material file format. Parameter lists are sorted ascending by this value.
     */
    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
