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
package com.hellblazer.verity.material;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.verity.model.BlendStateData;
import com.hellblazer.verity.model.MaterialEntry;
import com.hellblazer.verity.model.MaterialParam;
import com.hellblazer.verity.model.ParamId;
import com.hellblazer.verity.model.RasterizerStateData;
import com.hellblazer.verity.model.SamplerData;

import javax.vecmath.Vector4f;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for material entries, used for material presets and for copying materials between folders.
 *
 * <pre>
 * { "majorVersion": 1, "minorVersion": 6,
 *   "entries": [ { "materialLabel": "...", "shaderLabel": "...",
 *                  "booleans": [ { "paramId": "CustomBoolean1", "data": true } ],
 *                  "vectors":  [ { "paramId": "CustomVector0", "data": [0.0, 0.0, 0.0, 0.0] } ],
 *                  "samplers": [ { "paramId": "Sampler0", "data": { "wrapS": "REPEAT" } } ] } ] }
 * </pre>
 * <p>
 * Absent lists are empty. Absent fields of sampler, blend and rasterizer state objects take the type's default.
 *
 * @author hal.hildebrand
 */
public final class MaterialJson {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MaterialJson() {
    }

    /**
     * Decode one entry.
     *
     * @throws IOException if a field is missing or has the wrong type, a parameter label is unknown or a parameter
     *                     is stored in the list of another kind
     */
    public static MaterialEntry fromJson(JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Material entry must be an object");
        }
        var entry = new MaterialEntry(requiredText(node, "materialLabel"), requiredText(node, "shaderLabel"));
        readParams(node, "booleans", ParamKind.BOOLEAN, entry.booleans(), MaterialJson::readBoolean);
        readParams(node, "floats", ParamKind.FLOAT, entry.floats(), MaterialJson::readFloat);
        readParams(node, "vectors", ParamKind.VECTOR4, entry.vectors(), MaterialJson::readVector);
        readParams(node, "textures", ParamKind.TEXTURE, entry.textures(), MaterialJson::readText);
        readParams(node, "samplers", ParamKind.SAMPLER, entry.samplers(), MaterialJson::readSampler);
        readParams(node, "blendStates", ParamKind.BLEND_STATE, entry.blendStates(), MaterialJson::readBlendState);
        readParams(node, "rasterizerStates", ParamKind.RASTERIZER_STATE, entry.rasterizerStates(),
                   MaterialJson::readRasterizerState);
        return entry;
    }

    /**
     * Read the entries of a material document.
     */
    public static List<MaterialEntry> readEntries(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.has("entries") || !root.get("entries").isArray()) {
            throw new IOException("Material document has no \"entries\" array");
        }
        var entries = new ArrayList<MaterialEntry>();
        for (var node : root.get("entries")) {
            entries.add(fromJson(node));
        }
        return entries;
    }

    public static ObjectNode toJson(MaterialEntry entry) {
        var node = objectMapper.createObjectNode();
        node.put("materialLabel", entry.getMaterialLabel());
        node.put("shaderLabel", entry.getShaderLabel());
        writeParams(node.putArray("booleans"), entry.booleans(), (param, value) -> param.put("data", value));
        writeParams(node.putArray("floats"), entry.floats(), (param, value) -> param.put("data", value));
        writeParams(node.putArray("vectors"), entry.vectors(), (param, value) -> {
            var data = param.putArray("data");
            data.add(value.x).add(value.y).add(value.z).add(value.w);
        });
        writeParams(node.putArray("textures"), entry.textures(), (param, value) -> param.put("data", value));
        writeParams(node.putArray("samplers"), entry.samplers(), (param, value) -> {
            var data = param.putObject("data");
            data.put("wrapS", value.wrapS().name());
            data.put("wrapT", value.wrapT().name());
            data.put("wrapR", value.wrapR().name());
            data.put("minFilter", value.minFilter().name());
            data.put("magFilter", value.magFilter().name());
            var border = value.borderColor();
            data.putArray("borderColor").add(border.x).add(border.y).add(border.z).add(border.w);
            data.put("lodBias", value.lodBias());
            data.put("maxAnisotropy", value.maxAnisotropy());
        });
        writeParams(node.putArray("blendStates"), entry.blendStates(), (param, value) -> {
            var data = param.putObject("data");
            data.put("sourceColor", value.sourceColor().name());
            data.put("destinationColor", value.destinationColor().name());
            data.put("alphaSampleToCoverage", value.alphaSampleToCoverage());
        });
        writeParams(node.putArray("rasterizerStates"), entry.rasterizerStates(), (param, value) -> {
            var data = param.putObject("data");
            data.put("fillMode", value.fillMode().name());
            data.put("cullMode", value.cullMode().name());
            data.put("depthBias", value.depthBias());
        });
        return node;
    }

    /**
     * Write a material document with the given entries, pretty printed.
     */
    public static void writeEntries(OutputStream os, List<MaterialEntry> entries) throws IOException {
        var root = objectMapper.createObjectNode();
        root.put("majorVersion", 1);
        root.put("minorVersion", 6);
        var array = root.putArray("entries");
        entries.forEach(e -> array.add(toJson(e)));
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(os, root);
    }

    private static <E extends Enum<E>> E enumField(JsonNode data, String field, Class<E> type, E defaultValue)
    throws IOException {
        var node = data.get(field);
        if (node == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, node.asText());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown " + type.getSimpleName() + " for " + field + ": " + node.asText(), e);
        }
    }

    private static float floatField(JsonNode data, String field, float defaultValue) throws IOException {
        var node = data.get(field);
        if (node == null) {
            return defaultValue;
        }
        if (!node.isNumber()) {
            throw new IOException("Expected a number for " + field);
        }
        return (float) node.asDouble();
    }

    private static BlendStateData readBlendState(JsonNode data) throws IOException {
        requireObject(data);
        var defaults = BlendStateData.defaults();
        return new BlendStateData(
        enumField(data, "sourceColor", BlendStateData.BlendFactor.class, defaults.sourceColor()),
        enumField(data, "destinationColor", BlendStateData.BlendFactor.class, defaults.destinationColor()),
        data.path("alphaSampleToCoverage").asBoolean(defaults.alphaSampleToCoverage()));
    }

    private static Boolean readBoolean(JsonNode data) throws IOException {
        if (!data.isBoolean()) {
            throw new IOException("Expected a boolean");
        }
        return data.asBoolean();
    }

    private static Float readFloat(JsonNode data) throws IOException {
        if (!data.isNumber()) {
            throw new IOException("Expected a number");
        }
        return (float) data.asDouble();
    }

    private static <T> void readParams(JsonNode node, String field, ParamKind kind, List<MaterialParam<T>> params,
                                       Reader<T> reader) throws IOException {
        var array = node.get(field);
        if (array == null) {
            return;
        }
        if (!array.isArray()) {
            throw new IOException("Expected an array for " + field);
        }
        for (var param : array) {
            var label = requiredText(param, "paramId");
            var id = ParamId.fromLabel(label).orElseThrow(() -> new IOException("Unknown parameter: " + label));
            if (ParamClassifier.kindOf(id) != kind) {
                throw new IOException(label + " cannot be stored in " + field);
            }
            var data = param.get("data");
            if (data == null) {
                throw new IOException("Missing data for " + label);
            }
            params.add(MaterialParam.of(id, reader.read(data)));
        }
    }

    private static RasterizerStateData readRasterizerState(JsonNode data) throws IOException {
        requireObject(data);
        var defaults = RasterizerStateData.defaults();
        return new RasterizerStateData(
        enumField(data, "fillMode", RasterizerStateData.FillMode.class, defaults.fillMode()),
        enumField(data, "cullMode", RasterizerStateData.CullMode.class, defaults.cullMode()),
        floatField(data, "depthBias", defaults.depthBias()));
    }

    private static SamplerData readSampler(JsonNode data) throws IOException {
        requireObject(data);
        var defaults = SamplerData.defaults();
        var border = data.has("borderColor") ? readVector(data.get("borderColor")) : defaults.borderColor();
        var anisotropy = data.has("maxAnisotropy") ? data.get("maxAnisotropy").asInt() : defaults.maxAnisotropy();
        if (anisotropy < 1) {
            throw new IOException("maxAnisotropy must be at least 1: " + anisotropy);
        }
        return new SamplerData(enumField(data, "wrapS", SamplerData.WrapMode.class, defaults.wrapS()),
                               enumField(data, "wrapT", SamplerData.WrapMode.class, defaults.wrapT()),
                               enumField(data, "wrapR", SamplerData.WrapMode.class, defaults.wrapR()),
                               enumField(data, "minFilter", SamplerData.MinFilter.class, defaults.minFilter()),
                               enumField(data, "magFilter", SamplerData.MagFilter.class, defaults.magFilter()),
                               border, floatField(data, "lodBias", defaults.lodBias()), anisotropy);
    }

    private static String readText(JsonNode data) throws IOException {
        if (!data.isTextual()) {
            throw new IOException("Expected a string");
        }
        return data.asText();
    }

    private static Vector4f readVector(JsonNode data) throws IOException {
        if (!data.isArray() || data.size() != 4) {
            throw new IOException("Expected an array of four numbers");
        }
        var values = new float[4];
        for (int i = 0; i < 4; i++) {
            if (!data.get(i).isNumber()) {
                throw new IOException("Expected an array of four numbers");
            }
            values[i] = (float) data.get(i).asDouble();
        }
        return new Vector4f(values);
    }

    private static void requireObject(JsonNode data) throws IOException {
        if (!data.isObject()) {
            throw new IOException("Expected an object");
        }
    }

    private static String requiredText(JsonNode node, String field) throws IOException {
        var value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IOException("Missing string field: " + field);
        }
        return value.asText();
    }

    private static <T> void writeParams(ArrayNode array, List<MaterialParam<T>> params, Writer<T> writer) {
        for (var param : params) {
            var node = array.addObject();
            node.put("paramId", param.paramId().label());
            writer.write(node, param.data());
        }
    }

    @FunctionalInterface
    private interface Reader<T> {
        T read(JsonNode data) throws IOException;
    }

    @FunctionalInterface
    private interface Writer<T> {
        void write(ObjectNode param, T value);
    }
}
