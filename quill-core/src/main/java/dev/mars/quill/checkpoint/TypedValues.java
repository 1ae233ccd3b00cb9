/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.quill.checkpoint;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Jackson codec for free-form value maps (step outputs, job inputs) that keeps each value's
 * Java type across a JSON round trip.
 *
 * <p>Strings, booleans, {@code Integer} and finite {@code Double} values are written as plain JSON,
 * since untyped JSON reads them back as the same types. Maps, lists and sets are written as
 * {@code {"@type":"map|list|set", ...}} wrappers with each element encoded recursively and are read
 * back as {@link LinkedHashMap}, {@link ArrayList} and {@link LinkedHashSet}. Every other value is
 * written as {@code {"@type":"<class name>","value":<json>}} and read back with
 * {@link ObjectCodec#treeToValue(com.fasterxml.jackson.core.TreeNode, Class)}, so a {@code Long}
 * stays a {@code Long} and a bean or record comes back as its own class.</p>
 *
 * <p>Map keys are written with {@code String.valueOf}.</p>
 */
public final class TypedValues {

    static final String TYPE_FIELD = "@type";
    static final String VALUE_FIELD = "value";
    static final String ENTRIES_FIELD = "entries";
    static final String ITEMS_FIELD = "items";

    private static final String MAP = "map";
    private static final String LIST = "list";
    private static final String SET = "set";

    private TypedValues() {
    }

    public static final class MapSerializer extends StdSerializer<Map<String, Object>> {

        public MapSerializer() {
            super(Map.class, false);
        }

        @Override
        public void serialize(Map<String, Object> values, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            writeEntries(values, gen, provider);
        }
    }

    public static final class MapDeserializer extends StdDeserializer<Map<String, Object>> {

        public MapDeserializer() {
            super(Map.class);
        }

        @Override
        public Map<String, Object> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            ObjectCodec codec = p.getCodec();
            JsonNode node = codec.readTree(p);
            if (node == null || node.isNull()) {
                return new LinkedHashMap<>();
            }
            if (!node.isObject()) {
                return ctxt.reportInputMismatch(this, "Expected an object of typed values but found %s",
                        node.getNodeType());
            }
            return readEntries(node, codec);
        }
    }

    private static void writeEntries(Map<?, ?> values, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            gen.writeFieldName(String.valueOf(entry.getKey()));
            writeValue(entry.getValue(), gen, provider);
        }
        gen.writeEndObject();
    }

    private static void writeValue(Object value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof String) {
            gen.writeString((String) value);
        } else if (value instanceof Boolean) {
            gen.writeBoolean((Boolean) value);
        } else if (value instanceof Integer) {
            gen.writeNumber((Integer) value);
        } else if (value instanceof Double && Double.isFinite((Double) value)) {
            gen.writeNumber((Double) value);
        } else if (value instanceof Map) {
            gen.writeStartObject();
            gen.writeStringField(TYPE_FIELD, MAP);
            gen.writeFieldName(ENTRIES_FIELD);
            writeEntries((Map<?, ?>) value, gen, provider);
            gen.writeEndObject();
        } else if (value instanceof List || value instanceof Set) {
            gen.writeStartObject();
            gen.writeStringField(TYPE_FIELD, value instanceof Set ? SET : LIST);
            gen.writeArrayFieldStart(ITEMS_FIELD);
            for (Object item : (Collection<?>) value) {
                writeValue(item, gen, provider);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        } else {
            gen.writeStartObject();
            gen.writeStringField(TYPE_FIELD, value.getClass().getName());
            gen.writeFieldName(VALUE_FIELD);
            provider.defaultSerializeValue(value, gen);
            gen.writeEndObject();
        }
    }

    private static Map<String, Object> readEntries(JsonNode node, ObjectCodec codec) throws IOException {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), readValue(field.getValue(), codec));
        }
        return values;
    }

    private static Object readValue(JsonNode node, ObjectCodec codec) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isArray()) {
            return readItems(node, new ArrayList<>(), codec);
        }
        JsonNode typeNode = node.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            // untyped object, as written before type wrappers existed
            return readEntries(node, codec);
        }
        String type = typeNode.textValue();
        switch (type) {
            case MAP:
                return readEntries(node.path(ENTRIES_FIELD), codec);
            case LIST:
                return readItems(node.path(ITEMS_FIELD), new ArrayList<>(), codec);
            case SET:
                return readItems(node.path(ITEMS_FIELD), new LinkedHashSet<>(), codec);
            default:
                return codec.treeToValue(node.get(VALUE_FIELD), loadClass(type));
        }
    }

    private static <C extends Collection<Object>> C readItems(JsonNode node, C target, ObjectCodec codec)
            throws IOException {
        for (JsonNode item : node) {
            target.add(readValue(item, codec));
        }
        return target;
    }

    private static Class<?> loadClass(String name) throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            return Class.forName(name, false, loader != null ? loader : TypedValues.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IOException("Unknown value type in checkpoint: " + name, e);
        }
    }
}
