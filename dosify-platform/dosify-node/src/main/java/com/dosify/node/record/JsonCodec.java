package com.dosify.node.record;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson configuration for everything this node persists as JSON.
 * Instants are written as ISO-8601 strings and {@link FieldValue}s as natural JSON.
 */
public final class JsonCodec {

    private static final ObjectMapper SHARED = newMapper();

    private JsonCodec() {
    }

    /**
     * Returns the process-wide mapper. ObjectMapper is thread-safe once configured.
     */
    public static ObjectMapper mapper() {
        return SHARED;
    }

    public static ObjectMapper newMapper() {
        SimpleModule fieldValues = new SimpleModule("dosify-field-values");
        fieldValues.addSerializer(FieldValue.class, new FieldValueSerializer());
        fieldValues.addDeserializer(FieldValue.class, new FieldValueDeserializer());

        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(fieldValues)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Converts a parsed JSON tree into a field value.
     */
    public static FieldValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldValue.nullValue();
        }
        if (node.isTextual()) {
            return new FieldValue.StringValue(node.textValue());
        }
        if (node.isNumber()) {
            return new FieldValue.NumberValue(node.doubleValue());
        }
        if (node.isBoolean()) {
            return new FieldValue.BoolValue(node.booleanValue());
        }
        if (node.isObject()) {
            Map<String, FieldValue> nested = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                nested.put(field.getKey(), fromNode(field.getValue()));
            }
            return new FieldValue.MapValue(nested);
        }
        // Arrays are not part of the record model; keep their JSON text.
        return new FieldValue.StringValue(node.toString());
    }

    // ==================== Jackson adapters ====================

    static final class FieldValueSerializer extends JsonSerializer<FieldValue> {
        @Override
        public void serialize(FieldValue value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            if (value instanceof FieldValue.StringValue s) {
                gen.writeString(s.value());
            } else if (value instanceof FieldValue.NumberValue n) {
                gen.writeNumber(n.value());
            } else if (value instanceof FieldValue.BoolValue b) {
                gen.writeBoolean(b.value());
            } else if (value instanceof FieldValue.MapValue m) {
                gen.writeStartObject();
                for (Map.Entry<String, FieldValue> entry : m.value().entrySet()) {
                    gen.writeFieldName(entry.getKey());
                    serialize(entry.getValue(), gen, serializers);
                }
                gen.writeEndObject();
            } else {
                gen.writeNull();
            }
        }
    }

    static final class FieldValueDeserializer extends JsonDeserializer<FieldValue> {
        @Override
        public FieldValue deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
            JsonNode node = parser.getCodec().readTree(parser);
            return fromNode(node);
        }

        @Override
        public FieldValue getNullValue(DeserializationContext ctxt) {
            return FieldValue.nullValue();
        }
    }
}
