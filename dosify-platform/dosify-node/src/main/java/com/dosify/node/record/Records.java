package com.dosify.node.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for field-map records.
 */
public final class Records {

    /**
     * Implicit modification timestamp carried by every stored document.
     */
    public static final String LAST_UPDATE = "lastUpdate";

    public static final TypeReference<Map<String, FieldValue>> FIELD_MAP =
            new TypeReference<>() {};

    private Records() {
    }

    public static Map<String, FieldValue> copyOf(Map<String, FieldValue> fields) {
        if (fields == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Optional<Instant> lastUpdate(Map<String, FieldValue> fields) {
        if (fields == null) {
            return Optional.empty();
        }
        FieldValue value = fields.get(LAST_UPDATE);
        if (value instanceof FieldValue.StringValue s) {
            try {
                return Optional.of(Instant.parse(s.value()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Map<String, FieldValue> withLastUpdate(Map<String, FieldValue> fields, Instant lastUpdate) {
        Map<String, FieldValue> stamped = new LinkedHashMap<>(fields);
        stamped.put(LAST_UPDATE, new FieldValue.StringValue(lastUpdate.toString()));
        return Collections.unmodifiableMap(stamped);
    }

    /**
     * Returns the record without its {@code lastUpdate} bookkeeping field.
     */
    public static Map<String, FieldValue> withoutLastUpdate(Map<String, FieldValue> fields) {
        Map<String, FieldValue> content = new LinkedHashMap<>(fields);
        content.remove(LAST_UPDATE);
        return Collections.unmodifiableMap(content);
    }

    public static String toJson(Map<String, FieldValue> fields) {
        try {
            return JsonCodec.mapper().writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record cannot be encoded as JSON", e);
        }
    }

    public static Map<String, FieldValue> fromJson(String json) throws JsonProcessingException {
        JsonNode node = JsonCodec.mapper().readTree(json);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Record JSON must be an object");
        }
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), JsonCodec.fromNode(entry.getValue()));
        }
        return Collections.unmodifiableMap(fields);
    }
}
