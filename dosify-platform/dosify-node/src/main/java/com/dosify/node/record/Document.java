package com.dosify.node.record;

import java.util.Map;
import java.util.Objects;

/**
 * A record together with its identifier inside a collection.
 */
public record Document(String id, Map<String, FieldValue> fields) {

    public Document {
        Objects.requireNonNull(id, "Document ID cannot be null");
        fields = Records.copyOf(fields);
    }
}
