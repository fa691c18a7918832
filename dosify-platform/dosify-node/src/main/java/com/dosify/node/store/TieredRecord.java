package com.dosify.node.store;

import com.dosify.node.record.FieldValue;
import com.dosify.node.record.Records;

import java.util.Map;
import java.util.Objects;

/**
 * A record as returned by {@link TieredStore#read}, with the tier that served it.
 */
public record TieredRecord(String collection, String id, Map<String, FieldValue> fields, Tier servedBy) {

    public TieredRecord {
        Objects.requireNonNull(collection, "Collection cannot be null");
        Objects.requireNonNull(id, "Record ID cannot be null");
        Objects.requireNonNull(servedBy, "Serving tier cannot be null");
        fields = Records.copyOf(fields);
    }

    public FieldValue get(String field) {
        return fields.get(field);
    }
}
