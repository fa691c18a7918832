package com.dosify.node.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single value inside a loosely-typed record.
 * Records are flat {@code Map<String, FieldValue>} so the cache, encryption and sync layers
 * stay generic across medication, dose and schedule entities.
 */
public sealed interface FieldValue permits FieldValue.StringValue, FieldValue.NumberValue,
        FieldValue.BoolValue, FieldValue.NullValue, FieldValue.MapValue {

    /**
     * Plain string form of this value, used where a field must be handled as text.
     */
    String asText();

    static FieldValue of(String value) {
        return value == null ? NullValue.INSTANCE : new StringValue(value);
    }

    static FieldValue of(double value) {
        return new NumberValue(value);
    }

    static FieldValue of(boolean value) {
        return new BoolValue(value);
    }

    static FieldValue ofMap(Map<String, FieldValue> value) {
        return value == null ? NullValue.INSTANCE : new MapValue(value);
    }

    static FieldValue nullValue() {
        return NullValue.INSTANCE;
    }

    // ==================== Variants ====================

    record StringValue(String value) implements FieldValue {
        public StringValue {
            Objects.requireNonNull(value, "String value cannot be null");
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record NumberValue(double value) implements FieldValue {
        @Override
        public String asText() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    record BoolValue(boolean value) implements FieldValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record NullValue() implements FieldValue {
        public static final NullValue INSTANCE = new NullValue();

        @Override
        public String asText() {
            return "";
        }
    }

    record MapValue(Map<String, FieldValue> value) implements FieldValue {
        public MapValue {
            Objects.requireNonNull(value, "Map value cannot be null");
            value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        }

        @Override
        public String asText() {
            return Records.toJson(value);
        }
    }
}
