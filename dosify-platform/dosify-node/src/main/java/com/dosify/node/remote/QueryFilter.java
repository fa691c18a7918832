package com.dosify.node.remote;

import com.dosify.node.record.FieldValue;

import java.util.Map;
import java.util.Objects;

/**
 * Single field predicate of a collection query.
 */
public record QueryFilter(String field, Operator operator, FieldValue value) {

    public enum Operator {
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_OR_EQUAL(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public QueryFilter {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Filter field cannot be null or blank");
        }
        Objects.requireNonNull(operator, "Operator cannot be null");
        value = value != null ? value : FieldValue.nullValue();
    }

    public static QueryFilter eq(String field, FieldValue value) {
        return new QueryFilter(field, Operator.EQUAL, value);
    }

    /**
     * Canonical text used when deriving cache signatures.
     */
    public String canonical() {
        return field + operator.symbol() + value.getClass().getSimpleName() + ":" + value.asText();
    }

    /**
     * Evaluates the filter against a record. Ordering operators only match values of the same kind.
     */
    public boolean matches(Map<String, FieldValue> fields) {
        FieldValue actual = fields.getOrDefault(field, FieldValue.nullValue());
        return switch (operator) {
            case EQUAL -> actual.equals(value);
            case NOT_EQUAL -> !actual.equals(value);
            case LESS_THAN -> compare(actual, value) < 0 && comparable(actual, value);
            case LESS_OR_EQUAL -> compare(actual, value) <= 0 && comparable(actual, value);
            case GREATER_THAN -> compare(actual, value) > 0 && comparable(actual, value);
            case GREATER_OR_EQUAL -> compare(actual, value) >= 0 && comparable(actual, value);
        };
    }

    private static boolean comparable(FieldValue a, FieldValue b) {
        return (a instanceof FieldValue.NumberValue && b instanceof FieldValue.NumberValue)
                || (a instanceof FieldValue.StringValue && b instanceof FieldValue.StringValue);
    }

    /**
     * Orders numbers numerically and strings lexically; other combinations compare as equal.
     */
    public static int compare(FieldValue a, FieldValue b) {
        if (a instanceof FieldValue.NumberValue x && b instanceof FieldValue.NumberValue y) {
            return Double.compare(x.value(), y.value());
        }
        if (a instanceof FieldValue.StringValue x && b instanceof FieldValue.StringValue y) {
            return x.value().compareTo(y.value());
        }
        return 0;
    }
}
