package com.samsung.ees.infra.api.remotedb.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A single result row: column name to scalar value.
 * Values are always one of {@code null}, {@link Long}, {@link Double} or {@link String}.
 */
@ToString
@EqualsAndHashCode
public final class Row {
    private final Map<String, Object> values;

    public Row(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Convenience factory taking alternating column names and values.
     */
    public static Row of(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected an even number of arguments, got " + columnsAndValues.length);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new Row(values);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean contains(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    /**
     * Returns the value as text. Numbers produced by the result normalizer are rendered back,
     * so a numeric-looking serial number still reads as a string.
     */
    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    /**
     * Returns the value as a long, accepting numeric text. Non-numeric values yield {@code null}.
     */
    public Long getLong(String column) {
        Object value = values.get(column);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }
}
