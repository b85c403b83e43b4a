package com.samsung.ees.infra.api.remotedb.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the wide table: every value reported at a single {@code local_timestamp},
 * with each column prefixed by the id of the device that reported it.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class WideRow {
    public static final String TIMESTAMP_COLUMN = "local_timestamp";

    private final long localTimestamp;
    private final Map<String, Object> columns;

    public WideRow(long localTimestamp, Map<String, ?> columns) {
        this.localTimestamp = localTimestamp;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public Object get(String column) {
        if (TIMESTAMP_COLUMN.equals(column)) {
            return localTimestamp;
        }
        return columns.get(column);
    }

    /**
     * Flattened view with {@code local_timestamp} as the first entry.
     */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(TIMESTAMP_COLUMN, localTimestamp);
        map.putAll(columns);
        return map;
    }
}
