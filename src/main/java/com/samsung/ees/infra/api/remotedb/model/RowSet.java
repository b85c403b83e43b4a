package com.samsung.ees.infra.api.remotedb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered rows returned by one query, in the order the query sorted them.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RowSet {
    private static final RowSet EMPTY = new RowSet(List.of());

    private final List<String> columns;
    private final List<Row> rows;

    public RowSet(List<Row> rows) {
        this.rows = List.copyOf(rows);
        Set<String> names = new LinkedHashSet<>();
        for (Row row : this.rows) {
            names.addAll(row.columns());
        }
        this.columns = List.copyOf(names);
    }

    public static RowSet empty() {
        return EMPTY;
    }

    public int getTotalRows() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
