package com.samsung.ees.infra.api.remotedb.repository;

import com.samsung.ees.infra.api.remotedb.executor.RemoteQueryExecutor;
import com.samsung.ees.infra.api.remotedb.model.Row;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Looks up the columns of a remote table. Results are not cached, so schema changes between
 * calls are picked up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaIntrospector {
    private final RemoteQueryExecutor executor;

    /**
     * @return column names in table order, or an empty list if they could not be determined.
     *         An empty list means "use a fallback column set", not "the table has no columns".
     */
    public List<String> columns(String dbPath, String tableName) {
        String sql = "PRAGMA table_info(" + SqlIdentifiers.requireIdentifier(tableName) + ")";
        RowSet result;
        try {
            result = executor.execute(dbPath, sql);
        } catch (RuntimeException e) {
            log.warn("Failed to get columns for table {}: {}", tableName, e.getMessage());
            return List.of();
        }

        List<String> columns = new ArrayList<>(result.getTotalRows());
        for (Row row : result.getRows()) {
            String name = row.getString("name");
            if (name != null && !name.isEmpty()) {
                columns.add(name);
            }
        }
        if (columns.isEmpty()) {
            log.warn("No columns reported for table {}", tableName);
        }
        return columns;
    }
}
