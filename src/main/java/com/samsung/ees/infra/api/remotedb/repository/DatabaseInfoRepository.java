package com.samsung.ees.infra.api.remotedb.repository;

import com.samsung.ees.infra.api.remotedb.config.RemoteQueryProperties;
import com.samsung.ees.infra.api.remotedb.executor.RemoteQueryExecutor;
import com.samsung.ees.infra.api.remotedb.model.Row;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import com.samsung.ees.infra.api.remotedb.model.TableInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Repository
@RequiredArgsConstructor
public class DatabaseInfoRepository {
    private final RemoteQueryExecutor executor;
    private final RemoteQueryProperties properties;

    /**
     * Lists tables with their row counts, plus the timestamp span of the device table if it exists.
     */
    public TableInfo describe(String dbPath) {
        if (!QueryArguments.hasText(dbPath)) {
            throw new IllegalArgumentException("dbPath cannot be empty.");
        }

        RowSet tableRows = executor.execute(dbPath, "SELECT name FROM sqlite_master WHERE type='table' ORDER BY name");
        List<String> tables = new ArrayList<>();
        for (Row row : tableRows.getRows()) {
            tables.add(row.getString("name"));
        }

        Map<String, Long> tableStats = new LinkedHashMap<>();
        for (String table : tables) {
            RowSet count = executor.execute(dbPath, "SELECT COUNT(*) AS count FROM " + SqlIdentifiers.quoteIdentifier(table));
            if (!count.isEmpty()) {
                Long value = count.getRows().get(0).getLong("count");
                tableStats.put(table, value == null ? 0L : value);
            }
        }

        TableInfo.TimeRange timeRange = null;
        String deviceTable = SqlIdentifiers.requireIdentifier(properties.getTables().getDevice());
        if (tables.contains(deviceTable)) {
            RowSet span = executor.execute(dbPath,
                    "SELECT MIN(timestamp) AS min_time, MAX(timestamp) AS max_time FROM " + deviceTable);
            if (!span.isEmpty() && span.getRows().get(0).getLong("min_time") != null) {
                Row first = span.getRows().get(0);
                timeRange = new TableInfo.TimeRange(first.getLong("min_time"), first.getLong("max_time"));
            }
        }
        log.info("Database {} has {} tables", dbPath, tables.size());
        return new TableInfo(tables, tableStats, timeRange);
    }
}
