package com.samsung.ees.infra.api.remotedb.repository;

import com.samsung.ees.infra.api.remotedb.config.RemoteQueryProperties;
import com.samsung.ees.infra.api.remotedb.executor.RemoteQueryExecutor;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Named commands and events sent to devices.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CommandDataRepository {
    private final RemoteQueryExecutor executor;
    private final RemoteQueryProperties properties;

    /**
     * Rows with {@code startTime <= timestamp <= endTime}, ascending by timestamp.
     */
    public RowSet findByTimeRange(String dbPath, long startTime, long endTime, String deviceSn) {
        QueryArguments.validate(dbPath, startTime, endTime);
        String commandTable = SqlIdentifiers.requireIdentifier(properties.getTables().getCommand());

        List<String> conditions = new ArrayList<>();
        conditions.add("timestamp >= " + startTime);
        conditions.add("timestamp <= " + endTime);
        if (QueryArguments.hasText(deviceSn)) {
            conditions.add("device_sn = " + SqlIdentifiers.quoteLiteral(deviceSn));
        }

        String sql = String.format("""
                SELECT id, timestamp, device_sn, name, value, local_timestamp
                  FROM %s
                 WHERE %s
                 ORDER BY timestamp ASC
                """, commandTable, String.join(" AND ", conditions));
        log.debug("Executing SQL query: {}", sql);
        return executor.execute(dbPath, sql);
    }
}
