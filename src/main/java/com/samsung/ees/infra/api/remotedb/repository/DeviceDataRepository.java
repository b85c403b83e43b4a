package com.samsung.ees.infra.api.remotedb.repository;

import com.samsung.ees.infra.api.remotedb.config.RemoteQueryProperties;
import com.samsung.ees.infra.api.remotedb.executor.RemoteQueryExecutor;
import com.samsung.ees.infra.api.remotedb.model.RowSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Device measurement rows, optionally joined with their JSON payload from the extension table.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DeviceDataRepository {
    public static final String PAYLOAD_COLUMN = "payload_json";

    /**
     * Used when the table's columns cannot be introspected.
     */
    static final List<String> FALLBACK_COLUMNS = List.of(
            "id", "device_sn", "device_type", "timestamp", "local_timestamp",
            "activePower", "reactivePower", "powerFactor");

    private final RemoteQueryExecutor executor;
    private final SchemaIntrospector schemaIntrospector;
    private final RemoteQueryProperties properties;

    /**
     * Rows with {@code startTime <= timestamp <= endTime}, ascending by timestamp.
     *
     * @param startTime  inclusive lower bound, epoch seconds
     * @param endTime    inclusive upper bound, epoch seconds
     * @param deviceSn   restricts the result to one device when not blank
     * @param includeExt attaches the extension table's payload as {@value #PAYLOAD_COLUMN}, unexpanded
     */
    public RowSet findByTimeRange(String dbPath, long startTime, long endTime, String deviceSn, boolean includeExt) {
        QueryArguments.validate(dbPath, startTime, endTime);
        String deviceTable = SqlIdentifiers.requireIdentifier(properties.getTables().getDevice());

        List<String> conditions = new ArrayList<>();
        conditions.add("d.timestamp >= " + startTime);
        conditions.add("d.timestamp <= " + endTime);
        if (QueryArguments.hasText(deviceSn)) {
            conditions.add("d.device_sn = " + SqlIdentifiers.quoteLiteral(deviceSn));
        }

        String selectFields = selectFields(dbPath, deviceTable);
        String sql;
        if (includeExt) {
            String extTable = SqlIdentifiers.requireIdentifier(properties.getTables().getDeviceExt());
            sql = String.format("""
                    SELECT %s,
                           e.payload_json AS payload_json
                      FROM %s d
                      LEFT JOIN %s e ON d.id = e.device_data_id
                     WHERE %s
                     ORDER BY d.timestamp ASC
                    """, selectFields, deviceTable, extTable, String.join(" AND ", conditions));
        } else {
            sql = String.format("""
                    SELECT %s
                      FROM %s d
                     WHERE %s
                     ORDER BY d.timestamp ASC
                    """, selectFields, deviceTable, String.join(" AND ", conditions));
        }
        log.debug("Executing SQL query: {}", sql);
        return executor.execute(dbPath, sql);
    }

    private String selectFields(String dbPath, String deviceTable) {
        List<String> columns = schemaIntrospector.columns(dbPath, deviceTable);
        if (columns.isEmpty()) {
            log.warn("Using fallback columns for table {}", deviceTable);
            columns = FALLBACK_COLUMNS;
        }
        return columns.stream()
                .map(column -> "d." + SqlIdentifiers.quoteIdentifier(column))
                .collect(Collectors.joining(", "));
    }
}
