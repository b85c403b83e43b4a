package com.samsung.ees.infra.api.remotedb.model;

import java.util.List;
import java.util.Map;

/**
 * Overview of a remote database: its tables, their row counts and the time span of the device table.
 *
 * @param timeRange {@code null} when the device table is missing or empty
 */
public record TableInfo(List<String> tables, Map<String, Long> tableStats, TimeRange timeRange) {

    public record TimeRange(Long min, Long max) {
    }
}
