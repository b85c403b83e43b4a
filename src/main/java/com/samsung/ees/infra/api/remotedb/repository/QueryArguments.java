package com.samsung.ees.infra.api.remotedb.repository;

import com.samsung.ees.infra.api.remotedb.exception.InvalidTimeRangeException;

final class QueryArguments {

    private QueryArguments() {
        // Private constructor to prevent instantiation
    }

    /**
     * Rejects a bad database path or time range before any SQL is built.
     */
    static void validate(String dbPath, long startTime, long endTime) {
        if (dbPath == null || dbPath.isBlank()) {
            throw new IllegalArgumentException("dbPath cannot be empty.");
        }
        if (startTime > endTime) {
            throw new InvalidTimeRangeException(startTime, endTime);
        }
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
