package com.samsung.ees.infra.api.remotedb.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The wide table for a database and time range came back empty, so there is nothing to export.
 */
@Getter
@ResponseStatus(HttpStatus.NOT_FOUND)
public class NoDataFoundException extends RuntimeException {
    private final String dbPath;
    private final long startTime;
    private final long endTime;

    public NoDataFoundException(String dbPath, long startTime, long endTime) {
        super("No data found for the given criteria.");
        this.dbPath = dbPath;
        this.startTime = startTime;
        this.endTime = endTime;
    }
}
