package com.samsung.ees.infra.api.remotedb.exception;

/**
 * Caller supplied a time range whose start lies after its end.
 */
public class InvalidTimeRangeException extends IllegalArgumentException {
    public InvalidTimeRangeException(long startTime, long endTime) {
        super("Invalid time range: startTime " + startTime + " cannot be after endTime " + endTime + ".");
    }
}
