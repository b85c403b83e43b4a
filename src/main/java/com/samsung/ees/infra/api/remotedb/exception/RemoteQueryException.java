package com.samsung.ees.infra.api.remotedb.exception;

/**
 * Base class for failures while running a query on a remote database.
 */
public class RemoteQueryException extends RuntimeException {
    public RemoteQueryException(String message) {
        super(message);
    }

    public RemoteQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
