package com.samsung.ees.infra.api.remotedb.exception;

/**
 * The remote query process could not be started or exited with a non-zero status.
 */
public class RemoteExecutionException extends RemoteQueryException {
    public RemoteExecutionException(String message) {
        super(message);
    }

    public RemoteExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
