package com.samsung.ees.infra.api.remotedb.exception;

/**
 * The result file could not be copied back from the remote host, or the copy timed out.
 */
public class ResultTransportException extends RemoteQueryException {
    public ResultTransportException(String message) {
        super(message);
    }

    public ResultTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
