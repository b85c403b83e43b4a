package com.samsung.ees.infra.api.remotedb.exception;

/**
 * The result document was retrieved but is not a valid row document.
 */
public class ResultDecodeException extends RemoteQueryException {
    public ResultDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
