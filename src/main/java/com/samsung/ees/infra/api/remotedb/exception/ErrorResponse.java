package com.samsung.ees.infra.api.remotedb.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

/**
 * Body of every error response. {@code type} names the failure class, e.g. {@code RemoteExecutionException}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final LocalDateTime timestamp;
    private final int status;
    private final String error;
    private final String type;
    private final String message;

    public ErrorResponse(HttpStatus status, String type, String message) {
        this.timestamp = LocalDateTime.now();
        this.status = status.value();
        this.error = status.getReasonPhrase();
        this.type = type;
        this.message = message;
    }
}
