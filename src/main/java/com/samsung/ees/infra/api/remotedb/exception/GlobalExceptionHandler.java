package com.samsung.ees.infra.api.remotedb.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.stream.Collectors;

/**
 * Maps failures to JSON error responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Request parameters that are missing or fail bean validation.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex) {
        String errorMessage = ex.getBindingResult().getAllErrors().stream()
                .map(DefaultMessageSourceResolvable::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("Validation failed for request: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "ValidationException", errorMessage);
    }

    /**
     * Invalid time ranges, paths or identifiers.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid argument for request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), ex.getMessage());
    }

    @ExceptionHandler(NoDataFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoDataFoundException(NoDataFoundException ex) {
        log.warn("No data in {} between {} and {}", ex.getDbPath(), ex.getStartTime(), ex.getEndTime());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), ex.getMessage());
    }

    /**
     * The remote host, the transfer or the result document failed; the service itself is fine.
     */
    @ExceptionHandler(RemoteQueryException.class)
    public ResponseEntity<ErrorResponse> handleRemoteQueryException(RemoteQueryException ex) {
        log.error("Remote query failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex) {
        log.error("An unexpected error occurred:", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, null, "An internal server error occurred.");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String type, String message) {
        return new ResponseEntity<>(new ErrorResponse(status, type, message), status);
    }
}
