package com.samsung.ees.infra.api.remotedb.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Query parameters shared by the remote database endpoints.
 * Times are epoch seconds, matching the {@code timestamp} columns of the device database.
 */
@Data
public class RemoteQueryRequest {
    @NotBlank(message = "dbPath cannot be empty.")
    private String dbPath;

    @NotNull(message = "startTime cannot be null.")
    private Long startTime;

    @NotNull(message = "endTime cannot be null.")
    private Long endTime;

    private String deviceSn;

    private boolean includeExt;

    /**
     * Reduce device rows to the configured fields, expanding the payload.
     */
    private boolean flatten;
}
