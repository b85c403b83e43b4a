package com.samsung.ees.infra.api.remotedb.widetable;

public enum WideTableStage {
    FETCHING_PRIMARY,
    FETCHING_SECONDARY,
    MERGING,
    FINALIZING
}
