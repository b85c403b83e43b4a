package com.samsung.ees.infra.api.remotedb.widetable;

/**
 * Receives coarse progress while a wide table is built. Called on the building thread.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (stage, percent) -> { };

    /**
     * @param percent overall completion between 0 and 100
     */
    void onProgress(WideTableStage stage, double percent);
}
