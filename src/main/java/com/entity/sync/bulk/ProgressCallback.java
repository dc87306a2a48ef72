package com.entity.sync.bulk;

/**
 * Callback for tracking progress of imports.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed the number of records processed so far
     * @param total     the total number of records
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
