package com.property.reconciliation.bulk;

/**
 * Receives progress of an import: once per processed chunk and once when the batch completes.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed rows processed so far
     * @param total     rows in the batch
     * @param message   short description of the step
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
