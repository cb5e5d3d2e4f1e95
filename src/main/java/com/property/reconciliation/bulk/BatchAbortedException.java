package com.property.reconciliation.bulk;

/**
 * Thrown inside the batch transaction to roll it back when a row hit an
 * infrastructure failure or a chunk did not finish in time. Never reaches
 * callers of {@link BatchReconciler}; it becomes an aborted report.
 */
public class BatchAbortedException extends RuntimeException {

    private final int rowNumber;

    public BatchAbortedException(int rowNumber, String message, Throwable cause) {
        super(message, cause);
        this.rowNumber = rowNumber;
    }

    public int getRowNumber() {
        return rowNumber;
    }
}
