package com.property.reconciliation.bulk;

import com.property.reconciliation.validation.ImportRow;

import java.util.List;

/**
 * Processes the rows of one import target.
 *
 * <p>{@link #handle} reports malformed input, unresolved references and mode
 * violations as {@link RowOutcome} values. Exceptions escaping it are
 * classified by the reconciler: store failures abort the batch, anything else
 * fails only the row.</p>
 */
public interface RowHandler {

    ImportTarget target();

    RowOutcome handle(ImportRow row, BatchContext context);

    /**
     * Sequential pass over all rows before processing starts.
     */
    default void prepare(List<ImportRow> rows, BatchContext context) {
    }

    /**
     * Whether rows of one chunk may run in parallel.
     */
    default boolean concurrent() {
        return true;
    }
}
