package com.property.reconciliation.store;

/**
 * Infrastructure failure of the row store: the store is unavailable, the
 * transaction could not be started or committed, or a write was lost.
 * A batch that sees one of these rolls back as a whole.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
