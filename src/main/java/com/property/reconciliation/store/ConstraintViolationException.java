package com.property.reconciliation.store;

/**
 * A write broke a unique key or a foreign key. Unlike {@link StoreException}
 * this only concerns the record being written, so bulk imports record it
 * against the offending row and carry on.
 */
public class ConstraintViolationException extends RuntimeException {

    private final String constraint;

    public ConstraintViolationException(String constraint, String message) {
        super(message);
        this.constraint = constraint;
    }

    public String getConstraint() {
        return constraint;
    }
}
