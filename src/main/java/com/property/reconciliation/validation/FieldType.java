package com.property.reconciliation.validation;

/**
 * Declared type of an import column. The declared type alone decides coercion.
 */
public enum FieldType {
    TEXT,
    INTEGER,
    DECIMAL,
    /** Strict {@code yyyy-MM-dd} calendar date. */
    DATE,
    ENUM,
    EMAIL,
    /** Comma-separated list of trimmed, non-empty strings. */
    LIST
}
