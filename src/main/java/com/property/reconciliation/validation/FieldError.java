package com.property.reconciliation.validation;

/**
 * A field-level problem found while validating one row.
 *
 * @param rowNumber source row number
 * @param field     field name
 * @param message   human-readable message
 * @param value     offending raw value, may be null
 */
public record FieldError(int rowNumber, String field, String message, String value) {
}
