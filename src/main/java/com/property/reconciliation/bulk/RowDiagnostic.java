package com.property.reconciliation.bulk;

import com.property.reconciliation.validation.FieldError;

import java.util.Objects;

/**
 * An error or warning tagged with its source row. Row 0 is used for
 * diagnostics about the batch as a whole.
 *
 * @param field the offending field, if any
 * @param value the raw value, if any
 */
public record RowDiagnostic(int row, String message, String field, String value) {

    public RowDiagnostic {
        Objects.requireNonNull(message, "message is required");
        if (row < 0) {
            throw new IllegalArgumentException("row must not be negative");
        }
    }

    public static RowDiagnostic of(int row, String message) {
        return new RowDiagnostic(row, message, null, null);
    }

    public static RowDiagnostic of(int row, String message, String field) {
        return new RowDiagnostic(row, message, field, null);
    }

    public static RowDiagnostic from(FieldError error) {
        return new RowDiagnostic(error.rowNumber(), error.message(), error.field(), error.value());
    }

    @Override
    public String toString() {
        return "Row " + row + ": " + message;
    }
}
