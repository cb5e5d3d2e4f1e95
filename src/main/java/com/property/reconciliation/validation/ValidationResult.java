package com.property.reconciliation.validation;

import java.util.List;

/**
 * Outcome of validating one row: a typed record when there are no errors.
 * Warnings describe values that were dropped or defaulted.
 */
public record ValidationResult(ValidatedRow row, List<FieldError> errors, List<FieldError> warnings) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        if (errors.isEmpty() && row == null) {
            throw new IllegalArgumentException("A valid result needs a row");
        }
        if (!errors.isEmpty()) {
            row = null;
        }
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Joins the error messages into one line, e.g. for a report entry.
     */
    public String errorSummary() {
        return String.join("; ", errors.stream().map(FieldError::message).toList());
    }
}
