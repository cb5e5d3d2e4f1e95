package com.property.reconciliation.overlap;

import java.time.LocalDate;

/**
 * Thrown when a date range does not end strictly after it starts.
 */
public class InvalidDateRangeException extends IllegalArgumentException {

    private final LocalDate start;
    private final LocalDate end;

    public InvalidDateRangeException(LocalDate start, LocalDate end) {
        super("End date must be after start date (start=" + start + ", end=" + end + ")");
        this.start = start;
        this.end = end;
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }
}
