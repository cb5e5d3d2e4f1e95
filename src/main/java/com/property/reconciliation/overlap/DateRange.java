package com.property.reconciliation.overlap;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Half-open calendar range {@code [start, end)}. A range always ends strictly
 * after it starts; a range ending on the day another starts does not overlap it.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (!start.isBefore(end)) {
            throw new InvalidDateRangeException(start, end);
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange of(String start, String end) {
        return new DateRange(LocalDate.parse(start), LocalDate.parse(end));
    }

    /**
     * Returns a range when both bounds are present and ordered, empty otherwise.
     */
    public static Optional<DateRange> tryOf(LocalDate start, LocalDate end) {
        if (start == null || end == null || !start.isBefore(end)) {
            return Optional.empty();
        }
        return Optional.of(new DateRange(start, end));
    }

    /**
     * Two ranges overlap when this range starts inside the other, ends inside
     * the other (end-inclusive), or fully contains it.
     */
    public boolean overlaps(DateRange other) {
        boolean startsInside = !start.isBefore(other.start) && start.isBefore(other.end);
        boolean endsInside = end.isAfter(other.start) && !end.isAfter(other.end);
        boolean contains = !start.isAfter(other.start) && !end.isBefore(other.end);
        return startsInside || endsInside || contains;
    }

    /**
     * True when this range covers every day of {@code other}.
     */
    public boolean encloses(DateRange other) {
        return !start.isAfter(other.start) && !end.isBefore(other.end);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end);
    }

    public DateRange shiftTo(LocalDate newStart) {
        return new DateRange(newStart, newStart.plusDays(lengthInDays()));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
