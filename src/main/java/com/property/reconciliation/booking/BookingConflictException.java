package com.property.reconciliation.booking;

import com.property.reconciliation.overlap.ConflictRecord;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A booking could not be written because it overlaps existing bookings of its property.
 */
public class BookingConflictException extends RuntimeException {

    private final String propertyId;
    private final List<ConflictRecord> conflicts;

    public BookingConflictException(String propertyId, List<ConflictRecord> conflicts) {
        super("Booking overlaps " + conflicts.size() + " existing booking(s) on property " + propertyId + ": "
                + conflicts.stream().map(ConflictRecord::describe).collect(Collectors.joining("; ")));
        this.propertyId = propertyId;
        this.conflicts = List.copyOf(conflicts);
    }

    public String getPropertyId() {
        return propertyId;
    }

    public List<ConflictRecord> getConflicts() {
        return conflicts;
    }
}
