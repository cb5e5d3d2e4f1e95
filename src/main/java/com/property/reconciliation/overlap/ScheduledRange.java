package com.property.reconciliation.overlap;

import java.util.Objects;

/**
 * An existing occupation of a resource, as loaded into a {@link DateRangeIndex}.
 *
 * @param entryId id of the record holding the range (e.g. the booking id)
 * @param scopeId resource the range belongs to (e.g. the property id)
 * @param range   the occupied dates
 * @param type    classification of the source record (e.g. the booking type)
 * @param label   optional display label (e.g. the guest name)
 */
public record ScheduledRange(String entryId, String scopeId, DateRange range, String type, String label) {

    public ScheduledRange {
        Objects.requireNonNull(entryId, "entryId is required");
        Objects.requireNonNull(scopeId, "scopeId is required");
        Objects.requireNonNull(range, "range is required");
        Objects.requireNonNull(type, "type is required");
    }

    public String labelOrType() {
        return label != null && !label.isBlank() ? label : type;
    }
}
