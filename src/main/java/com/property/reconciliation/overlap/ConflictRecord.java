package com.property.reconciliation.overlap;

/**
 * One existing range that overlaps a candidate. Never persisted.
 *
 * @param entryId id of the conflicting record
 * @param range   the conflicting range
 * @param type    classification of the conflicting record (booking type)
 * @param label   display label of the conflicting record, may be null
 * @param kind    how the candidate collides with it
 */
public record ConflictRecord(String entryId, DateRange range, String type, String label, ConflictKind kind) {

    public String describe() {
        String who = label != null && !label.isBlank() ? label + " " : "";
        return who + type + " " + range;
    }
}
