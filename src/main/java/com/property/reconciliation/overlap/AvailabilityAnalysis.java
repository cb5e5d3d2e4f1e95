package com.property.reconciliation.overlap;

import java.util.List;

/**
 * Detailed availability answer for a candidate range: the blocking conflicts,
 * neighbours that sit closer than the grace period, and alternative ranges of
 * the same length.
 */
public record AvailabilityAnalysis(
        List<ConflictRecord> conflicts,
        List<GracePeriodViolation> gracePeriodViolations,
        List<AlternativeRange> alternatives
) {
    public AvailabilityAnalysis {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        gracePeriodViolations = gracePeriodViolations != null ? List.copyOf(gracePeriodViolations) : List.of();
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }

    public boolean isAvailable() {
        return conflicts.isEmpty();
    }

    /**
     * A neighbouring entry closer to the candidate than the grace period allows.
     *
     * @param entryId  the neighbouring entry
     * @param gapDays  days between the candidate and the neighbour
     * @param position whether the candidate sits before or after the neighbour
     */
    public record GracePeriodViolation(String entryId, long gapDays, Position position) {}

    public enum Position { BEFORE, AFTER }

    public record AlternativeRange(DateRange range, String reason, Confidence confidence) {}

    public enum Confidence { HIGH, MEDIUM }
}
