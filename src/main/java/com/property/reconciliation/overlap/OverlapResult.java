package com.property.reconciliation.overlap;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Conflicts found for one candidate range.
 */
public record OverlapResult(List<ConflictRecord> conflicts) {

    private static final OverlapResult NONE = new OverlapResult(List.of());

    public OverlapResult {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public static OverlapResult none() {
        return NONE;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    /**
     * Comma-separated conflict types, e.g. {@code "CONFIRMED, OWNER"}.
     */
    public String conflictTypes() {
        return conflicts.stream().map(ConflictRecord::type).collect(Collectors.joining(", "));
    }
}
