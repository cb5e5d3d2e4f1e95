package com.property.reconciliation.overlap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds existing ranges that collide with a candidate range inside one resource scope.
 *
 * <p>The detector only reports conflicts. Whether a conflict blocks the operation or is
 * downgraded to a warning is decided by the caller.</p>
 */
public class OverlapDetector {
    private static final Logger log = LoggerFactory.getLogger(OverlapDetector.class);

    public OverlapResult detect(DateRange candidate, String scopeId, DateRangeIndex index) {
        return detect(candidate, scopeId, index, null);
    }

    /**
     * @param excludeEntryId entry to ignore, typically the record being updated; may be null
     */
    public OverlapResult detect(DateRange candidate, String scopeId, DateRangeIndex index, String excludeEntryId) {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(scopeId, "scopeId is required");
        Objects.requireNonNull(index, "index is required");

        List<ConflictRecord> conflicts = new ArrayList<>();
        for (ScheduledRange existing : index.rangesFor(scopeId)) {
            if (existing.entryId().equals(excludeEntryId)) {
                continue;
            }
            if (candidate.overlaps(existing.range())) {
                conflicts.add(new ConflictRecord(existing.entryId(), existing.range(), existing.type(),
                        existing.label(), classify(candidate, existing.range())));
            }
        }
        if (!conflicts.isEmpty()) {
            log.debug("overlap.detected scope={} candidate={} conflicts={}", scopeId, candidate, conflicts.size());
        }
        return conflicts.isEmpty() ? OverlapResult.none() : new OverlapResult(conflicts);
    }

    static ConflictKind classify(DateRange candidate, DateRange existing) {
        if (candidate.encloses(existing)) {
            return ConflictKind.ENCOMPASSING;
        }
        if (existing.encloses(candidate)) {
            return ConflictKind.ENCOMPASSED;
        }
        return ConflictKind.OVERLAP;
    }
}
