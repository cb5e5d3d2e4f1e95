package com.property.reconciliation.overlap;

import com.property.reconciliation.overlap.AvailabilityAnalysis.AlternativeRange;
import com.property.reconciliation.overlap.AvailabilityAnalysis.Confidence;
import com.property.reconciliation.overlap.AvailabilityAnalysis.GracePeriodViolation;
import com.property.reconciliation.overlap.AvailabilityAnalysis.Position;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Availability check that goes beyond yes/no: it looks at the entries within a
 * week either side of the candidate, flags neighbours that leave less than the
 * grace period free, and proposes alternative dates when the candidate conflicts.
 */
public class AvailabilityAdvisor {

    static final int SEARCH_WINDOW_DAYS = 7;

    private final OverlapDetector detector;
    private final int maxAlternatives;

    public AvailabilityAdvisor(OverlapDetector detector, int maxAlternatives) {
        this.detector = Objects.requireNonNull(detector, "detector is required");
        if (maxAlternatives < 0) {
            throw new IllegalArgumentException("maxAlternatives must not be negative");
        }
        this.maxAlternatives = maxAlternatives;
    }

    public AvailabilityAnalysis analyze(DateRange candidate, String scopeId, DateRangeIndex index,
                                        String excludeEntryId, int gracePeriodDays, boolean suggestAlternatives) {
        if (gracePeriodDays < 0) {
            throw new IllegalArgumentException("gracePeriodDays must not be negative");
        }
        LocalDate searchStart = candidate.start().minusDays(SEARCH_WINDOW_DAYS);
        LocalDate searchEnd = candidate.end().plusDays(SEARCH_WINDOW_DAYS);

        List<ScheduledRange> nearby = new ArrayList<>();
        for (ScheduledRange existing : index.rangesFor(scopeId)) {
            if (existing.entryId().equals(excludeEntryId)) {
                continue;
            }
            DateRange r = existing.range();
            if (!r.end().isBefore(searchStart) && !r.start().isAfter(searchEnd)) {
                nearby.add(existing);
            }
        }

        List<ConflictRecord> conflicts = detector.detect(candidate, scopeId, index, excludeEntryId).conflicts();

        List<GracePeriodViolation> violations = new ArrayList<>();
        for (ScheduledRange existing : nearby) {
            long gapAfterExisting = ChronoUnit.DAYS.between(existing.range().end(), candidate.start());
            long gapBeforeExisting = ChronoUnit.DAYS.between(candidate.end(), existing.range().start());
            if (gapAfterExisting > 0 && gapAfterExisting < gracePeriodDays) {
                violations.add(new GracePeriodViolation(existing.entryId(), gapAfterExisting, Position.AFTER));
            }
            if (gapBeforeExisting > 0 && gapBeforeExisting < gracePeriodDays) {
                violations.add(new GracePeriodViolation(existing.entryId(), gapBeforeExisting, Position.BEFORE));
            }
        }

        List<AlternativeRange> alternatives = new ArrayList<>();
        if (suggestAlternatives && !conflicts.isEmpty() && !nearby.isEmpty()) {
            long duration = candidate.lengthInDays();

            for (int i = 0; i < nearby.size() - 1; i++) {
                ScheduledRange current = nearby.get(i);
                ScheduledRange next = nearby.get(i + 1);
                LocalDate gapStart = current.range().end().plusDays(gracePeriodDays);
                LocalDate gapEnd = next.range().start().minusDays(gracePeriodDays);
                if (ChronoUnit.DAYS.between(gapStart, gapEnd) >= duration) {
                    alternatives.add(new AlternativeRange(candidate.shiftTo(gapStart),
                            "Available between " + current.labelOrType() + " and " + next.labelOrType(),
                            Confidence.HIGH));
                }
            }

            ScheduledRange first = nearby.get(0);
            LocalDate beforeEnd = first.range().start().minusDays(gracePeriodDays);
            LocalDate beforeStart = beforeEnd.minusDays(duration);
            if (!beforeStart.isBefore(searchStart)) {
                alternatives.add(new AlternativeRange(new DateRange(beforeStart, beforeEnd),
                        "Available before " + first.labelOrType(), Confidence.MEDIUM));
            }

            ScheduledRange last = nearby.get(nearby.size() - 1);
            LocalDate afterStart = last.range().end().plusDays(gracePeriodDays);
            LocalDate afterEnd = afterStart.plusDays(duration);
            if (!afterEnd.isAfter(searchEnd)) {
                alternatives.add(new AlternativeRange(new DateRange(afterStart, afterEnd),
                        "Available after " + last.labelOrType(), Confidence.MEDIUM));
            }
        }

        List<AlternativeRange> limited = alternatives.size() > maxAlternatives
                ? alternatives.subList(0, maxAlternatives)
                : alternatives;
        return new AvailabilityAnalysis(conflicts, violations, limited);
    }
}
