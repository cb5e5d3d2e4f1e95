package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.core.model.PriceRange;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.overlap.ConflictRecord;
import com.property.reconciliation.overlap.DateRange;
import com.property.reconciliation.overlap.OverlapDetector;
import com.property.reconciliation.overlap.OverlapResult;
import com.property.reconciliation.writer.EntityWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes one pricing period after checking it against the property's
 * calendar. A period that overlaps no other one is created. On overlap:
 * <ul>
 *   <li>with {@link ImportOptions#isSkipPriceConflicts()} the period is skipped;</li>
 *   <li>in create mode it is refused;</li>
 *   <li>otherwise it replaces the dates and rates of the single period it overlaps.</li>
 * </ul>
 */
final class PricePeriodWriter {
    private static final Logger log = LoggerFactory.getLogger(PricePeriodWriter.class);

    static final String CONFLICT = "Date range conflicts with existing price range";

    enum Result {
        CREATED,
        UPDATED,
        SKIPPED,
        REFUSED
    }

    record Write(Result result, String priceRangeId, String message) {
    }

    private final EntityWriter writer;
    private final OverlapDetector detector;
    private final MetricsService metricsService;

    PricePeriodWriter(EntityWriter writer, OverlapDetector detector, MetricsService metricsService) {
        this.writer = Objects.requireNonNull(writer, "writer is required");
        this.detector = Objects.requireNonNull(detector, "detector is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * @param createWhenFree whether a period overlapping nothing may be created;
     *                       when false such a period is refused
     */
    Write write(BatchContext context, PriceRange candidate, boolean createWhenFree) {
        DateRange range = DateRange.of(candidate.startDate(), candidate.endDate());
        OverlapResult overlap = detector.detect(range, candidate.propertyId(), context.priceRanges());

        if (!overlap.hasConflicts()) {
            if (!createWhenFree) {
                return new Write(Result.REFUSED, null, "No existing price range overlaps " + range + " to update");
            }
            writer.create(context.transaction(), candidate, context.getActorId());
            context.recordPriceRange(candidate);
            return new Write(Result.CREATED, candidate.id(), null);
        }

        String names = overlap.conflicts().stream()
                .map(c -> "\"" + (c.label() != null ? c.label() : c.entryId()) + "\"")
                .collect(Collectors.joining(", "));
        if (context.getOptions().isSkipPriceConflicts()) {
            metricsService.incrementConflictDetected("skipped");
            return new Write(Result.SKIPPED, null, CONFLICT + " " + names + ", skipped");
        }
        if (context.getMode() == ImportMode.CREATE) {
            metricsService.incrementConflictDetected("error");
            return new Write(Result.REFUSED, null, CONFLICT + " " + names);
        }
        if (overlap.conflicts().size() > 1) {
            metricsService.incrementConflictDetected("error");
            return new Write(Result.REFUSED, null, "Date range overlaps " + overlap.conflicts().size()
                    + " existing price ranges (" + names + "); cannot choose one to update");
        }

        ConflictRecord target = overlap.conflicts().get(0);
        PriceRange existing = (PriceRange) context.transaction()
                .findById(EntityType.PRICE_RANGE, target.entryId())
                .orElseThrow(() -> new IllegalStateException("Price range " + target.entryId()
                        + " vanished from the transaction"));
        PriceRange updated = new PriceRange(existing.id(), existing.propertyId(),
                candidate.name() != null ? candidate.name() : existing.name(),
                candidate.startDate(), candidate.endDate(),
                candidate.ownerNightlyRate() != null ? candidate.ownerNightlyRate() : existing.ownerNightlyRate(),
                candidate.ownerWeeklyRate() != null ? candidate.ownerWeeklyRate() : existing.ownerWeeklyRate(),
                existing.validated());
        writer.update(context.transaction(), updated, context.getActorId());
        context.recordPriceRange(updated);
        metricsService.incrementConflictDetected("updated");
        log.debug("price.replaced id={} from={} to={}", existing.id(), target.range(), range);
        return new Write(Result.UPDATED, existing.id(), null);
    }
}
