package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.PriceRange;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.overlap.DateRange;
import com.property.reconciliation.overlap.OverlapDetector;
import com.property.reconciliation.reference.ReferenceResolution;
import com.property.reconciliation.reference.ReferenceResolver;
import com.property.reconciliation.validation.ImportRow;
import com.property.reconciliation.validation.ImportSchemas;
import com.property.reconciliation.validation.RowValidator;
import com.property.reconciliation.validation.ValidatedRow;
import com.property.reconciliation.validation.ValidationResult;
import com.property.reconciliation.writer.EntityWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Pricing sheet. Each row is one period of an existing property, identified
 * by the existing period it overlaps: create mode refuses overlaps, update
 * mode only replaces overlapped periods, both mode does either.
 *
 * <p>Rows run sequentially so that every row sees the periods written
 * before it.</p>
 */
public class PriceRangeRowHandler extends AbstractRowHandler {
    private static final Logger log = LoggerFactory.getLogger(PriceRangeRowHandler.class);

    private final PricePeriodWriter periods;

    public PriceRangeRowHandler(RowValidator validator, ReferenceResolver resolver, EntityWriter writer,
                                OverlapDetector detector, MetricsService metricsService) {
        super(validator, resolver, writer);
        this.periods = new PricePeriodWriter(writer, detector, metricsService);
    }

    @Override
    public ImportTarget target() {
        return ImportTarget.PRICE_RANGES;
    }

    @Override
    public boolean concurrent() {
        return false;
    }

    @Override
    public RowOutcome handle(ImportRow row, BatchContext context) {
        ValidationResult result = validator.validate(row, ImportSchemas.PRICE_RANGE);
        if (!result.isValid()) {
            return invalid(result);
        }
        ValidatedRow data = result.row();
        List<RowDiagnostic> warnings = warningsOf(result);
        int rowNumber = row.rowNumber();

        Optional<DateRange> range = DateRange.tryOf(data.getDate("startDate"), data.getDate("endDate"));
        if (range.isEmpty()) {
            return RowOutcome.Failed.of(rowNumber, BookingRowHandler.END_BEFORE_START, "endDate", warnings);
        }
        ReferenceResolution property = resolver.resolve(data.getString("propertyName"), context.properties(), null,
                context.getOptions().getSuggestionLimit());
        if (!property.isResolved()) {
            return RowOutcome.Failed.of(rowNumber, property.notFoundMessage(), "propertyName", warnings);
        }

        PriceRange candidate = new PriceRange(UUID.randomUUID().toString(), property.id(),
                data.getString("periodName"), range.get().start(), range.get().end(),
                data.getDecimal("ownerNightlyRate"), data.getDecimal("ownerWeeklyRate"), false);
        PricePeriodWriter.Write write = periods.write(context, candidate,
                context.getMode() != ImportMode.UPDATE);

        log.debug("price.imported row={} result={} id={}", rowNumber, write.result(), write.priceRangeId());
        return switch (write.result()) {
            case CREATED -> new RowOutcome.Created(rowNumber, write.priceRangeId(), warnings);
            case UPDATED -> new RowOutcome.Updated(rowNumber, write.priceRangeId(), warnings);
            case SKIPPED -> {
                warnings.add(RowDiagnostic.of(rowNumber, write.message(), "startDate"));
                yield new RowOutcome.Skipped(rowNumber, write.message(), warnings);
            }
            case REFUSED -> RowOutcome.Failed.of(rowNumber, write.message(), "startDate", warnings);
        };
    }
}
