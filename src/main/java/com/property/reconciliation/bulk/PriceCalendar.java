package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.PriceRange;
import com.property.reconciliation.overlap.DateRange;
import com.property.reconciliation.overlap.DateRangeIndex;
import com.property.reconciliation.overlap.ScheduledRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-property index of pricing periods.
 */
final class PriceCalendar {
    private static final Logger log = LoggerFactory.getLogger(PriceCalendar.class);

    static final String TYPE = "PRICE_RANGE";

    private PriceCalendar() {
    }

    static DateRangeIndex index(Collection<PriceRange> priceRanges) {
        List<ScheduledRange> ranges = new ArrayList<>();
        for (PriceRange priceRange : priceRanges) {
            entry(priceRange).ifPresent(ranges::add);
        }
        return DateRangeIndex.of(ranges);
    }

    static Optional<ScheduledRange> entry(PriceRange priceRange) {
        Optional<DateRange> range = DateRange.tryOf(priceRange.startDate(), priceRange.endDate());
        if (range.isEmpty()) {
            log.warn("calendar.invalid_price_range priceRangeId={} start={} end={}",
                    priceRange.id(), priceRange.startDate(), priceRange.endDate());
            return Optional.empty();
        }
        return Optional.of(new ScheduledRange(priceRange.id(), priceRange.propertyId(), range.get(), TYPE,
                priceRange.name()));
    }
}
