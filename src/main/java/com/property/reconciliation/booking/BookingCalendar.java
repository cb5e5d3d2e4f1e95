package com.property.reconciliation.booking;

import com.property.reconciliation.core.model.Booking;
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
 * Builds the per-property occupation index from stored bookings.
 * Cancelled bookings free their dates and are left out.
 */
public final class BookingCalendar {
    private static final Logger log = LoggerFactory.getLogger(BookingCalendar.class);

    private BookingCalendar() {
    }

    public static DateRangeIndex index(Collection<Booking> bookings) {
        List<ScheduledRange> ranges = new ArrayList<>();
        for (Booking booking : bookings) {
            if (booking.isCancelled()) {
                continue;
            }
            Optional<DateRange> range = DateRange.tryOf(booking.startDate(), booking.endDate());
            if (range.isEmpty()) {
                log.warn("calendar.invalid_booking_range bookingId={} start={} end={}",
                        booking.id(), booking.startDate(), booking.endDate());
                continue;
            }
            ranges.add(new ScheduledRange(booking.id(), booking.propertyId(), range.get(),
                    booking.type().name(), booking.guestName()));
        }
        return DateRangeIndex.of(ranges);
    }
}
