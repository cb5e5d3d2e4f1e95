package com.property.reconciliation.booking;

import com.property.reconciliation.bulk.ImportOptions;
import com.property.reconciliation.core.model.Booking;
import com.property.reconciliation.core.model.CanonicalEntity;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.logging.LogContext;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.metrics.NoOpMetricsService;
import com.property.reconciliation.overlap.AvailabilityAdvisor;
import com.property.reconciliation.overlap.AvailabilityAnalysis;
import com.property.reconciliation.overlap.DateRange;
import com.property.reconciliation.overlap.DateRangeIndex;
import com.property.reconciliation.overlap.OverlapDetector;
import com.property.reconciliation.overlap.OverlapResult;
import com.property.reconciliation.store.ConstraintViolationException;
import com.property.reconciliation.store.StoreException;
import com.property.reconciliation.store.StoreTransaction;
import com.property.reconciliation.store.TransactionCallback;
import com.property.reconciliation.store.TransactionalStore;
import com.property.reconciliation.writer.EntityWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Single-booking operations outside of bulk imports. Unlike an import, any
 * overlap with a non-cancelled booking of the same property rejects the write.
 */
public class BookingService {
    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final TransactionalStore store;
    private final EntityWriter writer;
    private final OverlapDetector detector;
    private final AvailabilityAdvisor advisor;
    private final MetricsService metricsService;
    private final int defaultGracePeriodDays;

    public BookingService(TransactionalStore store, EntityWriter writer, OverlapDetector detector,
                          AvailabilityAdvisor advisor) {
        this(store, writer, detector, advisor, new NoOpMetricsService());
    }

    public BookingService(TransactionalStore store, EntityWriter writer, OverlapDetector detector,
                          AvailabilityAdvisor advisor, MetricsService metricsService) {
        this(store, writer, detector, advisor, metricsService, ImportOptions.defaults().getGracePeriodDays());
    }

    /**
     * @param defaultGracePeriodDays grace period used by {@link #analyzeAvailability(String, DateRange, String, boolean)}
     */
    public BookingService(TransactionalStore store, EntityWriter writer, OverlapDetector detector,
                          AvailabilityAdvisor advisor, MetricsService metricsService, int defaultGracePeriodDays) {
        if (defaultGracePeriodDays < 0) {
            throw new IllegalArgumentException("defaultGracePeriodDays must be >= 0");
        }
        this.defaultGracePeriodDays = defaultGracePeriodDays;
        this.store = Objects.requireNonNull(store, "store is required");
        this.writer = Objects.requireNonNull(writer, "writer is required");
        this.detector = Objects.requireNonNull(detector, "detector is required");
        this.advisor = Objects.requireNonNull(advisor, "advisor is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Conflicts the range would have on the property.
     *
     * @param excludeBookingId booking to ignore, typically the one being moved; may be null
     */
    public OverlapResult checkAvailability(String propertyId, DateRange range, String excludeBookingId) {
        return execute(tx -> detector.detect(range, propertyId, calendar(tx), excludeBookingId));
    }

    public AvailabilityAnalysis analyzeAvailability(String propertyId, DateRange range, String excludeBookingId,
                                                    boolean suggestAlternatives) {
        return analyzeAvailability(propertyId, range, excludeBookingId, defaultGracePeriodDays, suggestAlternatives);
    }

    public AvailabilityAnalysis analyzeAvailability(String propertyId, DateRange range, String excludeBookingId,
                                                    int gracePeriodDays, boolean suggestAlternatives) {
        return execute(tx -> advisor.analyze(range, propertyId, calendar(tx), excludeBookingId,
                gracePeriodDays, suggestAlternatives));
    }

    /**
     * @throws BookingConflictException if the booking overlaps another one
     * @throws EntityNotFoundException  if the property does not exist
     */
    public Booking createBooking(Booking booking, String actorId) {
        Objects.requireNonNull(booking, "booking is required");
        DateRange range = DateRange.of(booking.startDate(), booking.endDate());
        requireGuest(booking);
        try (LogContext ctx = LogContext.forBooking(booking.id(), "create")) {
            Booking created = execute(tx -> {
                requireExists(tx, EntityType.PROPERTY, booking.propertyId());
                rejectConflicts(tx, booking, range, null);
                return writer.create(tx, booking, actorId);
            });
            log.info("booking.created bookingId={} propertyId={} range={}", created.id(), created.propertyId(), range);
            return created;
        }
    }

    /**
     * Replaces a booking. The booking's own dates never count as a conflict.
     */
    public Booking updateBooking(Booking booking, String actorId) {
        Objects.requireNonNull(booking, "booking is required");
        DateRange range = DateRange.of(booking.startDate(), booking.endDate());
        requireGuest(booking);
        try (LogContext ctx = LogContext.forBooking(booking.id(), "update")) {
            Booking updated = execute(tx -> {
                requireExists(tx, EntityType.BOOKING, booking.id());
                requireExists(tx, EntityType.PROPERTY, booking.propertyId());
                rejectConflicts(tx, booking, range, booking.id());
                return writer.update(tx, booking, actorId);
            });
            log.info("booking.updated bookingId={} range={} status={}", updated.id(), range, updated.status());
            return updated;
        }
    }

    public void deleteBooking(String bookingId, String actorId) {
        try (LogContext ctx = LogContext.forBooking(bookingId, "delete")) {
            execute(tx -> {
                List<CanonicalEntity> removed = writer.delete(tx, EntityType.BOOKING, bookingId, actorId);
                if (removed.isEmpty()) {
                    throw new EntityNotFoundException(EntityType.BOOKING, bookingId);
                }
                return removed;
            });
            log.info("booking.deleted bookingId={}", bookingId);
        }
    }

    private void rejectConflicts(StoreTransaction tx, Booking booking, DateRange range, String excludeId) {
        if (booking.isCancelled()) {
            return;
        }
        OverlapResult overlap = detector.detect(range, booking.propertyId(), calendar(tx), excludeId);
        if (overlap.hasConflicts()) {
            metricsService.incrementConflictDetected("rejected");
            log.warn("booking.rejected propertyId={} range={} conflicts={}", booking.propertyId(), range,
                    overlap.conflicts().size());
            throw new BookingConflictException(booking.propertyId(), overlap.conflicts());
        }
    }

    private static void requireGuest(Booking booking) {
        if (booking.type().requiresGuest() && (booking.guestName() == null || booking.guestName().isBlank())) {
            throw new IllegalArgumentException("A guest name is required for " + booking.type() + " bookings");
        }
    }

    private static void requireExists(StoreTransaction tx, EntityType type, String id) {
        if (tx.findById(type, id).isEmpty()) {
            throw new EntityNotFoundException(type, id);
        }
    }

    private static DateRangeIndex calendar(StoreTransaction tx) {
        return BookingCalendar.index(tx.findAll(EntityType.BOOKING, Booking.class));
    }

    /**
     * Runs the callback in a transaction and surfaces the domain exception
     * that caused a rollback instead of the store's wrapper.
     */
    private <T> T execute(TransactionCallback<T> callback) {
        try {
            return store.inTransaction(callback);
        } catch (StoreException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BookingConflictException
                    || cause instanceof EntityNotFoundException
                    || cause instanceof ConstraintViolationException
                    || cause instanceof IllegalArgumentException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }
}
