package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.Booking;
import com.property.reconciliation.core.model.BookingSource;
import com.property.reconciliation.core.model.BookingStatus;
import com.property.reconciliation.core.model.BookingType;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.overlap.DateRange;
import com.property.reconciliation.overlap.OverlapDetector;
import com.property.reconciliation.overlap.OverlapResult;
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
 * Booking sheet. Rows are matched to existing bookings by external id and
 * checked for overlaps against the bookings persisted before the batch.
 * An overlap only warns in create mode; in update and both modes it fails the row.
 * An external id repeated inside one file fails every occurrence after the first.
 */
public class BookingRowHandler extends AbstractRowHandler {
    private static final Logger log = LoggerFactory.getLogger(BookingRowHandler.class);

    static final String END_BEFORE_START = "End date must be after start date";
    static final String DUPLICATE_IN_FILE = "Duplicate booking external id within import file";

    private final OverlapDetector detector;
    private final MetricsService metricsService;

    public BookingRowHandler(RowValidator validator, ReferenceResolver resolver, EntityWriter writer,
                             OverlapDetector detector, MetricsService metricsService) {
        super(validator, resolver, writer);
        this.detector = detector;
        this.metricsService = metricsService;
    }

    @Override
    public ImportTarget target() {
        return ImportTarget.BOOKINGS;
    }

    @Override
    public void prepare(List<ImportRow> rows, BatchContext context) {
        for (ImportRow row : rows) {
            context.noteIdentity(identityKey(row.firstValue(List.of("externalId", "bookingId"))), row.rowNumber());
        }
    }

    @Override
    public RowOutcome handle(ImportRow row, BatchContext context) {
        ValidationResult result = validator.validate(row, ImportSchemas.BOOKING);
        if (!result.isValid()) {
            return invalid(result);
        }
        ValidatedRow data = result.row();
        List<RowDiagnostic> warnings = warningsOf(result);
        int rowNumber = row.rowNumber();
        String externalId = data.getString("externalId");
        if (!context.isFirstOccurrence(identityKey(externalId), rowNumber)) {
            return RowOutcome.Failed.of(rowNumber, DUPLICATE_IN_FILE, "externalId", warnings);
        }

        Optional<DateRange> range = DateRange.tryOf(data.getDate("startDate"), data.getDate("endDate"));
        if (range.isEmpty()) {
            return RowOutcome.Failed.of(rowNumber, END_BEFORE_START, "endDate", warnings);
        }

        String propertyName = data.getString("propertyName");
        ReferenceResolution property = resolveProperty(propertyName, context);
        if (!property.isResolved()) {
            return RowOutcome.Failed.of(rowNumber, property.notFoundMessage(), "propertyName", warnings);
        }
        if (property.reference().wasAutoCreated()) {
            warnings.add(RowDiagnostic.of(rowNumber,
                    "Auto-created property: \"" + property.reference().name() + "\"", "propertyName"));
        }
        String propertyId = property.id();

        Optional<String> existingId = context.bookingIdForExternalId(externalId);
        ImportMode mode = context.getMode();
        if (existingId.isPresent() && mode == ImportMode.CREATE) {
            return RowOutcome.Failed.of(rowNumber, "Booking \"" + externalId + "\" already exists", "externalId",
                    warnings);
        }
        if (existingId.isEmpty() && mode == ImportMode.UPDATE) {
            String message = externalId == null
                    ? "An external id is required to update a booking"
                    : "Booking \"" + externalId + "\" not found for update";
            return RowOutcome.Failed.of(rowNumber, message, "externalId", warnings);
        }

        OverlapResult overlap = detector.detect(range.get(), propertyId, context.bookings(),
                existingId.orElse(null));
        if (overlap.hasConflicts()) {
            String message = "Booking overlaps with existing booking for \"" + propertyName + "\" ("
                    + overlap.conflictTypes() + ")";
            if (mode == ImportMode.CREATE) {
                metricsService.incrementConflictDetected("warning");
                warnings.add(RowDiagnostic.of(rowNumber, message, "dates"));
            } else {
                metricsService.incrementConflictDetected("error");
                return RowOutcome.Failed.of(rowNumber, message, "dates", warnings);
            }
        }

        if (existingId.isPresent()) {
            Booking existing = (Booking) context.transaction()
                    .findById(EntityType.BOOKING, existingId.get())
                    .orElseThrow(() -> new IllegalStateException("Booking " + existingId.get()
                            + " vanished from the transaction"));
            Booking updated = apply(Booking.builder(existing), row, data)
                    .propertyId(propertyId)
                    .startDate(range.get().start())
                    .endDate(range.get().end())
                    .build();
            writer.update(context.transaction(), updated, context.getActorId());
            log.debug("booking.updated row={} id={}", rowNumber, updated.id());
            return new RowOutcome.Updated(rowNumber, updated.id(), warnings);
        }

        Booking created = apply(Booking.builder(), row, data)
                .id(UUID.randomUUID().toString())
                .propertyId(propertyId)
                .type(data.getEnum("bookingType", BookingType.class))
                .status(data.getEnum("status", BookingStatus.class))
                .source(BookingSource.IMPORT)
                .startDate(range.get().start())
                .endDate(range.get().end())
                .externalId(externalId)
                .createdBy(context.getActorId())
                .build();
        writer.create(context.transaction(), created, context.getActorId());
        context.registerBooking(externalId, created.id());
        log.debug("booking.created row={} id={} property={}", rowNumber, created.id(), propertyId);
        return new RowOutcome.Created(rowNumber, created.id(), warnings);
    }

    private static String identityKey(String externalId) {
        return externalId != null ? "external:" + externalId : null;
    }

    private static Booking.Builder apply(Booking.Builder builder, ImportRow row, ValidatedRow data) {
        if (row.hasValue("bookingType") || row.hasValue("type")) {
            builder.type(data.getEnum("bookingType", BookingType.class));
        }
        if (row.hasValue("status") || row.hasValue("bookingStatus")) {
            builder.status(data.getEnum("status", BookingStatus.class));
        }
        if (data.has("guestName")) {
            builder.guestName(data.getString("guestName"));
        }
        if (data.has("guestEmail")) {
            builder.guestEmail(data.getString("guestEmail"));
        }
        if (data.has("guestPhone")) {
            builder.guestPhone(data.getString("guestPhone"));
        }
        if (data.has("numberOfGuests")) {
            builder.numberOfGuests(data.getInteger("numberOfGuests"));
        }
        if (data.has("totalAmount")) {
            builder.totalAmount(data.getDecimal("totalAmount"));
        }
        if (data.has("notes")) {
            builder.notes(data.getString("notes"));
        }
        return builder;
    }
}
