package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.AvailabilityRequest;
import com.property.reconciliation.core.model.Booking;
import com.property.reconciliation.core.model.BookingSource;
import com.property.reconciliation.core.model.BookingStatus;
import com.property.reconciliation.core.model.BookingType;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.core.model.OperationalCost;
import com.property.reconciliation.core.model.OperationalCostType;
import com.property.reconciliation.core.model.PriceRange;
import com.property.reconciliation.core.model.PriceType;
import com.property.reconciliation.core.model.Property;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.RequestStatus;
import com.property.reconciliation.core.model.RequestUrgency;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One-sheet import where each row names a property and may carry any of the
 * pricing, cost, booking and availability request sections. A section is
 * written when one of its marker columns has a value.
 *
 * <p>Rows run sequentially: a row may create the property a later row
 * attaches its sections to. A pricing period overlapping another one is
 * handled as on the pricing sheet, except that a refusal only skips the
 * section with a warning.</p>
 */
public class CombinedRowHandler extends AbstractRowHandler {
    private static final Logger log = LoggerFactory.getLogger(CombinedRowHandler.class);

    private final OverlapDetector detector;
    private final MetricsService metricsService;
    private final PricePeriodWriter periods;

    public CombinedRowHandler(RowValidator validator, ReferenceResolver resolver, EntityWriter writer,
                              OverlapDetector detector, MetricsService metricsService) {
        super(validator, resolver, writer);
        this.detector = detector;
        this.metricsService = metricsService;
        this.periods = new PricePeriodWriter(writer, detector, metricsService);
    }

    @Override
    public ImportTarget target() {
        return ImportTarget.COMBINED;
    }

    @Override
    public boolean concurrent() {
        return false;
    }

    @Override
    public RowOutcome handle(ImportRow row, BatchContext context) {
        ValidationResult result = validator.validate(row, ImportSchemas.COMBINED);
        if (!result.isValid()) {
            return invalid(result);
        }
        ValidatedRow data = result.row();
        List<RowDiagnostic> warnings = warningsOf(result);
        int rowNumber = row.rowNumber();
        String propertyName = data.getString("propertyName");
        boolean propertySection = ImportSchemas.PROPERTY_SECTION.isPresent(row);

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        Optional<String> existingId = context.properties().idForName(propertyName);
        String propertyId;

        if (existingId.isEmpty()) {
            if (context.getMode() == ImportMode.UPDATE) {
                return RowOutcome.Failed.of(rowNumber, "Property \"" + propertyName + "\" not found for update",
                        "propertyName", warnings);
            }
            if (!propertySection) {
                ReferenceResolution missing = resolver.resolve(propertyName, context.properties(), null,
                        context.getOptions().getSuggestionLimit());
                return RowOutcome.Failed.of(rowNumber, missing.notFoundMessage(), "propertyName", warnings);
            }
            String destinationId;
            if (data.has("destinationName")) {
                ReferenceResolution destination = resolveDestination(data.getString("destinationName"), context);
                if (!destination.isResolved()) {
                    return RowOutcome.Failed.of(rowNumber, destination.notFoundMessage(), "destinationName",
                            warnings);
                }
                if (destination.reference().wasAutoCreated()) {
                    String country = resolver.getCountryLookup().countryFor(destination.reference().name(),
                            context.getOptions().getDefaultCountry());
                    warnings.add(RowDiagnostic.of(rowNumber, autoCreatedDestinationWarning(destination, country),
                            "destinationName"));
                }
                destinationId = destination.id();
            } else {
                destinationId = fallbackDestinationId(context);
            }
            Property.Builder builder = Property.builder()
                    .id(UUID.randomUUID().toString())
                    .name(propertyName)
                    .status(PropertyStatus.HIDDEN);
            Property property = PropertyRowHandler.apply(builder, row, data, destinationId).build();
            writer.create(context.transaction(), property, context.getActorId());
            context.properties().register(property.id(), property.name());
            propertyId = property.id();
            created.add(ImportSchemas.PROPERTY_SECTION.section());
        } else {
            propertyId = existingId.get();
            if (propertySection) {
                if (context.getMode() == ImportMode.CREATE) {
                    warnings.add(RowDiagnostic.of(rowNumber,
                            "Property \"" + propertyName + "\" already exists; property columns ignored",
                            "propertyName"));
                } else {
                    Property existing = (Property) context.transaction()
                            .findById(EntityType.PROPERTY, propertyId)
                            .orElseThrow(() -> new IllegalStateException("Property " + propertyId
                                    + " vanished from the transaction"));
                    String destinationId = null;
                    if (data.has("destinationName")) {
                        ReferenceResolution destination = resolveDestination(data.getString("destinationName"),
                                context);
                        if (!destination.isResolved()) {
                            return RowOutcome.Failed.of(rowNumber, destination.notFoundMessage(),
                                    "destinationName", warnings);
                        }
                        destinationId = destination.id();
                    }
                    writer.update(context.transaction(),
                            PropertyRowHandler.apply(Property.builder(existing), row, data, destinationId).build(),
                            context.getActorId());
                    updated.add(ImportSchemas.PROPERTY_SECTION.section());
                }
            }
        }

        if (ImportSchemas.PRICING_SECTION.isPresent(row)) {
            writePricing(row, data, propertyId, context, created, updated, warnings);
        }
        if (ImportSchemas.COST_SECTION.isPresent(row)) {
            OperationalCost cost = new OperationalCost(UUID.randomUUID().toString(), propertyId,
                    data.getEnum("costType", OperationalCostType.class),
                    data.getDecimal("costEstimatedPrice"), PriceType.PER_STAY);
            writer.create(context.transaction(), cost, context.getActorId());
            created.add(ImportSchemas.COST_SECTION.section());
        }
        if (ImportSchemas.BOOKING_SECTION.isPresent(row)) {
            writeBooking(row, data, propertyId, propertyName, context, created, warnings);
        }
        if (ImportSchemas.REQUEST_SECTION.isPresent(row)) {
            writeRequest(row, data, propertyId, context, created, warnings);
        }

        log.debug("combined.row row={} property={} created={} updated={}", rowNumber, propertyId, created, updated);
        if (!created.isEmpty()) {
            List<String> sections = new ArrayList<>(created);
            sections.addAll(updated);
            return new RowOutcome.Created(rowNumber, propertyId, warnings, sections);
        }
        if (!updated.isEmpty()) {
            return new RowOutcome.Updated(rowNumber, propertyId, warnings, updated);
        }
        return new RowOutcome.Skipped(rowNumber, "No sections to import", warnings);
    }

    private void writePricing(ImportRow row, ValidatedRow data, String propertyId, BatchContext context,
                              List<String> created, List<String> updated, List<RowDiagnostic> warnings) {
        int rowNumber = row.rowNumber();
        Optional<DateRange> range = DateRange.tryOf(data.getDate("priceStartDate"), data.getDate("priceEndDate"));
        if (range.isEmpty()) {
            warnings.add(RowDiagnostic.of(rowNumber,
                    "Pricing section skipped: valid price start and end dates are required", "priceStartDate"));
            return;
        }
        String name = data.has("periodName") ? data.getString("periodName") : "Period " + rowNumber;
        PriceRange price = new PriceRange(UUID.randomUUID().toString(), propertyId, name,
                range.get().start(), range.get().end(),
                data.getDecimal("ownerNightlyRate"), data.getDecimal("ownerWeeklyRate"), false);
        PricePeriodWriter.Write write = periods.write(context, price, true);
        switch (write.result()) {
            case CREATED -> created.add(ImportSchemas.PRICING_SECTION.section());
            case UPDATED -> updated.add(ImportSchemas.PRICING_SECTION.section());
            default -> warnings.add(RowDiagnostic.of(rowNumber, "Pricing section skipped: " + write.message(),
                    "priceStartDate"));
        }
    }

    private void writeBooking(ImportRow row, ValidatedRow data, String propertyId, String propertyName,
                              BatchContext context, List<String> created, List<RowDiagnostic> warnings) {
        int rowNumber = row.rowNumber();
        Optional<DateRange> range = DateRange.tryOf(data.getDate("bookingStartDate"),
                data.getDate("bookingEndDate"));
        if (range.isEmpty()) {
            warnings.add(RowDiagnostic.of(rowNumber,
                    "Booking section skipped: valid booking start and end dates are required", "bookingStartDate"));
            return;
        }
        OverlapResult overlap = detector.detect(range.get(), propertyId, context.bookings());
        if (overlap.hasConflicts()) {
            metricsService.incrementConflictDetected("warning");
            warnings.add(RowDiagnostic.of(rowNumber, "Booking overlaps with existing booking for \""
                    + propertyName + "\" (" + overlap.conflictTypes() + ")", "dates"));
        }
        Booking booking = Booking.builder()
                .id(UUID.randomUUID().toString())
                .propertyId(propertyId)
                .type(data.getEnum("bookingType", BookingType.class))
                .status(BookingStatus.CONFIRMED)
                .source(BookingSource.IMPORT)
                .startDate(range.get().start())
                .endDate(range.get().end())
                .guestName(data.getString("guestName"))
                .guestEmail(data.getString("guestEmail"))
                .createdBy(context.getActorId())
                .build();
        writer.create(context.transaction(), booking, context.getActorId());
        created.add(ImportSchemas.BOOKING_SECTION.section());
    }

    private void writeRequest(ImportRow row, ValidatedRow data, String propertyId, BatchContext context,
                              List<String> created, List<RowDiagnostic> warnings) {
        int rowNumber = row.rowNumber();
        Optional<DateRange> range = DateRange.tryOf(data.getDate("requestStartDate"),
                data.getDate("requestEndDate"));
        String guestName = data.getString("requestGuestName");
        String guestEmail = data.getString("requestGuestEmail");
        if (range.isEmpty() || guestName == null || guestEmail == null) {
            warnings.add(RowDiagnostic.of(rowNumber,
                    "Availability request skipped: dates, guest name and guest email are required",
                    "requestStartDate"));
            return;
        }
        Integer guests = data.getInteger("requestNumberOfGuests");
        AvailabilityRequest request = new AvailabilityRequest(UUID.randomUUID().toString(), propertyId,
                range.get().start(), range.get().end(), guestName, guestEmail,
                data.getString("requestGuestPhone"),
                guests != null && guests > 0 ? guests : 1,
                data.getString("requestMessage"),
                data.getEnum("requestStatus", RequestStatus.class),
                data.getEnum("requestUrgency", RequestUrgency.class),
                context.getActorId());
        writer.create(context.transaction(), request, context.getActorId());
        created.add(ImportSchemas.REQUEST_SECTION.section());
    }
}
