package com.property.reconciliation.bulk;

import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.core.model.Property;
import com.property.reconciliation.core.model.PropertyStatus;
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
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Property sheet. Identity is the case-insensitive property name; the
 * destination is given by id or by name, and unknown destination names are
 * created when the batch allows it.
 */
public class PropertyRowHandler extends AbstractRowHandler {
    private static final Logger log = LoggerFactory.getLogger(PropertyRowHandler.class);

    static final String DUPLICATE_IN_FILE = "Duplicate property name within import file";

    public PropertyRowHandler(RowValidator validator, ReferenceResolver resolver, EntityWriter writer) {
        super(validator, resolver, writer);
    }

    @Override
    public ImportTarget target() {
        return ImportTarget.PROPERTIES;
    }

    @Override
    public void prepare(List<ImportRow> rows, BatchContext context) {
        for (ImportRow row : rows) {
            context.noteIdentity(identityKey(row.firstValue(List.of("name", "propertyName"))), row.rowNumber());
        }
    }

    @Override
    public RowOutcome handle(ImportRow row, BatchContext context) {
        ValidationResult result = validator.validate(row, ImportSchemas.PROPERTY);
        if (!result.isValid()) {
            return invalid(result);
        }
        ValidatedRow data = result.row();
        List<RowDiagnostic> warnings = warningsOf(result);
        int rowNumber = row.rowNumber();
        String name = data.getString("name");

        if (!context.isFirstOccurrence(identityKey(name), rowNumber)) {
            return RowOutcome.Failed.of(rowNumber, DUPLICATE_IN_FILE, "name", warnings);
        }

        Optional<String> existingId = context.properties().idForName(name);
        ImportMode mode = context.getMode();
        if (existingId.isPresent() && mode == ImportMode.CREATE) {
            return RowOutcome.Failed.of(rowNumber, "Property \"" + name + "\" already exists", "name", warnings);
        }
        if (existingId.isEmpty() && mode == ImportMode.UPDATE) {
            return RowOutcome.Failed.of(rowNumber, "Property \"" + name + "\" not found for update", "name", warnings);
        }

        String destinationId = null;
        if (data.has("destinationId")) {
            ReferenceResolution destination = resolver.resolve(data.getString("destinationId"),
                    context.destinations(), null, context.getOptions().getSuggestionLimit());
            if (!destination.isResolved()) {
                return RowOutcome.Failed.of(rowNumber, destination.notFoundMessage(), "destinationId", warnings);
            }
            destinationId = destination.id();
        } else if (data.has("destinationName")) {
            ReferenceResolution destination = resolveDestination(data.getString("destinationName"), context);
            if (!destination.isResolved()) {
                return RowOutcome.Failed.of(rowNumber, destination.notFoundMessage(), "destinationName", warnings);
            }
            if (destination.reference().wasAutoCreated()) {
                String country = resolver.getCountryLookup().countryFor(destination.reference().name(),
                        context.getOptions().getDefaultCountry());
                warnings.add(RowDiagnostic.of(rowNumber, autoCreatedDestinationWarning(destination, country),
                        "destinationName"));
            }
            destinationId = destination.id();
        }

        if (existingId.isPresent()) {
            Property existing = (Property) context.transaction()
                    .findById(EntityType.PROPERTY, existingId.get())
                    .orElseThrow(() -> new IllegalStateException("Property " + existingId.get()
                            + " vanished from the transaction"));
            Property updated = apply(Property.builder(existing), row, data, destinationId).build();
            writer.update(context.transaction(), updated, context.getActorId());
            log.debug("property.updated row={} id={}", rowNumber, updated.id());
            return new RowOutcome.Updated(rowNumber, updated.id(), warnings);
        }

        Property.Builder builder = Property.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .status(data.getEnum("status", PropertyStatus.class));
        Property created = apply(builder, row, data, destinationId).build();
        writer.create(context.transaction(), created, context.getActorId());
        context.properties().register(created.id(), created.name());
        log.debug("property.created row={} id={}", rowNumber, created.id());
        return new RowOutcome.Created(rowNumber, created.id(), warnings);
    }

    /**
     * Copies the columns present in the row onto the builder; absent columns
     * leave the builder's value alone so updates only touch what the sheet carries.
     */
    static Property.Builder apply(Property.Builder builder, ImportRow row, ValidatedRow data, String destinationId) {
        if (destinationId != null) {
            builder.destinationId(destinationId);
        }
        if (data.has("numberOfRooms")) {
            builder.numberOfRooms(data.getInteger("numberOfRooms"));
        }
        if (data.has("numberOfBathrooms")) {
            builder.numberOfBathrooms(data.getInteger("numberOfBathrooms"));
        }
        if (data.has("maxGuests")) {
            builder.maxGuests(data.getInteger("maxGuests"));
        }
        if (data.has("address")) {
            builder.address(data.getString("address"));
        }
        if (data.has("city")) {
            builder.city(data.getString("city"));
        }
        if (data.has("latitude")) {
            builder.latitude(data.getDecimal("latitude"));
        }
        if (data.has("longitude")) {
            builder.longitude(data.getDecimal("longitude"));
        }
        if (row.hasValue("status")) {
            builder.status(data.getEnum("status", PropertyStatus.class));
        }
        if (data.has("segment")) {
            builder.segment(data.getString("segment"));
        }
        if (data.has("categories")) {
            builder.categories(data.getList("categories"));
        }
        return builder;
    }

    private static String identityKey(String name) {
        return name == null ? null : name.trim().toLowerCase(Locale.ROOT);
    }
}
