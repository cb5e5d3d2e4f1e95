package com.property.reconciliation.bulk;

import com.property.reconciliation.booking.BookingCalendar;
import com.property.reconciliation.core.model.Booking;
import com.property.reconciliation.core.model.Contact;
import com.property.reconciliation.core.model.ContactPropertyLink;
import com.property.reconciliation.core.model.Destination;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.core.model.PriceRange;
import com.property.reconciliation.core.model.Property;
import com.property.reconciliation.overlap.DateRangeIndex;
import com.property.reconciliation.reference.ReferenceIndex;
import com.property.reconciliation.reference.ReferenceKind;
import com.property.reconciliation.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Preload phase of a batch: reads every record the rows may refer to in one
 * pass, so the row loop never queries the store for lookups.
 */
public class BatchContextLoader {
    private static final Logger log = LoggerFactory.getLogger(BatchContextLoader.class);

    public BatchContext load(StoreTransaction tx, String batchId, ImportTarget target, ImportMode mode,
                             ImportOptions options, String actorId) {
        ReferenceIndex properties = ReferenceIndex.of(ReferenceKind.PROPERTY,
                tx.findAll(EntityType.PROPERTY, Property.class));
        ReferenceIndex destinations = ReferenceIndex.of(ReferenceKind.DESTINATION,
                tx.findAll(EntityType.DESTINATION, Destination.class));

        List<Booking> existingBookings = tx.findAll(EntityType.BOOKING, Booking.class);
        Map<String, String> bookingsByExternalId = new HashMap<>();
        for (Booking booking : existingBookings) {
            if (booking.externalId() != null) {
                bookingsByExternalId.putIfAbsent(booking.externalId(), booking.id());
            }
        }

        Map<String, String> contactsByEmail = new HashMap<>();
        for (Contact contact : tx.findAll(EntityType.CONTACT, Contact.class)) {
            if (contact.email() != null && !contact.email().isBlank()) {
                contactsByEmail.putIfAbsent(BatchContext.emailKey(contact.email()), contact.id());
            }
        }

        Set<String> links = new HashSet<>();
        for (ContactPropertyLink link : tx.findAll(EntityType.CONTACT_PROPERTY_LINK, ContactPropertyLink.class)) {
            links.add(link.contactId() + "|" + link.propertyId());
        }

        DateRangeIndex bookingIndex = BookingCalendar.index(existingBookings);
        DateRangeIndex priceIndex = PriceCalendar.index(tx.findAll(EntityType.PRICE_RANGE, PriceRange.class));
        log.debug("preload.completed properties={} destinations={} bookings={} priceRanges={} contacts={}",
                properties.size(), destinations.size(), bookingIndex.size(), priceIndex.size(),
                contactsByEmail.size());
        return new BatchContext(batchId, target, mode, options, actorId, tx, properties, destinations,
                bookingIndex, priceIndex, contactsByEmail, bookingsByExternalId, links);
    }
}
