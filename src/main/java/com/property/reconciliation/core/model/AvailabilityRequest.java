package com.property.reconciliation.core.model;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A guest enquiry for a stay that has not been turned into a booking yet.
 */
public record AvailabilityRequest(
        String id,
        String propertyId,
        LocalDate startDate,
        LocalDate endDate,
        String guestName,
        String guestEmail,
        String guestPhone,
        int numberOfGuests,
        String message,
        RequestStatus status,
        RequestUrgency urgency,
        String requestedBy
) implements CanonicalEntity {

    public AvailabilityRequest {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(propertyId, "propertyId is required");
        Objects.requireNonNull(startDate, "startDate is required");
        Objects.requireNonNull(endDate, "endDate is required");
        Objects.requireNonNull(guestName, "guestName is required");
        Objects.requireNonNull(guestEmail, "guestEmail is required");
        guestPhone = guestPhone != null ? guestPhone : "";
        status = status != null ? status : RequestStatus.PENDING;
        urgency = urgency != null ? urgency : RequestUrgency.MEDIUM;
        if (numberOfGuests < 1) {
            throw new IllegalArgumentException("numberOfGuests must be at least 1");
        }
    }

    @Override
    public EntityType entityType() {
        return EntityType.AVAILABILITY_REQUEST;
    }

    @Override
    public Map<EntityType, String> references() {
        Map<EntityType, String> refs = new HashMap<>();
        refs.put(EntityType.PROPERTY, propertyId);
        return refs;
    }

    @Override
    public String displayName() {
        return guestName;
    }
}
