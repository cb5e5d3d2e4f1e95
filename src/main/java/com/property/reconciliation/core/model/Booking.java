package com.property.reconciliation.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A period during which a property is occupied or blocked.
 * Bookings carry no uniqueness constraint; conflicts are only reported
 * by the overlap detector.
 */
public record Booking(
        String id,
        String propertyId,
        BookingType type,
        BookingStatus status,
        BookingSource source,
        LocalDate startDate,
        LocalDate endDate,
        String guestName,
        String guestEmail,
        String guestPhone,
        Integer numberOfGuests,
        BigDecimal totalAmount,
        String notes,
        String externalId,
        String createdBy
) implements CanonicalEntity {

    public Booking {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(propertyId, "propertyId is required");
        Objects.requireNonNull(startDate, "startDate is required");
        Objects.requireNonNull(endDate, "endDate is required");
        type = type != null ? type : BookingType.CONFIRMED;
        status = status != null ? status : BookingStatus.CONFIRMED;
        source = source != null ? source : BookingSource.MANUAL;
    }

    @Override
    public EntityType entityType() {
        return EntityType.BOOKING;
    }

    @Override
    public Map<EntityType, String> references() {
        Map<EntityType, String> refs = new HashMap<>();
        refs.put(EntityType.PROPERTY, propertyId);
        return refs;
    }

    @Override
    public String displayName() {
        return guestName != null ? guestName : type.name();
    }

    public boolean isCancelled() {
        return status == BookingStatus.CANCELLED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Booking booking) {
        return new Builder()
                .id(booking.id)
                .propertyId(booking.propertyId)
                .type(booking.type)
                .status(booking.status)
                .source(booking.source)
                .startDate(booking.startDate)
                .endDate(booking.endDate)
                .guestName(booking.guestName)
                .guestEmail(booking.guestEmail)
                .guestPhone(booking.guestPhone)
                .numberOfGuests(booking.numberOfGuests)
                .totalAmount(booking.totalAmount)
                .notes(booking.notes)
                .externalId(booking.externalId)
                .createdBy(booking.createdBy);
    }

    public static class Builder {
        private String id;
        private String propertyId;
        private BookingType type;
        private BookingStatus status;
        private BookingSource source;
        private LocalDate startDate;
        private LocalDate endDate;
        private String guestName;
        private String guestEmail;
        private String guestPhone;
        private Integer numberOfGuests;
        private BigDecimal totalAmount;
        private String notes;
        private String externalId;
        private String createdBy;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder propertyId(String propertyId) {
            this.propertyId = propertyId;
            return this;
        }

        public Builder type(BookingType type) {
            this.type = type;
            return this;
        }

        public Builder status(BookingStatus status) {
            this.status = status;
            return this;
        }

        public Builder source(BookingSource source) {
            this.source = source;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder guestName(String guestName) {
            this.guestName = guestName;
            return this;
        }

        public Builder guestEmail(String guestEmail) {
            this.guestEmail = guestEmail;
            return this;
        }

        public Builder guestPhone(String guestPhone) {
            this.guestPhone = guestPhone;
            return this;
        }

        public Builder numberOfGuests(Integer numberOfGuests) {
            this.numberOfGuests = numberOfGuests;
            return this;
        }

        public Builder totalAmount(BigDecimal totalAmount) {
            this.totalAmount = totalAmount;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Booking build() {
            return new Booking(id, propertyId, type, status, source, startDate, endDate, guestName,
                    guestEmail, guestPhone, numberOfGuests, totalAmount, notes, externalId, createdBy);
        }
    }
}
