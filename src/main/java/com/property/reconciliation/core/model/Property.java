package com.property.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A rentable house. Name matching against imports is case-insensitive,
 * but the store does not enforce name uniqueness.
 */
public record Property(
        String id,
        String name,
        String destinationId,
        Integer numberOfRooms,
        Integer numberOfBathrooms,
        Integer maxGuests,
        String address,
        String city,
        BigDecimal latitude,
        BigDecimal longitude,
        PropertyStatus status,
        String segment,
        List<String> categories
) implements CanonicalEntity {

    public Property {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        status = status != null ? status : PropertyStatus.PUBLISHED;
        categories = categories != null ? List.copyOf(categories) : List.of();
    }

    @Override
    public EntityType entityType() {
        return EntityType.PROPERTY;
    }

    @Override
    public Map<EntityType, String> references() {
        Map<EntityType, String> refs = new HashMap<>();
        refs.put(EntityType.DESTINATION, destinationId);
        return refs;
    }

    @Override
    public String displayName() {
        return name;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Property property) {
        return new Builder()
                .id(property.id)
                .name(property.name)
                .destinationId(property.destinationId)
                .numberOfRooms(property.numberOfRooms)
                .numberOfBathrooms(property.numberOfBathrooms)
                .maxGuests(property.maxGuests)
                .address(property.address)
                .city(property.city)
                .latitude(property.latitude)
                .longitude(property.longitude)
                .status(property.status)
                .segment(property.segment)
                .categories(property.categories);
    }

    public static class Builder {
        private String id;
        private String name;
        private String destinationId;
        private Integer numberOfRooms;
        private Integer numberOfBathrooms;
        private Integer maxGuests;
        private String address;
        private String city;
        private BigDecimal latitude;
        private BigDecimal longitude;
        private PropertyStatus status;
        private String segment;
        private List<String> categories;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder destinationId(String destinationId) {
            this.destinationId = destinationId;
            return this;
        }

        public Builder numberOfRooms(Integer numberOfRooms) {
            this.numberOfRooms = numberOfRooms;
            return this;
        }

        public Builder numberOfBathrooms(Integer numberOfBathrooms) {
            this.numberOfBathrooms = numberOfBathrooms;
            return this;
        }

        public Builder maxGuests(Integer maxGuests) {
            this.maxGuests = maxGuests;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder latitude(BigDecimal latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder longitude(BigDecimal longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder status(PropertyStatus status) {
            this.status = status;
            return this;
        }

        public Builder segment(String segment) {
            this.segment = segment;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Property build() {
            return new Property(id, name, destinationId, numberOfRooms, numberOfBathrooms, maxGuests,
                    address, city, latitude, longitude, status, segment, categories);
        }
    }
}
