package com.property.reconciliation.core.model;

import java.util.Objects;

/**
 * A travel destination that properties belong to.
 */
public record Destination(String id, String name, String country) implements CanonicalEntity {

    public Destination {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        country = country != null ? country : "Unknown";
    }

    @Override
    public EntityType entityType() {
        return EntityType.DESTINATION;
    }

    @Override
    public String displayName() {
        return name;
    }
}
