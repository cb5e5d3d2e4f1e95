package com.property.reconciliation.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public record PriceRange(
        String id,
        String propertyId,
        String name,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal ownerNightlyRate,
        BigDecimal ownerWeeklyRate,
        boolean validated
) implements CanonicalEntity {

    public PriceRange {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(propertyId, "propertyId is required");
        Objects.requireNonNull(startDate, "startDate is required");
        Objects.requireNonNull(endDate, "endDate is required");
    }

    @Override
    public EntityType entityType() {
        return EntityType.PRICE_RANGE;
    }

    @Override
    public Map<EntityType, String> references() {
        Map<EntityType, String> refs = new HashMap<>();
        refs.put(EntityType.PROPERTY, propertyId);
        return refs;
    }

    @Override
    public String displayName() {
        return name;
    }
}
