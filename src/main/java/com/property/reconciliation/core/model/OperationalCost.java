package com.property.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public record OperationalCost(
        String id,
        String propertyId,
        OperationalCostType costType,
        BigDecimal estimatedPrice,
        PriceType priceType
) implements CanonicalEntity {

    public OperationalCost {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(propertyId, "propertyId is required");
        costType = costType != null ? costType : OperationalCostType.HOUSEKEEPING;
        priceType = priceType != null ? priceType : PriceType.PER_STAY;
    }

    @Override
    public EntityType entityType() {
        return EntityType.OPERATIONAL_COST;
    }

    @Override
    public Map<EntityType, String> references() {
        Map<EntityType, String> refs = new HashMap<>();
        refs.put(EntityType.PROPERTY, propertyId);
        return refs;
    }

    @Override
    public String displayName() {
        return costType.name();
    }
}
