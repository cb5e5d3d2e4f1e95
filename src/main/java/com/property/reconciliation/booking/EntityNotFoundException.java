package com.property.reconciliation.booking;

import com.property.reconciliation.core.model.EntityType;

public class EntityNotFoundException extends RuntimeException {

    private final EntityType entityType;
    private final String entityId;

    public EntityNotFoundException(EntityType entityType, String entityId) {
        super(entityType.getLabel() + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
