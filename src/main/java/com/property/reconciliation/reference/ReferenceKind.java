package com.property.reconciliation.reference;

import com.property.reconciliation.core.model.EntityType;

/**
 * Kinds of loosely specified references an import row may carry.
 */
public enum ReferenceKind {
    PROPERTY(EntityType.PROPERTY, "Property", "properties"),
    DESTINATION(EntityType.DESTINATION, "Destination", "destinations");

    private final EntityType entityType;
    private final String displayName;
    private final String pluralName;

    ReferenceKind(EntityType entityType, String displayName, String pluralName) {
        this.entityType = entityType;
        this.displayName = displayName;
        this.pluralName = pluralName;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getPluralName() {
        return pluralName;
    }
}
