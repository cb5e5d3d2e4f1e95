package com.property.reconciliation.core.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Association between a contact and a property. Removed by the store when
 * either side is deleted.
 */
public record ContactPropertyLink(
        String id,
        String contactId,
        String propertyId,
        ContactPropertyRelationship relationship
) implements CanonicalEntity {

    public ContactPropertyLink {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(contactId, "contactId is required");
        Objects.requireNonNull(propertyId, "propertyId is required");
        relationship = relationship != null ? relationship : ContactPropertyRelationship.OTHER;
    }

    @Override
    public EntityType entityType() {
        return EntityType.CONTACT_PROPERTY_LINK;
    }

    @Override
    public Map<EntityType, String> references() {
        Map<EntityType, String> refs = new HashMap<>();
        refs.put(EntityType.CONTACT, contactId);
        refs.put(EntityType.PROPERTY, propertyId);
        return refs;
    }

    @Override
    public String displayName() {
        return relationship.name();
    }
}
