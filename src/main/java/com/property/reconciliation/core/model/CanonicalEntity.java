package com.property.reconciliation.core.model;

import java.util.Map;

/**
 * A durable, authoritative record owned by the row store.
 * Only the entity writer is allowed to persist or mutate these.
 */
public interface CanonicalEntity {

    String id();

    EntityType entityType();

    /**
     * Foreign keys held by this record, keyed by the referenced entity type.
     * Null values mean the reference is unset. The store uses these for
     * referential integrity and cascading deletes.
     */
    default Map<EntityType, String> references() {
        return Map.of();
    }

    /**
     * Short human-readable name used in audit summaries and log lines.
     */
    String displayName();
}
