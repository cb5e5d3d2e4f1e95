package com.property.reconciliation.audit;

/**
 * Mutations recorded in the audit trail.
 */
public enum AuditAction {
    ENTITY_CREATED,
    ENTITY_AUTO_CREATED,
    ENTITY_UPDATED,
    ENTITY_DELETED
}
