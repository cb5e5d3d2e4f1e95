package com.property.reconciliation.store;

import com.property.reconciliation.audit.AuditEntry;
import com.property.reconciliation.core.model.CanonicalEntity;
import com.property.reconciliation.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * Read/write handle on an open transaction. Implementations must tolerate
 * concurrent calls from the workers of one import chunk.
 */
public interface StoreTransaction {

    Optional<CanonicalEntity> findById(EntityType type, String id);

    <E extends CanonicalEntity> List<E> findAll(EntityType type, Class<E> javaType);

    /**
     * @throws ConstraintViolationException on a duplicate id, a duplicate unique key or a dangling foreign key
     */
    void insert(CanonicalEntity entity);

    /**
     * @throws ConstraintViolationException if the record does not exist or a constraint breaks
     */
    void update(CanonicalEntity entity);

    /**
     * Deletes a record and, through the foreign keys, every record that depends on it.
     *
     * @return the removed records, the requested one first; empty if it did not exist
     */
    List<CanonicalEntity> delete(EntityType type, String id);

    /**
     * Buffers an audit entry; it reaches the audit sink only if the transaction commits.
     */
    void appendAudit(AuditEntry entry);
}
