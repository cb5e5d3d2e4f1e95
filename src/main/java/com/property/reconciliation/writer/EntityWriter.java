package com.property.reconciliation.writer;

import com.property.reconciliation.audit.AuditAction;
import com.property.reconciliation.audit.AuditEntry;
import com.property.reconciliation.audit.AuditSnapshots;
import com.property.reconciliation.core.model.CanonicalEntity;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The only component that mutates canonical entities. Every write goes to the
 * caller's transaction together with exactly one audit entry.
 *
 * <p>No business validation happens here: callers hand over records that are
 * already validated and resolved. Constraint failures raised by the store
 * propagate unchanged, and dependents of a deleted record are removed by the
 * store's foreign keys.</p>
 */
public class EntityWriter {
    private static final Logger log = LoggerFactory.getLogger(EntityWriter.class);

    private final AuditSnapshots snapshots;

    public EntityWriter() {
        this(new AuditSnapshots());
    }

    public EntityWriter(AuditSnapshots snapshots) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots is required");
    }

    public <E extends CanonicalEntity> E create(StoreTransaction tx, E entity, String actorId) {
        return create(tx, entity, actorId, AuditAction.ENTITY_CREATED,
                "Created " + entity.entityType().getLabel() + " \"" + entity.displayName() + "\"");
    }

    public <E extends CanonicalEntity> E create(StoreTransaction tx, E entity, String actorId,
                                                AuditAction action, String summary) {
        tx.insert(entity);
        tx.appendAudit(AuditEntry.builder()
                .action(action)
                .entityType(entity.entityType())
                .entityId(entity.id())
                .actorId(actorId)
                .after(snapshots.snapshot(entity))
                .summary(summary)
                .build());
        log.debug("entity.created type={} id={} action={}", entity.entityType().getLabel(), entity.id(), action);
        return entity;
    }

    public <E extends CanonicalEntity> E update(StoreTransaction tx, E entity, String actorId) {
        CanonicalEntity before = tx.findById(entity.entityType(), entity.id()).orElse(null);
        tx.update(entity);
        tx.appendAudit(AuditEntry.builder()
                .action(AuditAction.ENTITY_UPDATED)
                .entityType(entity.entityType())
                .entityId(entity.id())
                .actorId(actorId)
                .before(snapshots.snapshot(before))
                .after(snapshots.snapshot(entity))
                .summary("Updated " + entity.entityType().getLabel() + " \"" + entity.displayName() + "\"")
                .build());
        log.debug("entity.updated type={} id={}", entity.entityType().getLabel(), entity.id());
        return entity;
    }

    /**
     * @return the removed records, the requested one first; empty when nothing was deleted
     */
    public List<CanonicalEntity> delete(StoreTransaction tx, EntityType type, String id, String actorId) {
        List<CanonicalEntity> removed = tx.delete(type, id);
        if (removed.isEmpty()) {
            return removed;
        }
        CanonicalEntity target = removed.get(0);
        String summary = "Deleted " + type.getLabel() + " \"" + target.displayName() + "\"";
        if (removed.size() > 1) {
            summary += " and " + (removed.size() - 1) + " dependent record(s)";
        }
        tx.appendAudit(AuditEntry.builder()
                .action(AuditAction.ENTITY_DELETED)
                .entityType(type)
                .entityId(id)
                .actorId(actorId)
                .before(snapshots.snapshot(target))
                .summary(summary)
                .build());
        log.debug("entity.deleted type={} id={} cascaded={}", type.getLabel(), id, removed.size() - 1);
        return removed;
    }
}
