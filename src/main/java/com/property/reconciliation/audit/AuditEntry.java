package com.property.reconciliation.audit;

import com.property.reconciliation.core.model.EntityType;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one mutation of a canonical entity.
 *
 * @param before  field snapshot before the change, null on create
 * @param after   field snapshot after the change, null on delete
 * @param summary one-line human readable description
 */
public record AuditEntry(
        String id,
        AuditAction action,
        EntityType entityType,
        String entityId,
        String actorId,
        Map<String, Object> before,
        Map<String, Object> after,
        String summary,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        before = before != null ? Map.copyOf(before) : null;
        after = after != null ? Map.copyOf(after) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private EntityType entityType;
        private String entityId;
        private String actorId;
        private Map<String, Object> before;
        private Map<String, Object> after;
        private String summary;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder before(Map<String, Object> before) {
            this.before = before;
            return this;
        }

        public Builder after(Map<String, Object> after) {
            this.after = after;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, entityType, entityId, actorId, before, after, summary, timestamp);
        }
    }
}
