package com.property.reconciliation.store;

import com.property.reconciliation.audit.AuditEntry;
import com.property.reconciliation.audit.AuditSink;
import com.property.reconciliation.core.model.CanonicalEntity;
import com.property.reconciliation.core.model.Contact;
import com.property.reconciliation.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory row store with the semantics the reconciliation core relies on:
 * atomic transactions, a unique key on contact email, foreign keys between
 * records and cascading deletes of dependents.
 *
 * <p>A transaction works on a private copy of the committed tables taken when
 * it begins. Only one transaction runs at a time; a second caller waits for the
 * first to finish. Commit swaps the copy in and flushes the buffered audit
 * entries to the {@link AuditSink}.</p>
 */
public class InMemoryEntityStore implements TransactionalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final AuditSink auditSink;
    private final ReentrantLock writerLock = new ReentrantLock(true);
    private volatile Map<EntityType, Map<String, CanonicalEntity>> committed;

    public InMemoryEntityStore(AuditSink auditSink) {
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink is required");
        this.committed = emptyTables();
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        Objects.requireNonNull(callback, "callback is required");
        if (writerLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Nested transactions are not supported");
        }
        writerLock.lock();
        try {
            Transaction tx = new Transaction(copyOf(committed));
            T result;
            try {
                result = callback.doInTransaction(tx);
            } catch (StoreException e) {
                log.warn("store.rollback reason={}", e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.warn("store.rollback reason={}", e.getMessage());
                throw new StoreException("Transaction rolled back: " + e.getMessage(), e);
            } finally {
                tx.close();
            }
            List<AuditEntry> audit = tx.auditBuffer();
            if (!audit.isEmpty()) {
                try {
                    auditSink.append(audit);
                } catch (RuntimeException e) {
                    log.error("store.audit_flush_failed entries={} error={}", audit.size(), e.getMessage());
                    throw new StoreException("Audit sink rejected the transaction's entries", e);
                }
            }
            committed = tx.tables;
            log.debug("store.commit writes={} auditEntries={}", tx.writes, audit.size());
            return result;
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Reads committed data outside any transaction. Intended for callers that
     * only need a consistent snapshot, such as tests and read-only views.
     */
    public <E extends CanonicalEntity> List<E> committed(EntityType type, Class<E> javaType) {
        List<E> result = new ArrayList<>();
        for (CanonicalEntity entity : committed.get(type).values()) {
            result.add(javaType.cast(entity));
        }
        return result;
    }

    public Optional<CanonicalEntity> committedById(EntityType type, String id) {
        return Optional.ofNullable(committed.get(type).get(id));
    }

    public int count(EntityType type) {
        return committed.get(type).size();
    }

    private static Map<EntityType, Map<String, CanonicalEntity>> emptyTables() {
        Map<EntityType, Map<String, CanonicalEntity>> tables = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            tables.put(type, new LinkedHashMap<>());
        }
        return tables;
    }

    private static Map<EntityType, Map<String, CanonicalEntity>> copyOf(
            Map<EntityType, Map<String, CanonicalEntity>> source) {
        Map<EntityType, Map<String, CanonicalEntity>> copy = new EnumMap<>(EntityType.class);
        source.forEach((type, rows) -> copy.put(type, new LinkedHashMap<>(rows)));
        return copy;
    }

    private static String emailKey(String email) {
        return email == null || email.isBlank() ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Transaction implements StoreTransaction {
        private final Map<EntityType, Map<String, CanonicalEntity>> tables;
        private final List<AuditEntry> audit = new ArrayList<>();
        private int writes;
        private boolean open = true;

        private Transaction(Map<EntityType, Map<String, CanonicalEntity>> tables) {
            this.tables = tables;
        }

        @Override
        public synchronized Optional<CanonicalEntity> findById(EntityType type, String id) {
            checkOpen();
            return Optional.ofNullable(tables.get(type).get(id));
        }

        @Override
        public synchronized <E extends CanonicalEntity> List<E> findAll(EntityType type, Class<E> javaType) {
            checkOpen();
            List<E> result = new ArrayList<>();
            for (CanonicalEntity entity : tables.get(type).values()) {
                result.add(javaType.cast(entity));
            }
            return result;
        }

        @Override
        public synchronized void insert(CanonicalEntity entity) {
            checkOpen();
            Map<String, CanonicalEntity> table = tables.get(entity.entityType());
            if (table.containsKey(entity.id())) {
                throw new ConstraintViolationException("primary_key",
                        "A " + entity.entityType().getLabel() + " with id " + entity.id() + " already exists");
            }
            checkReferences(entity);
            checkUniqueEmail(entity);
            table.put(entity.id(), entity);
            writes++;
        }

        @Override
        public synchronized void update(CanonicalEntity entity) {
            checkOpen();
            Map<String, CanonicalEntity> table = tables.get(entity.entityType());
            if (!table.containsKey(entity.id())) {
                throw new ConstraintViolationException("primary_key",
                        "No " + entity.entityType().getLabel() + " with id " + entity.id());
            }
            checkReferences(entity);
            checkUniqueEmail(entity);
            table.put(entity.id(), entity);
            writes++;
        }

        @Override
        public synchronized List<CanonicalEntity> delete(EntityType type, String id) {
            checkOpen();
            CanonicalEntity target = tables.get(type).get(id);
            if (target == null) {
                return List.of();
            }
            List<CanonicalEntity> removed = new ArrayList<>();
            cascade(target, removed);
            writes += removed.size();
            return Collections.unmodifiableList(removed);
        }

        @Override
        public synchronized void appendAudit(AuditEntry entry) {
            checkOpen();
            audit.add(Objects.requireNonNull(entry, "entry is required"));
        }

        private void cascade(CanonicalEntity target, List<CanonicalEntity> removed) {
            tables.get(target.entityType()).remove(target.id());
            removed.add(target);
            for (Map<String, CanonicalEntity> table : tables.values()) {
                List<CanonicalEntity> dependents = new ArrayList<>();
                for (CanonicalEntity candidate : table.values()) {
                    if (target.id().equals(candidate.references().get(target.entityType()))) {
                        dependents.add(candidate);
                    }
                }
                for (CanonicalEntity dependent : dependents) {
                    if (tables.get(dependent.entityType()).containsKey(dependent.id())) {
                        cascade(dependent, removed);
                    }
                }
            }
        }

        private void checkReferences(CanonicalEntity entity) {
            for (Map.Entry<EntityType, String> ref : entity.references().entrySet()) {
                if (ref.getValue() != null && !tables.get(ref.getKey()).containsKey(ref.getValue())) {
                    throw new ConstraintViolationException("foreign_key",
                            "Referenced " + ref.getKey().getLabel() + " " + ref.getValue() + " does not exist");
                }
            }
        }

        private void checkUniqueEmail(CanonicalEntity entity) {
            if (!(entity instanceof Contact contact)) {
                return;
            }
            String key = emailKey(contact.email());
            if (key == null) {
                return;
            }
            for (CanonicalEntity other : tables.get(EntityType.CONTACT).values()) {
                if (!other.id().equals(contact.id()) && key.equals(emailKey(((Contact) other).email()))) {
                    throw new ConstraintViolationException("contact_email_unique",
                            "A contact with email " + contact.email() + " already exists");
                }
            }
        }

        private void checkOpen() {
            if (!open) {
                throw new StoreException("Transaction is no longer open");
            }
        }

        private synchronized void close() {
            open = false;
        }

        private synchronized List<AuditEntry> auditBuffer() {
            return List.copyOf(audit);
        }
    }
}
