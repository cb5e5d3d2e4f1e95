package com.property.reconciliation.chaos;

import com.property.reconciliation.audit.AuditEntry;
import com.property.reconciliation.core.model.CanonicalEntity;
import com.property.reconciliation.core.model.EntityType;
import com.property.reconciliation.store.StoreException;
import com.property.reconciliation.store.StoreTransaction;
import com.property.reconciliation.store.TransactionCallback;
import com.property.reconciliation.store.TransactionalStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link TransactionalStore} that injects infrastructure
 * failures into the transactions it hands out: failing reads, failing writes,
 * a write budget after which every write fails, and latency on writes.
 */
public class ChaosEntityStore implements TransactionalStore {

    private final TransactionalStore delegate;
    private final AtomicBoolean failOnRead = new AtomicBoolean(false);
    private final AtomicBoolean failOnWrite = new AtomicBoolean(false);
    private final AtomicInteger failAfterNWrites = new AtomicInteger(-1);
    private final AtomicInteger writeCount = new AtomicInteger(0);
    private volatile long injectDelayMs = 0;

    public ChaosEntityStore(TransactionalStore delegate) {
        this.delegate = delegate;
    }

    /**
     * When enabled, findById() and findAll() throw {@link StoreException}.
     */
    public void setFailOnRead(boolean fail) {
        failOnRead.set(fail);
    }

    /**
     * When enabled, every insert, update and delete throws {@link StoreException}.
     */
    public void setFailOnWrite(boolean fail) {
        failOnWrite.set(fail);
    }

    /**
     * Lets N writes through, then fails every following one. Set to -1 to disable.
     */
    public void setFailAfterNWrites(int n) {
        failAfterNWrites.set(n);
        writeCount.set(0);
    }

    /**
     * Delay in milliseconds before each write (0 to disable).
     */
    public void setInjectDelayMs(long delayMs) {
        this.injectDelayMs = delayMs;
    }

    public void reset() {
        failOnRead.set(false);
        failOnWrite.set(false);
        failAfterNWrites.set(-1);
        writeCount.set(0);
        injectDelayMs = 0;
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        return delegate.inTransaction(tx -> callback.doInTransaction(new ChaosTransaction(tx)));
    }

    private final class ChaosTransaction implements StoreTransaction {

        private final StoreTransaction tx;

        private ChaosTransaction(StoreTransaction tx) {
            this.tx = tx;
        }

        @Override
        public Optional<CanonicalEntity> findById(EntityType type, String id) {
            checkRead();
            return tx.findById(type, id);
        }

        @Override
        public <E extends CanonicalEntity> List<E> findAll(EntityType type, Class<E> javaType) {
            checkRead();
            return tx.findAll(type, javaType);
        }

        @Override
        public void insert(CanonicalEntity entity) {
            beforeWrite();
            tx.insert(entity);
        }

        @Override
        public void update(CanonicalEntity entity) {
            beforeWrite();
            tx.update(entity);
        }

        @Override
        public List<CanonicalEntity> delete(EntityType type, String id) {
            beforeWrite();
            return tx.delete(type, id);
        }

        @Override
        public void appendAudit(AuditEntry entry) {
            tx.appendAudit(entry);
        }
    }

    private void checkRead() {
        if (failOnRead.get()) {
            throw new StoreException("ChaosEntityStore: simulated read failure");
        }
    }

    private void beforeWrite() {
        if (injectDelayMs > 0) {
            try {
                Thread.sleep(injectDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreException("Interrupted during chaos delay", e);
            }
        }
        if (failOnWrite.get()) {
            throw new StoreException("ChaosEntityStore: simulated write failure");
        }
        int limit = failAfterNWrites.get();
        if (limit >= 0) {
            int count = writeCount.incrementAndGet();
            if (count > limit) {
                throw new StoreException("ChaosEntityStore: write limit exceeded (" + count + " > " + limit + ")");
            }
        }
    }
}
