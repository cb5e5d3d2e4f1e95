package com.property.reconciliation.store;

/**
 * The storage engine seen from the reconciliation core: a row store that can
 * run a callback atomically.
 *
 * <p>If the callback returns, every write and every buffered audit entry
 * becomes visible at once. If it throws, nothing does and the failure is
 * rethrown: a {@link StoreException} unchanged, anything else wrapped in one.</p>
 */
public interface TransactionalStore {

    <T> T inTransaction(TransactionCallback<T> callback);
}
