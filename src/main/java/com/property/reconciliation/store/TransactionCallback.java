package com.property.reconciliation.store;

/**
 * Work executed inside one store transaction.
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(StoreTransaction tx);
}
