package com.nana.reconcile.store;

/**
 * Hands out {@link Transaction} handles for a store.
 */
public interface TransactionManager {

    /**
     * Starts a transaction.
     *
     * @return an active managed handle
     * @throws ModelStore.PersistenceException if one is already open or the
     *         backend refuses
     */
    Transaction begin();

    /** @return an unmanaged handle for auto-commit work */
    Transaction autoCommit();
}
