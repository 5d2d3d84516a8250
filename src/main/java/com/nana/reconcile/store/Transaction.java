package com.nana.reconcile.store;

/**
 * Handle on the unit of work an import runs in.
 *
 * <p>A managed handle wraps a real transaction: {@link #commit()} and
 * {@link #rollback()} end it, and {@link #close()} rolls back when it is
 * still active. An unmanaged handle stands for auto-commit mode; every
 * store call is durable immediately and commit/rollback do nothing.
 */
public interface Transaction extends AutoCloseable {

    /** @return {@code true} when this handle controls a real transaction */
    boolean isManaged();

    /** @return {@code true} until the transaction is committed or rolled back */
    boolean isActive();

    void commit();

    void rollback();

    /** Rolls back an active managed transaction; otherwise does nothing. */
    @Override
    void close();
}
