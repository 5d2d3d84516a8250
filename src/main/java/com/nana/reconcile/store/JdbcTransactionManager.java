package com.nana.reconcile.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transactions over the shared {@link Database} connection.
 *
 * <p>{@link #begin()} switches auto-commit off; ending the transaction
 * either way switches it back on in a {@code finally} block so a failed
 * commit never leaves the connection in manual mode.
 */
public class JdbcTransactionManager implements TransactionManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionManager.class);

    private final Database database;
    private JdbcTransaction current;

    public JdbcTransactionManager(Database database) {
        this.database = database;
    }

    @Override
    public synchronized Transaction begin() {
        if (current != null && current.isActive()) {
            throw new ModelStore.PersistenceException("A transaction is already open on " + database.getUrl());
        }
        Connection conn = database.getConnection();
        try {
            conn.setAutoCommit(false);
        } catch (SQLException ex) {
            throw new ModelStore.PersistenceException("Failed to begin transaction.", ex);
        }
        current = new JdbcTransaction(conn);
        log.debug("Transaction started.");
        return current;
    }

    @Override
    public Transaction autoCommit() {
        return AutoCommitHandle.INSTANCE;
    }

    /** @return {@code true} while a transaction from {@link #begin()} is open */
    public synchronized boolean inTransaction() {
        return current != null && current.isActive();
    }

    // -----------------------------------------------------------------------
    // HANDLES
    // -----------------------------------------------------------------------

    static final class JdbcTransaction implements Transaction {

        private final Connection connection;
        private boolean active = true;

        JdbcTransaction(Connection connection) {
            this.connection = connection;
        }

        Connection connection() { return connection; }

        @Override
        public boolean isManaged() { return true; }

        @Override
        public boolean isActive() { return active; }

        @Override
        public void commit() {
            requireActive();
            try {
                connection.commit();
                log.debug("Transaction committed.");
            } catch (SQLException ex) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackEx) {
                    ex.addSuppressed(rollbackEx);
                }
                throw new ModelStore.PersistenceException("Commit failed; transaction rolled back.", ex);
            } finally {
                end();
            }
        }

        @Override
        public void rollback() {
            requireActive();
            try {
                connection.rollback();
                log.debug("Transaction rolled back.");
            } catch (SQLException ex) {
                throw new ModelStore.PersistenceException("Rollback failed.", ex);
            } finally {
                end();
            }
        }

        @Override
        public void close() {
            if (active) {
                log.debug("Transaction closed while active; rolling back.");
                rollback();
            }
        }

        private void requireActive() {
            if (!active) {
                throw new IllegalStateException("Transaction already ended.");
            }
        }

        private void end() {
            active = false;
            try {
                connection.setAutoCommit(true);
            } catch (SQLException ex) {
                log.error("Failed to restore auto-commit mode.", ex);
            }
        }
    }

    private static final class AutoCommitHandle implements Transaction {

        static final AutoCommitHandle INSTANCE = new AutoCommitHandle();

        @Override
        public boolean isManaged() { return false; }

        @Override
        public boolean isActive() { return true; }

        @Override
        public void commit() {
            // each statement already committed
        }

        @Override
        public void rollback() {
            // nothing to undo in auto-commit mode
        }

        @Override
        public void close() {
            // no resources held
        }
    }
}
