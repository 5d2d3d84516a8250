package com.nana.reconcile.store;

import com.nana.reconcile.util.ReconcileConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single JDBC connection that the bundled stores share.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Open the connection for a JDBC URL (SQLite by default).</li>
 *   <li>Apply the per-connection PRAGMAs SQLite does not persist.</li>
 *   <li>Run caller-supplied DDL.</li>
 *   <li>Close the connection on {@link #close()}.</li>
 * </ul>
 *
 * <p>One connection means one open transaction at a time, which matches the
 * engine's single transaction per import batch.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    /** Write-ahead logging; only meaningful for file databases. */
    private static final String PRAGMA_WAL = "PRAGMA journal_mode=WAL;";

    /** SQLite ships with foreign keys off. */
    private static final String PRAGMA_FK = "PRAGMA foreign_keys=ON;";

    private static final String PRAGMA_BUSY = "PRAGMA busy_timeout=5000;";

    private final String url;
    private final Connection connection;

    /**
     * Opens and configures a connection.
     *
     * @param url JDBC URL, e.g. {@code jdbc:sqlite::memory:}
     * @throws DatabaseException if the connection cannot be opened
     */
    public Database(String url) {
        this.url = url;
        try {
            this.connection = DriverManager.getConnection(url);
            DatabaseMetaData meta = connection.getMetaData();
            log.info("Connected to {} {} via driver {}",
                    meta.getDatabaseProductName(),
                    meta.getDatabaseProductVersion(),
                    meta.getDriverVersion());
            if (url.startsWith("jdbc:sqlite:")) {
                configurePragmas();
            }
        } catch (SQLException ex) {
            throw new DatabaseException("Failed to open database at: " + url, ex);
        }
    }

    /**
     * @param config source of {@code reconcile.datasource.url}
     * @return a database for the configured URL
     */
    public static Database fromConfig(ReconcileConfig config) {
        return new Database(config.getDatasourceUrl());
    }

    public String getUrl() { return url; }

    /**
     * @return the open connection
     * @throws IllegalStateException if the database was closed
     */
    public Connection getConnection() {
        try {
            if (connection.isClosed()) {
                throw new IllegalStateException("Database connection is closed: " + url);
            }
        } catch (SQLException ex) {
            throw new DatabaseException("Failed to check connection state.", ex);
        }
        return connection;
    }

    /**
     * Runs DDL statements in order.
     *
     * @param statements SQL without user input
     * @throws DatabaseException if any statement fails
     */
    public void execute(String... statements) {
        try (Statement st = getConnection().createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
            log.debug("Executed {} DDL statement(s).", statements.length);
        } catch (SQLException ex) {
            throw new DatabaseException("DDL failed.", ex);
        }
    }

    /**
     * Closes the connection. Failures are logged, not thrown.
     */
    @Override
    public void close() {
        try {
            if (!connection.isClosed()) {
                connection.close();
                log.info("Database connection closed: {}", url);
            }
        } catch (SQLException ex) {
            log.error("Error closing database connection.", ex);
        }
    }

    private void configurePragmas() throws SQLException {
        try (Statement st = connection.createStatement()) {
            if (!url.contains(":memory:")) {
                st.execute(PRAGMA_WAL);
            }
            st.execute(PRAGMA_FK);
            st.execute(PRAGMA_BUSY);
            log.debug("SQLite PRAGMAs configured.");
        }
    }

    // -----------------------------------------------------------------------
    // EXCEPTION
    // -----------------------------------------------------------------------

    /**
     * Thrown when the connection cannot be opened or DDL fails.
     */
    public static final class DatabaseException extends ModelStore.PersistenceException {

        public DatabaseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
