package com.nana.reconcile.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * JDBC implementation of {@link ModelStore} for one table with an integer
 * primary key.
 *
 * <p>Subclasses supply the schema, a row mapper and a column binder. This
 * class builds every statement with {@code ?} placeholders; attribute names
 * are mapped to columns through {@link #columnFor(String)} and never come
 * from dataset input.
 *
 * <p>SAVE SEMANTICS:
 * <ul>
 *   <li>No id: INSERT and assign the generated key.</li>
 *   <li>Id present: UPDATE by id; when no row matched, INSERT with that id.</li>
 * </ul>
 *
 * <p>VALUE BINDING: dates and times are stored as ISO-8601 text,
 * {@link BigDecimal} as plain text, booleans as 1/0.
 *
 * @param <T> the model type
 */
public abstract class AbstractJdbcStore<T> implements ModelStore<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractJdbcStore.class);

    protected final Database database;
    private final String table;
    private final String idColumn;
    private final JdbcTransactionManager transactionManager;
    private ModelSchema<T> schema;

    /**
     * @param database           shared connection owner
     * @param table              table name
     * @param idColumn           integer primary key column
     * @param transactionManager manager shared by every store on {@code database}
     */
    protected AbstractJdbcStore(Database database, String table, String idColumn,
                                JdbcTransactionManager transactionManager) {
        this.database = database;
        this.table = table;
        this.idColumn = idColumn;
        this.transactionManager = transactionManager;
    }

    // -----------------------------------------------------------------------
    // SUBCLASS CONTRACT
    // -----------------------------------------------------------------------

    protected abstract ModelSchema<T> buildSchema();

    /** Maps the current result-set row to a new instance. */
    protected abstract T mapRow(ResultSet rs) throws SQLException;

    /**
     * @return column to value for every stored column except the id, in a
     *         stable order
     */
    protected abstract Map<String, Object> toColumns(T instance);

    protected abstract void assignId(T instance, int id);

    /** Column holding an attribute; defaults to the attribute name. */
    protected String columnFor(String attribute) {
        return attribute;
    }

    /**
     * Converts a lookup value for an attribute into a bindable value.
     * Foreign-key stores override this to turn a related object into its key.
     */
    protected Object criterionValue(String attribute, Object value) {
        return value;
    }

    // -----------------------------------------------------------------------
    // MODELSTORE
    // -----------------------------------------------------------------------

    @Override
    public synchronized ModelSchema<T> getSchema() {
        if (schema == null) {
            schema = buildSchema();
        }
        return schema;
    }

    @Override
    public TransactionManager getTransactionManager() {
        return transactionManager;
    }

    @Override
    public List<T> findBy(Map<String, Object> criteria) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table);
        List<Object> params = new ArrayList<>();
        String sep = " WHERE ";
        for (Map.Entry<String, Object> e : criteria.entrySet()) {
            Object value = toSqlValue(criterionValue(e.getKey(), e.getValue()));
            sql.append(sep).append(columnFor(e.getKey()));
            if (value == null) {
                sql.append(" IS NULL");
            } else {
                sql.append(" = ?");
                params.add(value);
            }
            sep = " AND ";
        }
        sql.append(" ORDER BY ").append(idColumn);
        log.debug("findBy {} on {}", criteria, table);
        return query(sql.toString(), params);
    }

    @Override
    public List<T> findAllIn(String attribute, Collection<?> values) {
        if (values.isEmpty()) {
            return new ArrayList<>();
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table)
                .append(" WHERE ").append(columnFor(attribute)).append(" IN (");
        for (Object v : values) {
            if (!params.isEmpty()) sql.append(", ");
            sql.append('?');
            params.add(toSqlValue(criterionValue(attribute, v)));
        }
        sql.append(") ORDER BY ").append(idColumn);
        return query(sql.toString(), params);
    }

    @Override
    public Stream<T> streamAll() {
        Connection conn = database.getConnection();
        PreparedStatement ps;
        ResultSet rs;
        try {
            ps = conn.prepareStatement("SELECT * FROM " + table + " ORDER BY " + idColumn);
            rs = ps.executeQuery();
        } catch (SQLException ex) {
            throw new PersistenceException("Failed to scan " + table + ".", ex);
        }
        Spliterator<T> spliterator = new Spliterators.AbstractSpliterator<T>(
                Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super T> action) {
                try {
                    if (!rs.next()) {
                        return false;
                    }
                    action.accept(mapRow(rs));
                    return true;
                } catch (SQLException ex) {
                    throw new PersistenceException("Failed to read " + table + ".", ex);
                }
            }
        };
        return StreamSupport.stream(spliterator, false).onClose(() -> {
            try {
                rs.close();
                ps.close();
            } catch (SQLException ex) {
                throw new PersistenceException("Failed to close scan of " + table + ".", ex);
            }
        });
    }

    @Override
    public void save(T instance, Transaction tx) {
        requireUsable(tx);
        Object id = getId(instance);
        Map<String, Object> columns = toColumns(instance);
        try {
            if (id == null) {
                insert(instance, columns);
            } else if (update(id, columns) == 0) {
                Map<String, Object> withId = new LinkedHashMap<>();
                withId.put(idColumn, id);
                withId.putAll(columns);
                insert(instance, withId);
            }
        } catch (SQLException ex) {
            throw new PersistenceException("Failed to save " + table + " " + instance + ".", ex);
        }
    }

    @Override
    public void delete(T instance, Transaction tx) {
        requireUsable(tx);
        Object id = getId(instance);
        if (id == null) {
            throw new PersistenceException("Cannot delete unsaved " + table + " " + instance + ".");
        }
        try (PreparedStatement ps = database.getConnection().prepareStatement(
                "DELETE FROM " + table + " WHERE " + idColumn + " = ?")) {
            ps.setObject(1, id);
            int affected = ps.executeUpdate();
            log.debug("Deleted {} row(s) from {} for id={}.", affected, table, id);
        } catch (SQLException ex) {
            throw new PersistenceException("Failed to delete " + table + " id=" + id + ".", ex);
        }
    }

    @Override
    public void saveRelation(T instance, String attribute, Transaction tx) {
        throw new PersistenceException("Table " + table + " has no many-to-many attribute '" + attribute + "'.");
    }

    // -----------------------------------------------------------------------
    // HELPERS FOR SUBCLASSES
    // -----------------------------------------------------------------------

    /**
     * Replaces the join rows of one owner.
     *
     * @param joinTable    join table name
     * @param ownerColumn  column referencing the owner
     * @param memberColumn column referencing the member
     * @param ownerId      owner id
     * @param memberIds    member ids to keep
     */
    protected void replaceJoinRows(String joinTable, String ownerColumn, String memberColumn,
                                   Object ownerId, Collection<?> memberIds) {
        if (ownerId == null) {
            throw new PersistenceException("Cannot write " + joinTable + " for an unsaved owner.");
        }
        Connection conn = database.getConnection();
        try (PreparedStatement del = conn.prepareStatement(
                "DELETE FROM " + joinTable + " WHERE " + ownerColumn + " = ?");
             PreparedStatement ins = conn.prepareStatement(
                "INSERT INTO " + joinTable + " (" + ownerColumn + ", " + memberColumn + ") VALUES (?, ?)")) {
            del.setObject(1, ownerId);
            del.executeUpdate();
            for (Object memberId : memberIds) {
                ins.setObject(1, ownerId);
                ins.setObject(2, memberId);
                ins.addBatch();
            }
            ins.executeBatch();
            log.debug("{}: owner {} now has {} member(s).", joinTable, ownerId, memberIds.size());
        } catch (SQLException ex) {
            throw new PersistenceException("Failed to write " + joinTable + " for owner " + ownerId + ".", ex);
        }
    }

    /**
     * @return member ids recorded for one owner, in insertion order
     */
    protected List<Integer> loadJoinIds(String joinTable, String ownerColumn, String memberColumn,
                                        Object ownerId) {
        List<Integer> ids = new ArrayList<>();
        try (PreparedStatement ps = database.getConnection().prepareStatement(
                "SELECT " + memberColumn + " FROM " + joinTable
                        + " WHERE " + ownerColumn + " = ? ORDER BY rowid")) {
            ps.setObject(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getInt(1));
                }
            }
        } catch (SQLException ex) {
            throw new PersistenceException("Failed to read " + joinTable + " for owner " + ownerId + ".", ex);
        }
        return ids;
    }

    /** @return the integer column value, or {@code null} for SQL NULL */
    protected static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    protected static Object toSqlValue(Object value) {
        if (value instanceof LocalDate || value instanceof LocalDateTime || value instanceof LocalTime) {
            return value.toString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof Enum<?>) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    // -----------------------------------------------------------------------
    // PRIVATE
    // -----------------------------------------------------------------------

    private List<T> query(String sql, List<Object> params) {
        List<T> results = new ArrayList<>();
        try (PreparedStatement ps = database.getConnection().prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new PersistenceException("Query failed on " + table + ".", ex);
        }
        return results;
    }

    private void insert(T instance, Map<String, Object> columns) throws SQLException {
        List<String> names = new ArrayList<>(columns.keySet());
        String sql = "INSERT INTO " + table + " (" + String.join(", ", names) + ") VALUES ("
                + String.join(", ", Collections.nCopies(names.size(), "?")) + ")";
        try (PreparedStatement ps = database.getConnection().prepareStatement(
                sql, Statement.RETURN_GENERATED_KEYS)) {
            bind(ps, new ArrayList<>(columns.values()));
            ps.executeUpdate();
            if (getId(instance) == null) {
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (keys.next()) {
                        assignId(instance, keys.getInt(1));
                    }
                }
            }
            log.debug("Inserted into {} with id={}.", table, getId(instance));
        }
    }

    private int update(Object id, Map<String, Object> columns) throws SQLException {
        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ");
        int i = 0;
        for (String column : columns.keySet()) {
            if (i++ > 0) sql.append(", ");
            sql.append(column).append(" = ?");
        }
        sql.append(" WHERE ").append(idColumn).append(" = ?");
        try (PreparedStatement ps = database.getConnection().prepareStatement(sql.toString())) {
            List<Object> values = new ArrayList<>(columns.values());
            values.add(id);
            bind(ps, values);
            return ps.executeUpdate();
        }
    }

    private static void bind(PreparedStatement ps, List<Object> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            ps.setObject(i + 1, toSqlValue(values.get(i)));
        }
    }

    protected static void requireUsable(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction handle is required.");
        }
        if (tx.isManaged() && !tx.isActive()) {
            throw new PersistenceException("Transaction has already ended.");
        }
    }
}
