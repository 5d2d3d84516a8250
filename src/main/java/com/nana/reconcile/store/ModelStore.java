package com.nana.reconcile.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Persistence collaborator for one model type.
 *
 * <p>The reconciliation engine only needs exact-match lookup, save, delete,
 * relation writes and a lazy full scan. Write operations receive the
 * {@link Transaction} handle of the running import so a store can refuse
 * work on a handle that already ended.
 *
 * <p>ERROR CONTRACT: every backend failure surfaces as the unchecked
 * {@link PersistenceException}.
 *
 * @param <T> the model type
 */
public interface ModelStore<T> {

    ModelSchema<T> getSchema();

    /** @return a fresh, unsaved instance */
    T newInstance();

    /**
     * Exact-match lookup. A {@code null} criterion value matches only
     * missing values.
     *
     * @param criteria attribute name to required value; empty matches everything
     * @return matching instances, never {@code null}
     */
    List<T> findBy(Map<String, Object> criteria);

    /**
     * @param attribute attribute to match
     * @param values    accepted values; an empty collection matches nothing
     * @return instances whose attribute is one of {@code values}
     */
    List<T> findAllIn(String attribute, Collection<?> values);

    /**
     * Scans every instance lazily. The caller must close the stream.
     *
     * @return a stream reading one instance at a time
     */
    Stream<T> streamAll();

    /** Inserts or updates the instance; a new instance receives its id. */
    void save(T instance, Transaction tx);

    void delete(T instance, Transaction tx);

    /**
     * Persists the member set of a many-to-many attribute as currently held
     * by the instance. The instance must already have an id.
     */
    void saveRelation(T instance, String attribute, Transaction tx);

    /**
     * @return the current members of a many-to-many attribute; never {@code null}
     */
    @SuppressWarnings("unchecked")
    default Collection<?> getRelationMembers(T instance, String attribute) {
        Attribute<T, ?> attr = getSchema().getAttribute(attribute);
        if (attr.getKind() != AttributeKind.MANY_TO_MANY) {
            throw new IllegalArgumentException("'" + attribute + "' is not a many-to-many attribute.");
        }
        Object value = ((Accessor<T, Object>) attr.getAccessor()).get(instance);
        return value == null ? List.of() : (Collection<?>) value;
    }

    /** @return the identity of the instance, or {@code null} when unsaved */
    Object getId(T instance);

    TransactionManager getTransactionManager();

    // -----------------------------------------------------------------------
    // EXCEPTION
    // -----------------------------------------------------------------------

    /**
     * Unchecked wrapper for backend failures such as constraint violations.
     */
    class PersistenceException extends RuntimeException {

        public PersistenceException(String message) {
            super(message);
        }

        public PersistenceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
