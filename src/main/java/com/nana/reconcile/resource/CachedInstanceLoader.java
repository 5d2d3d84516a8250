package com.nana.reconcile.resource;

import com.nana.reconcile.dataset.Dataset;
import com.nana.reconcile.dataset.Row;
import com.nana.reconcile.store.ModelStore;
import com.nana.reconcile.widget.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pre-loads every object the dataset refers to with a single query, then
 * answers rows from memory.
 *
 * <p>Requires exactly one import id field. Rows whose key does not convert
 * are left out of the pre-load and fail when they are processed.
 *
 * <p>Each pre-loaded object is handed out at most once. A key repeated
 * later in the dataset is looked up in the store again, so a row always
 * starts from the stored state and never from an object an earlier row
 * has modified.
 */
public class CachedInstanceLoader<T> implements InstanceLoader<T> {

    private static final Logger log = LoggerFactory.getLogger(CachedInstanceLoader.class);

    private final Field<T, ?> idField;
    private final Map<Object, T> cache = new HashMap<>();
    private final Set<Object> served = new HashSet<>();
    private final ModelInstanceLoader<T> reloader;

    /**
     * @throws IllegalArgumentException unless exactly one id field is given
     */
    public CachedInstanceLoader(ModelStore<T> store, List<Field<T, ?>> idFields, Dataset dataset) {
        if (idFields.size() != 1) {
            throw new IllegalArgumentException(
                    "Cached instance loading needs exactly one import id field, got " + idFields.size() + ".");
        }
        this.idField = idFields.get(0);
        this.reloader = new ModelInstanceLoader<>(store, idFields);

        Set<Object> keys = new LinkedHashSet<>();
        if (dataset.getHeaders().contains(idField.getColumnName())) {
            for (Row row : dataset) {
                try {
                    Object key = idField.clean(row);
                    if (key != null) {
                        keys.add(key);
                    }
                } catch (ConversionException ex) {
                    log.debug("Row {} key not pre-loaded: {}", row.getNumber(), ex.getMessage());
                }
            }
        }
        if (!keys.isEmpty()) {
            for (T instance : store.findAllIn(idField.getAttribute(), keys)) {
                cache.put(idField.getValue(instance), instance);
            }
        }
        log.debug("Pre-loaded {} of {} referenced objects.", cache.size(), keys.size());
    }

    @Override
    public Optional<T> getInstance(Row row) {
        if (!row.containsColumn(idField.getColumnName())) {
            throw new ResolutionException("Identification column '" + idField.getColumnName()
                    + "' not found in dataset. Available columns are: " + row.getColumns());
        }
        Object key = idField.clean(row);
        if (key == null) {
            return Optional.empty();
        }
        if (!served.add(key)) {
            log.debug("Row {} repeats key {}; reloading.", row.getNumber(), key);
            return reloader.getInstance(row);
        }
        return Optional.ofNullable(cache.remove(key));
    }
}
