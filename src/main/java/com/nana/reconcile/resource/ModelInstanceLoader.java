package com.nana.reconcile.resource;

import com.nana.reconcile.dataset.Row;
import com.nana.reconcile.store.ModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks each row up with one exact-match query on the import id fields.
 *
 * <p>A row whose key cells are all blank is new without a query.
 */
public class ModelInstanceLoader<T> implements InstanceLoader<T> {

    private static final Logger log = LoggerFactory.getLogger(ModelInstanceLoader.class);

    private final ModelStore<T> store;
    private final List<Field<T, ?>> idFields;

    public ModelInstanceLoader(ModelStore<T> store, List<Field<T, ?>> idFields) {
        this.store = store;
        this.idFields = List.copyOf(idFields);
    }

    @Override
    public Optional<T> getInstance(Row row) {
        Map<String, Object> criteria = new LinkedHashMap<>();
        boolean anyValue = false;
        for (Field<T, ?> field : idFields) {
            if (!row.containsColumn(field.getColumnName())) {
                throw new ResolutionException("Identification column '" + field.getColumnName()
                        + "' not found in dataset. Available columns are: " + row.getColumns());
            }
            Object key = field.clean(row);
            if (key != null) {
                anyValue = true;
            }
            criteria.put(field.getAttribute(), key);
        }
        if (!anyValue) {
            return Optional.empty();
        }

        List<T> matches = store.findBy(criteria);
        if (matches.size() > 1) {
            throw new ResolutionException(matches.size() + " objects match " + criteria
                    + "; identification fields must be unique.");
        }
        log.trace("Row {} resolved {} for {}", row.getNumber(), matches.isEmpty() ? "nothing" : "one", criteria);
        return matches.stream().findFirst();
    }
}
