package com.nana.reconcile.resource;

import com.nana.reconcile.dataset.Row;

/**
 * Replaces the default import of one field. Registered by field name with
 * {@link FieldSet.Builder#importer(String, FieldImporter)}.
 *
 * @param <T> model type
 */
@FunctionalInterface
public interface FieldImporter<T> {

    /**
     * Called only when the row carries the field's column.
     */
    void importField(Field<T, ?> field, T instance, Row row);
}
