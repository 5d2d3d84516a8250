package com.nana.reconcile.widget;

import com.nana.reconcile.store.Accessor;
import com.nana.reconcile.store.ModelStore;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a cell to one related object through its key attribute.
 *
 * <p>The cell is first cleaned with the key attribute's own widget, then
 * looked up by exact match. No match gives {@code null}, or a
 * {@link ConversionException} when the relation is required. Rendering
 * writes the related object's key.
 *
 * @param <R> related model type
 */
public class ForeignKeyWidget<R> implements Widget<R> {

    private final ModelStore<R> store;
    private final String field;
    private final boolean required;
    private final Widget<Object> keyWidget;
    private final Accessor<R, Object> keyAccessor;

    /**
     * @param store     store holding the related objects
     * @param field     key attribute on the related model
     * @param required  whether an unmatched key is an error
     * @param keyWidget converter for the key attribute
     */
    @SuppressWarnings("unchecked")
    public ForeignKeyWidget(ModelStore<R> store, String field, boolean required, Widget<?> keyWidget) {
        this.store = store;
        this.field = field;
        this.required = required;
        this.keyWidget = (Widget<Object>) keyWidget;
        this.keyAccessor = store.getSchema().resolvePath(field);
    }

    public ModelStore<R> getStore() { return store; }

    public String getField() { return field; }

    public boolean isRequired() { return required; }

    @Override
    public R clean(String value) {
        Object key = keyWidget.clean(value);
        if (key == null || (key instanceof String && ((String) key).isBlank())) {
            return missing(value);
        }
        Map<String, Object> criteria = new HashMap<>();
        criteria.put(field, key);
        List<R> matches = store.findBy(criteria);
        if (matches.isEmpty()) {
            return missing(value);
        }
        if (matches.size() > 1) {
            throw new ConversionException(matches.size() + " "
                    + store.getSchema().getModelName() + " objects match " + field + "='" + value + "'.");
        }
        return matches.get(0);
    }

    @Override
    public String render(R value) {
        if (value == null) {
            return "";
        }
        return keyWidget.render(keyAccessor.get(value));
    }

    private R missing(String value) {
        if (required) {
            throw new ConversionException("No " + store.getSchema().getModelName()
                    + " with " + field + "='" + (value == null ? "" : value) + "'.");
        }
        return null;
    }
}
