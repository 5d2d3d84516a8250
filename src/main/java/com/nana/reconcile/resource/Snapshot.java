package com.nana.reconcile.resource;

import com.nana.reconcile.store.ModelStore;
import com.nana.reconcile.widget.ForeignKeyWidget;
import com.nana.reconcile.widget.ManyToManyWidget;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field-by-field copy of an object taken before a row mutates it.
 *
 * <p>Holds two views per field: the exported text, used for diffs, and a
 * comparison value, used to detect unchanged rows. Comparison values are
 * normalized so that equal data compares equal across loads: related
 * objects become their ids, member collections become id sets, and
 * decimals drop trailing zeros.
 */
public final class Snapshot {

    private final Map<String, String> exports;
    private final Map<String, Object> values;

    Snapshot(Map<String, String> exports, Map<String, Object> values) {
        this.exports = Collections.unmodifiableMap(new LinkedHashMap<>(exports));
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** A snapshot in which every field exports as {@code ""}. */
    static Snapshot empty(List<? extends Field<?, ?>> fields) {
        Map<String, String> exports = new LinkedHashMap<>();
        for (Field<?, ?> field : fields) {
            exports.put(field.getName(), "");
        }
        return new Snapshot(exports, Map.of());
    }

    /** @return the exported text, {@code ""} for unknown fields */
    public String getExport(String field) {
        return exports.getOrDefault(field, "");
    }

    /** @return the normalized comparison value, or {@code null} */
    public Object getValue(String field) {
        return values.get(field);
    }

    public Map<String, String> getExports() {
        return exports;
    }

    @Override
    public String toString() {
        return "Snapshot" + exports;
    }

    // -----------------------------------------------------------------------
    // NORMALIZATION
    // -----------------------------------------------------------------------

    /**
     * Converts a field value into its comparison form.
     */
    static Object normalize(Field<?, ?> field, Object value) {
        if (value == null) {
            return field.isRelationCollection() ? Set.of() : null;
        }
        if (field.getWidget() instanceof ForeignKeyWidget) {
            return idOf(((ForeignKeyWidget<?>) field.getWidget()).getStore(), value);
        }
        if (field.isRelationCollection()) {
            ModelStore<?> store = ((ManyToManyWidget<?>) field.getWidget()).getStore();
            Set<Object> ids = new HashSet<>();
            for (Object member : (Collection<?>) value) {
                ids.add(idOf(store, member));
            }
            return ids;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros();
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static <R> Object idOf(ModelStore<R> store, Object related) {
        return store.getId((R) related);
    }
}
