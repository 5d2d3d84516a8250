package com.nana.reconcile.resource;

import com.nana.reconcile.dataset.Row;
import com.nana.reconcile.store.Accessor;
import com.nana.reconcile.widget.ConversionException;
import com.nana.reconcile.widget.ManyToManyWidget;
import com.nana.reconcile.widget.Widget;

import java.util.Objects;
import java.util.function.Function;

/**
 * Binds one dataset column to one model attribute through a {@link Widget}.
 *
 * <p>Fields are immutable. They are created with {@link #of(Accessor, Widget)}
 * or {@link #computed(Function, Widget)}, refined with the {@code with}-style
 * methods, and receive their name when registered in a {@link FieldSet}.
 * The column name and the attribute default to the field name.
 *
 * <p>A computed field has no attribute: it is exported but never imported.
 * A readonly field is exported and compared but never written.
 *
 * @param <T> model type
 * @param <V> native value type
 */
public final class Field<T, V> {

    private final String name;
    private final String columnName;
    private final String attribute;
    private final boolean computed;
    private final Accessor<T, V> accessor;
    private final Widget<V> widget;
    private final boolean readonly;

    private Field(String name, String columnName, String attribute, boolean computed,
                  Accessor<T, V> accessor, Widget<V> widget, boolean readonly) {
        this.name = name;
        this.columnName = columnName;
        this.attribute = attribute;
        this.computed = computed;
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.widget = Objects.requireNonNull(widget, "widget");
        this.readonly = readonly;
    }

    /** A field backed by a model attribute. */
    public static <T, V> Field<T, V> of(Accessor<T, V> accessor, Widget<V> widget) {
        return new Field<>(null, null, null, false, accessor, widget, false);
    }

    /** An export-only field whose value is derived from the object. */
    public static <T, V> Field<T, V> computed(Function<T, V> getter, Widget<V> widget) {
        return new Field<>(null, null, null, true, Accessor.readOnly(getter), widget, true);
    }

    public Field<T, V> column(String columnName) {
        return new Field<>(name, columnName, attribute, computed, accessor, widget, readonly);
    }

    /** Names the attribute, e.g. a dotted path such as {@code author.name}. */
    public Field<T, V> attribute(String attribute) {
        if (computed) {
            throw new IllegalStateException("A computed field has no attribute.");
        }
        return new Field<>(name, columnName, attribute, false, accessor, widget, readonly);
    }

    public Field<T, V> readonly() {
        return new Field<>(name, columnName, attribute, computed, accessor, widget, true);
    }

    /** Assigns the registry name, defaulting column and attribute to it. */
    Field<T, V> named(String fieldName) {
        String column = columnName == null ? fieldName : columnName;
        String attr = computed || attribute != null ? attribute : fieldName;
        return new Field<>(fieldName, column, attr, computed, accessor, widget, readonly);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getName()          { return name; }

    public String getColumnName()    { return columnName; }

    /** @return the attribute path, or {@code null} for a computed field */
    public String getAttribute()     { return attribute; }

    public Widget<V> getWidget()     { return widget; }

    public boolean isReadonly()      { return readonly; }

    public boolean isComputed()      { return computed; }

    /** @return {@code true} when the field holds a many-to-many member list */
    public boolean isRelationCollection() {
        return widget instanceof ManyToManyWidget;
    }

    // -----------------------------------------------------------------------
    // OPERATIONS
    // -----------------------------------------------------------------------

    /**
     * Converts this field's cell.
     *
     * @throws ConversionException if the row has no such column or the cell
     *         does not convert
     */
    public V clean(Row row) {
        if (!row.containsColumn(columnName)) {
            throw new ConversionException("Column '" + columnName + "' not found in dataset. "
                    + "Available columns are: " + row.getColumns());
        }
        try {
            return widget.clean(row.get(columnName));
        } catch (ConversionException ex) {
            throw new ConversionException("Column '" + columnName + "': " + ex.getMessage(), ex);
        }
    }

    public V getValue(T instance) {
        return accessor.get(instance);
    }

    /**
     * Writes the cleaned cell to the instance. Does nothing for readonly or
     * computed fields, or when the attribute cannot be written.
     */
    public void save(T instance, Row row) {
        if (readonly || !accessor.isWritable()) {
            return;
        }
        accessor.set(instance, clean(row));
    }

    /** Writes an already converted value; same restrictions as {@link #save}. */
    public void assign(T instance, V value) {
        if (readonly || !accessor.isWritable()) {
            return;
        }
        accessor.set(instance, value);
    }

    /** @return the rendered value, {@code ""} for {@code null} */
    public String export(T instance) {
        V value = getValue(instance);
        return value == null ? "" : widget.render(value);
    }

    @Override
    public String toString() {
        return "Field{" + name + " <- '" + columnName + "'"
               + (attribute == null ? "" : ", attribute=" + attribute)
               + (readonly ? ", readonly" : "") + "}";
    }
}
