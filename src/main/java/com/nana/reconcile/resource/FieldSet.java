package com.nana.reconcile.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Ordered field registry of a resource, plus its per-field hook table.
 *
 * <p>Typically built once into a {@code static final} constant of the
 * resource class:
 * <pre>
 * static final FieldSet&lt;Book&gt; FIELDS = FieldSet.&lt;Book&gt;builder()
 *         .field("id", Field.of(Accessor.of(Book::getId, Book::setId), new IntegerWidget()))
 *         .field("name", Field.of(Accessor.of(Book::getName, Book::setName), new CharWidget()))
 *         .exporter("name", book -&gt; book.getName().toUpperCase())
 *         .build();
 * </pre>
 *
 * @param <T> model type
 */
public final class FieldSet<T> {

    private final Map<String, Field<T, ?>> fields;
    private final Map<String, Function<T, String>> exporters;
    private final Map<String, FieldImporter<T>> importers;

    private FieldSet(Builder<T> builder) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.exporters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.exporters));
        this.importers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.importers));
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static <T> FieldSet<T> empty() {
        return new Builder<T>().build();
    }

    /** @return fields in declaration order */
    public List<Field<T, ?>> getFields() {
        return new ArrayList<>(fields.values());
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    /** @return the field, or {@code null} when not declared */
    public Field<T, ?> getField(String name) {
        return fields.get(name);
    }

    public Map<String, Function<T, String>> getExporters() { return exporters; }

    public Map<String, FieldImporter<T>> getImporters() { return importers; }

    /** @return a builder pre-filled with this set's fields and hooks */
    public Builder<T> toBuilder() {
        Builder<T> builder = new Builder<>();
        builder.fields.putAll(fields);
        builder.exporters.putAll(exporters);
        builder.importers.putAll(importers);
        return builder;
    }

    @Override
    public String toString() {
        return "FieldSet" + fields.keySet();
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder<T> {

        private final Map<String, Field<T, ?>> fields = new LinkedHashMap<>();
        private final Map<String, Function<T, String>> exporters = new LinkedHashMap<>();
        private final Map<String, FieldImporter<T>> importers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the name is already taken
         */
        public Builder<T> field(String name, Field<T, ?> field) {
            if (fields.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate field '" + name + "'.");
            }
            fields.put(name, field.named(name));
            return this;
        }

        /** Overrides how the named field is exported. */
        public Builder<T> exporter(String name, Function<T, String> exporter) {
            exporters.put(name, exporter);
            return this;
        }

        /** Overrides how the named field is imported. */
        public Builder<T> importer(String name, FieldImporter<T> importer) {
            importers.put(name, importer);
            return this;
        }

        public FieldSet<T> build() {
            return new FieldSet<>(this);
        }
    }
}
