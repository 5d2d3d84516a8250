package com.nana.reconcile.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-resource configuration, read once when the resource is built.
 *
 * <p>DEFAULTS:
 * <ul>
 *   <li>fields: every model attribute ({@code null} whitelist)</li>
 *   <li>exclude: nothing</li>
 *   <li>importIdFields: {@code ["id"]}</li>
 *   <li>useTransactions: {@link TransactionMode#INHERIT}</li>
 *   <li>skipUnchanged: {@code false}</li>
 *   <li>reportSkipped: {@code true}</li>
 *   <li>columnOrder: declaration order</li>
 *   <li>instanceLoader: {@link InstanceLoaderType#MODEL}</li>
 * </ul>
 */
public final class ResourceOptions {

    private final List<String> fields;
    private final Set<String> exclude;
    private final List<String> importIdFields;
    private final Map<String, Map<String, Object>> widgets;
    private final TransactionMode useTransactions;
    private final boolean skipUnchanged;
    private final boolean reportSkipped;
    private final List<String> columnOrder;
    private final InstanceLoaderType instanceLoader;

    private ResourceOptions(Builder b) {
        this.fields          = b.fields == null ? null : Collections.unmodifiableList(new ArrayList<>(b.fields));
        this.exclude         = Collections.unmodifiableSet(new LinkedHashSet<>(b.exclude));
        this.importIdFields  = Collections.unmodifiableList(new ArrayList<>(b.importIdFields));
        Map<String, Map<String, Object>> w = new LinkedHashMap<>();
        b.widgets.forEach((k, v) -> w.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
        this.widgets         = Collections.unmodifiableMap(w);
        this.useTransactions = b.useTransactions;
        this.skipUnchanged   = b.skipUnchanged;
        this.reportSkipped   = b.reportSkipped;
        this.columnOrder     = Collections.unmodifiableList(new ArrayList<>(b.columnOrder));
        this.instanceLoader  = b.instanceLoader;
    }

    public static ResourceOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the attribute whitelist, or {@code null} for all attributes */
    public List<String> getFields()              { return fields; }

    public Set<String> getExclude()              { return exclude; }

    public List<String> getImportIdFields()      { return importIdFields; }

    /** @return widget arguments by field name */
    public Map<String, Map<String, Object>> getWidgets() { return widgets; }

    public Map<String, Object> getWidgetArgs(String field) {
        return widgets.getOrDefault(field, Map.of());
    }

    public TransactionMode getUseTransactions()  { return useTransactions; }

    public boolean isSkipUnchanged()             { return skipUnchanged; }

    public boolean isReportSkipped()             { return reportSkipped; }

    public List<String> getColumnOrder()         { return columnOrder; }

    public InstanceLoaderType getInstanceLoader() { return instanceLoader; }

    @Override
    public String toString() {
        return "ResourceOptions{fields=" + fields
               + ", exclude=" + exclude
               + ", importIdFields=" + importIdFields
               + ", useTransactions=" + useTransactions
               + ", skipUnchanged=" + skipUnchanged
               + ", reportSkipped=" + reportSkipped
               + ", instanceLoader=" + instanceLoader + "}";
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder {

        private List<String> fields;
        private final Set<String> exclude = new LinkedHashSet<>();
        private List<String> importIdFields = List.of("id");
        private final Map<String, Map<String, Object>> widgets = new LinkedHashMap<>();
        private TransactionMode useTransactions = TransactionMode.INHERIT;
        private boolean skipUnchanged = false;
        private boolean reportSkipped = true;
        private List<String> columnOrder = List.of();
        private InstanceLoaderType instanceLoader = InstanceLoaderType.MODEL;

        private Builder() {
        }

        public Builder fields(String... names) {
            this.fields = List.of(names);
            return this;
        }

        public Builder exclude(String... names) {
            this.exclude.addAll(List.of(names));
            return this;
        }

        /**
         * @throws IllegalArgumentException if no name is given
         */
        public Builder importIdFields(String... names) {
            if (names.length == 0) {
                throw new IllegalArgumentException("At least one import id field is required.");
            }
            this.importIdFields = List.of(names);
            return this;
        }

        public Builder widget(String field, Map<String, Object> args) {
            this.widgets.put(field, args);
            return this;
        }

        public Builder useTransactions(TransactionMode mode) {
            this.useTransactions = mode;
            return this;
        }

        public Builder skipUnchanged(boolean skipUnchanged) {
            this.skipUnchanged = skipUnchanged;
            return this;
        }

        public Builder reportSkipped(boolean reportSkipped) {
            this.reportSkipped = reportSkipped;
            return this;
        }

        public Builder columnOrder(String... names) {
            this.columnOrder = List.of(names);
            return this;
        }

        public Builder instanceLoader(InstanceLoaderType type) {
            this.instanceLoader = type;
            return this;
        }

        public ResourceOptions build() {
            return new ResourceOptions(this);
        }
    }
}
