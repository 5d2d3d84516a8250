package com.nana.reconcile.resource;

import com.nana.reconcile.dataset.Dataset;
import com.nana.reconcile.dataset.Row;
import com.nana.reconcile.diff.DiffEngine;
import com.nana.reconcile.diff.DiffMatchPatchEngine;
import com.nana.reconcile.result.ImportType;
import com.nana.reconcile.result.Result;
import com.nana.reconcile.result.RowResult;
import com.nana.reconcile.store.ModelStore;
import com.nana.reconcile.store.Transaction;
import com.nana.reconcile.store.TransactionManager;
import com.nana.reconcile.util.ReconcileConfig;
import com.nana.reconcile.util.ReconcileLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Reconciles dataset rows against the objects of one {@link ModelStore}
 * and exports those objects back to datasets.
 *
 * <p>ROW LIFECYCLE ({@link #importRow}):
 * <ol>
 *   <li>Resolve the existing object, or create a fresh one.</li>
 *   <li>Snapshot it.</li>
 *   <li>If {@link #forDelete} says so, delete it (or skip when it is new).</li>
 *   <li>Otherwise apply every non-collection field whose column is present.</li>
 *   <li>If {@link #skipRow} says nothing changed, stop with SKIP.</li>
 *   <li>Save (unless dry run), then write many-to-many members.</li>
 *   <li>Diff every field against the snapshot.</li>
 * </ol>
 * Any {@link RuntimeException} in these steps turns the row into an ERROR
 * row; the batch continues unless errors are raised eagerly.
 *
 * <p>TRANSACTIONS ({@link #importData(Dataset, boolean, boolean, TransactionMode)}):
 * when a batch runs in a transaction, rows are always applied for real and
 * the transaction is rolled back at the end for a dry run or when anything
 * failed. Without a transaction a dry run never calls save or delete.
 *
 * <p>Subclasses customise behaviour by overriding the protected hooks.
 * Instances are not safe for concurrent batches.
 *
 * @param <T> model type
 */
public class Resource<T> {

    private static final Logger log = LoggerFactory.getLogger(Resource.class);

    protected final ModelStore<T> store;
    protected final ResourceOptions options;
    private final ReconcileConfig config;
    private final DiffEngine diffEngine;
    private final List<Field<T, ?>> fields;
    private final Map<String, Field<T, ?>> fieldsByName;
    private final List<Field<T, ?>> importIdFields;
    private final Map<String, Function<T, String>> exporters;
    private final Map<String, FieldImporter<T>> importers;

    public Resource(ModelStore<T> store, ResourceOptions options, FieldSet<T> fieldSet) {
        this(store, options, fieldSet, ReconcileConfig.getInstance(), new DiffMatchPatchEngine());
    }

    /**
     * @throws IllegalArgumentException if an import id field, a column order
     *         entry or a hook names an undeclared field
     */
    public Resource(ModelStore<T> store, ResourceOptions options, FieldSet<T> fieldSet,
                    ReconcileConfig config, DiffEngine diffEngine) {
        this.store = Objects.requireNonNull(store, "store");
        this.options = Objects.requireNonNull(options, "options");
        this.config = Objects.requireNonNull(config, "config");
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");

        this.fields = Collections.unmodifiableList(orderFields(fieldSet, options.getColumnOrder()));
        Map<String, Field<T, ?>> byName = new LinkedHashMap<>();
        for (Field<T, ?> field : fields) {
            byName.put(field.getName(), field);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);

        List<Field<T, ?>> ids = new ArrayList<>();
        for (String name : options.getImportIdFields()) {
            Field<T, ?> field = requireField(name, "import id field");
            if (field.isComputed()) {
                throw new IllegalArgumentException("Import id field '" + name + "' has no attribute.");
            }
            ids.add(field);
        }
        this.importIdFields = Collections.unmodifiableList(ids);

        fieldSet.getExporters().keySet().forEach(name -> requireField(name, "exporter"));
        fieldSet.getImporters().keySet().forEach(name -> requireField(name, "importer"));
        this.exporters = fieldSet.getExporters();
        this.importers = fieldSet.getImporters();
        log.debug("{} configured with fields {}", getName(), byName.keySet());
    }

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    /** @return fields in column order */
    public List<Field<T, ?>> getFields() {
        return fields;
    }

    public Field<T, ?> getField(String name) {
        return requireField(name, "field");
    }

    public List<Field<T, ?>> getImportIdFields() {
        return importIdFields;
    }

    public ResourceOptions getOptions() {
        return options;
    }

    /** @return column names in export order */
    public List<String> getColumnHeaders() {
        List<String> headers = new ArrayList<>();
        for (Field<T, ?> field : fields) {
            headers.add(field.getColumnName());
        }
        return headers;
    }

    /** @return headers matching the entries of {@link RowResult#getDiff()} */
    public List<String> getDiffHeaders() {
        return getColumnHeaders();
    }

    // -----------------------------------------------------------------------
    // HOOKS
    // -----------------------------------------------------------------------

    /** Creates the object for a row that resolved to nothing. */
    protected T initInstance(Row row) {
        return store.newInstance();
    }

    /** Runs once before any row; a failure becomes a base error. */
    protected void beforeImport(Dataset dataset, boolean dryRun) {
    }

    protected void beforeSaveInstance(T instance, boolean dryRun) {
    }

    protected void afterSaveInstance(T instance, boolean dryRun) {
    }

    protected void beforeDeleteInstance(T instance, boolean dryRun) {
    }

    protected void afterDeleteInstance(T instance, boolean dryRun) {
    }

    /** @return {@code true} to delete the row's object instead of saving it */
    protected boolean forDelete(Row row, T instance) {
        return false;
    }

    /**
     * Decides whether the mutated object can be left unsaved.
     *
     * <p>With {@code skipUnchanged} on, the row is skipped when every
     * attribute field equals its snapshot value. Many-to-many fields compare
     * the member set the row names against the persisted members; a row
     * without the column, or a readonly field, is left out of the comparison.
     *
     * @param instance the object after field application
     * @param original its snapshot taken before
     * @param row      the dataset row
     */
    protected boolean skipRow(T instance, Snapshot original, Row row) {
        if (!options.isSkipUnchanged()) {
            return false;
        }
        for (Field<T, ?> field : fields) {
            if (field.isComputed()) {
                continue;
            }
            Object current;
            if (field.isRelationCollection()) {
                if (field.isReadonly() || !row.containsColumn(field.getColumnName())) {
                    continue;
                }
                current = Snapshot.normalize(field, field.clean(row));
            } else {
                current = Snapshot.normalize(field, field.getValue(instance));
            }
            if (!Objects.equals(current, original.getValue(field.getName()))) {
                return false;
            }
        }
        return true;
    }

    /** Chooses how rows are matched to existing objects. */
    protected InstanceLoader<T> createInstanceLoader(Dataset dataset) {
        return switch (options.getInstanceLoader()) {
            case MODEL -> new ModelInstanceLoader<>(store, importIdFields);
            case CACHED -> new CachedInstanceLoader<>(store, importIdFields, dataset);
        };
    }

    // -----------------------------------------------------------------------
    // IMPORT
    // -----------------------------------------------------------------------

    public Result importData(Dataset dataset) {
        return importData(dataset, false, false, TransactionMode.INHERIT);
    }

    public Result importData(Dataset dataset, boolean dryRun) {
        return importData(dataset, dryRun, false, TransactionMode.INHERIT);
    }

    public Result importData(Dataset dataset, boolean dryRun, boolean raiseErrors) {
        return importData(dataset, dryRun, raiseErrors, TransactionMode.INHERIT);
    }

    /**
     * Imports a dataset.
     *
     * @param dataset         rows to reconcile
     * @param dryRun          compute outcomes without keeping changes
     * @param raiseErrors     re-throw the first failure after rolling back
     * @param useTransactions overrides the resource and process defaults
     *                        unless {@link TransactionMode#INHERIT}
     * @return the outcome of every reported row
     * @throws RuntimeException the first failure, when {@code raiseErrors} is set
     */
    public Result importData(Dataset dataset, boolean dryRun, boolean raiseErrors,
                             TransactionMode useTransactions) {
        boolean transactional = resolveTransactions(useTransactions);
        boolean rowDryRun = !transactional && dryRun;
        String operation = (dryRun ? "DRY_RUN:" : "IMPORT:") + getName();
        ReconcileLog.setOperationContext(operation);
        log.info("{} starting: {} rows, transactional={}, dryRun={}",
                getName(), dataset.size(), transactional, dryRun);

        Result.Builder result = new Result.Builder(getName(), dryRun);
        TransactionManager tm = store.getTransactionManager();
        try (Transaction tx = transactional ? tm.begin() : tm.autoCommit()) {
            try {
                runBeforeImport(dataset, rowDryRun, result, raiseErrors);

                InstanceLoader<T> loader = createInstanceLoader(dataset);
                for (Row row : dataset) {
                    RowResult rowResult = importRow(row, loader, tx, rowDryRun, raiseErrors);
                    if (rowResult.getImportType() == ImportType.SKIP && !options.isReportSkipped()) {
                        result.countSkipped();
                    } else {
                        result.addRow(rowResult);
                    }
                }
            } catch (RuntimeException ex) {
                if (tx.isManaged() && tx.isActive()) {
                    tx.rollback();
                    log.warn("{} aborted; transaction rolled back.", getName());
                }
                ReconcileLog.logErrorEvent("IMPORT_ABORTED", "resource=" + getName(), ex);
                throw ex;
            }

            if (tx.isManaged()) {
                if (dryRun || result.hasErrors()) {
                    tx.rollback();
                    log.info("{} rolled back (dryRun={}, errors={}).", getName(), dryRun, result.hasErrors());
                } else {
                    tx.commit();
                }
            }
        } finally {
            ReconcileLog.clearAllContext();
        }

        Result built = result.build();
        log.info("{}: {}", getName(), built.getSummary());
        ReconcileLog.logEvent(built.hasErrors() ? "IMPORT_COMPLETED_WITH_ERRORS" : "IMPORT_COMPLETE",
                "resource=" + getName() + " " + built.getSummary());
        return built;
    }

    /**
     * Reconciles one row.
     *
     * @param row         the dataset row
     * @param loader      resolver for existing objects
     * @param tx          handle threaded to every store write
     * @param dryRun      skip store writes
     * @param raiseErrors re-throw instead of recording an ERROR row
     * @return the row's outcome
     */
    public RowResult importRow(Row row, InstanceLoader<T> loader, Transaction tx,
                               boolean dryRun, boolean raiseErrors) {
        RowResult.Builder rr = new RowResult.Builder(row.getNumber());
        ReconcileLog.setRowContext(row.getNumber());
        try {
            Optional<T> existing = loader.getInstance(row);
            boolean isNew = existing.isEmpty();
            T instance = existing.orElseGet(() -> initInstance(row));
            rr.newRecord(isNew).importType(isNew ? ImportType.NEW : ImportType.UPDATE);
            Snapshot original = snapshot(instance, !isNew);

            if (forDelete(row, instance)) {
                if (isNew) {
                    rr.importType(ImportType.SKIP);
                    rr.diff(getDiff(Snapshot.empty(fields), Snapshot.empty(fields)));
                } else {
                    rr.importType(ImportType.DELETE)
                            .objectRepr(String.valueOf(instance))
                            .objectId(store.getId(instance));
                    deleteInstance(instance, tx, dryRun);
                    rr.diff(getDiff(original, Snapshot.empty(fields)));
                }
            } else {
                importObj(instance, row);
                if (skipRow(instance, original, row)) {
                    rr.importType(ImportType.SKIP);
                } else {
                    saveInstance(instance, tx, dryRun);
                    saveM2m(instance, row, tx, dryRun);
                    rr.objectRepr(String.valueOf(instance)).objectId(store.getId(instance));
                }
                rr.diff(getDiff(original, snapshot(instance, !dryRun || !isNew)));
            }
            log.debug("Row {} -> {}", row.getNumber(), rr.getImportType());
        } catch (RuntimeException ex) {
            rr.importType(ImportType.ERROR).diff(List.of()).addError(ex);
            log.warn("Row {} failed: {}", row.getNumber(), ex.getMessage());
            ReconcileLog.logWarningEvent("ROW_ERROR",
                    "row=" + row.getNumber() + " error=" + ex.getClass().getSimpleName());
            if (raiseErrors) {
                throw ex;
            }
        } finally {
            ReconcileLog.clearRowContext();
        }
        return rr.build();
    }

    /** Applies every non-collection field whose column the row carries. */
    public void importObj(T instance, Row row) {
        for (Field<T, ?> field : fields) {
            if (!field.isRelationCollection()) {
                importField(field, instance, row);
            }
        }
    }

    /** Imports one field through its registered importer or {@link Field#save}. */
    public void importField(Field<T, ?> field, T instance, Row row) {
        if (field.isComputed() || !row.containsColumn(field.getColumnName())) {
            return;
        }
        FieldImporter<T> importer = importers.get(field.getName());
        if (importer != null) {
            importer.importField(field, instance, row);
        } else {
            field.save(instance, row);
        }
    }

    /**
     * Writes many-to-many members named by the row. Does nothing in a dry run;
     * the owner must already be saved.
     */
    @SuppressWarnings("unchecked")
    public void saveM2m(T instance, Row row, Transaction tx, boolean dryRun) {
        if (dryRun) {
            return;
        }
        for (Field<T, ?> field : fields) {
            if (!field.isRelationCollection() || field.isReadonly()
                    || !row.containsColumn(field.getColumnName())) {
                continue;
            }
            Field<T, Object> m2m = (Field<T, Object>) field;
            FieldImporter<T> importer = importers.get(field.getName());
            if (importer != null) {
                importer.importField(field, instance, row);
            } else {
                m2m.assign(instance, m2m.clean(row));
            }
            store.saveRelation(instance, field.getAttribute(), tx);
        }
    }

    /**
     * @return one rendered diff per field, in field order
     */
    public List<String> getDiff(Snapshot original, Snapshot current) {
        List<String> diffs = new ArrayList<>();
        for (Field<T, ?> field : fields) {
            diffs.add(diffEngine.diffAndRender(
                    original.getExport(field.getName()),
                    current.getExport(field.getName())));
        }
        return diffs;
    }

    // -----------------------------------------------------------------------
    // EXPORT
    // -----------------------------------------------------------------------

    /** Exports one field through its registered exporter or {@link Field#export}. */
    public String exportField(Field<T, ?> field, T instance) {
        Function<T, String> exporter = exporters.get(field.getName());
        if (exporter != null) {
            String value = exporter.apply(instance);
            return value == null ? "" : value;
        }
        return field.export(instance);
    }

    /** @return exported values in column order */
    public List<String> exportInstance(T instance) {
        List<String> values = new ArrayList<>();
        for (Field<T, ?> field : fields) {
            values.add(exportField(field, instance));
        }
        return values;
    }

    /** Exports every object in the store, reading them one at a time. */
    public Dataset export() {
        Dataset dataset = new Dataset(getColumnHeaders());
        try (Stream<T> all = store.streamAll()) {
            all.forEach(instance -> dataset.append(exportInstance(instance)));
        }
        log.info("{} exported {} rows.", getName(), dataset.size());
        ReconcileLog.logEvent("EXPORT_COMPLETE", "resource=" + getName() + " rows=" + dataset.size());
        return dataset;
    }

    public Dataset export(Iterable<T> instances) {
        Dataset dataset = new Dataset(getColumnHeaders());
        for (T instance : instances) {
            dataset.append(exportInstance(instance));
        }
        log.info("{} exported {} rows.", getName(), dataset.size());
        return dataset;
    }

    // -----------------------------------------------------------------------
    // PRIVATE
    // -----------------------------------------------------------------------

    private boolean resolveTransactions(TransactionMode override) {
        if (override != null && override != TransactionMode.INHERIT) {
            return override == TransactionMode.ENABLED;
        }
        if (options.getUseTransactions() != TransactionMode.INHERIT) {
            return options.getUseTransactions() == TransactionMode.ENABLED;
        }
        return config.isUseTransactions();
    }

    private void runBeforeImport(Dataset dataset, boolean dryRun, Result.Builder result, boolean raiseErrors) {
        try {
            beforeImport(dataset, dryRun);
        } catch (RuntimeException ex) {
            log.error("{} before-import hook failed.", getName(), ex);
            result.addBaseError(ex);
            if (raiseErrors) {
                throw ex;
            }
        }
    }

    private void saveInstance(T instance, Transaction tx, boolean dryRun) {
        runHook("beforeSaveInstance", () -> beforeSaveInstance(instance, dryRun));
        if (!dryRun) {
            store.save(instance, tx);
        }
        runHook("afterSaveInstance", () -> afterSaveInstance(instance, dryRun));
    }

    private void deleteInstance(T instance, Transaction tx, boolean dryRun) {
        runHook("beforeDeleteInstance", () -> beforeDeleteInstance(instance, dryRun));
        if (!dryRun) {
            store.delete(instance, tx);
        }
        runHook("afterDeleteInstance", () -> afterDeleteInstance(instance, dryRun));
    }

    private void runHook(String name, Runnable hook) {
        try {
            hook.run();
        } catch (HookException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new HookException(name + " failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * @param persisted whether many-to-many members can be read from the store
     */
    private Snapshot snapshot(T instance, boolean persisted) {
        Map<String, String> exports = new LinkedHashMap<>();
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field<T, ?> field : fields) {
            exports.put(field.getName(), exportField(field, instance));
            if (field.isComputed()) {
                continue;
            }
            Object value;
            if (field.isRelationCollection()) {
                Collection<?> members = persisted && store.getId(instance) != null
                        ? store.getRelationMembers(instance, field.getAttribute())
                        : List.of();
                value = members;
            } else {
                value = field.getValue(instance);
            }
            values.put(field.getName(), Snapshot.normalize(field, value));
        }
        return new Snapshot(exports, values);
    }

    private List<Field<T, ?>> orderFields(FieldSet<T> fieldSet, List<String> columnOrder) {
        List<Field<T, ?>> declared = fieldSet.getFields();
        if (columnOrder.isEmpty()) {
            return declared;
        }
        List<Field<T, ?>> ordered = new ArrayList<>();
        for (String name : columnOrder) {
            Field<T, ?> field = fieldSet.getField(name);
            if (field == null) {
                throw new IllegalArgumentException("Column order names unknown field '" + name + "'.");
            }
            if (ordered.contains(field)) {
                throw new IllegalArgumentException("Column order repeats field '" + name + "'.");
            }
            ordered.add(field);
        }
        for (Field<T, ?> field : declared) {
            if (!columnOrder.contains(field.getName())) {
                ordered.add(field);
            }
        }
        return ordered;
    }

    private Field<T, ?> requireField(String name, String role) {
        Field<T, ?> field = fieldsByName.get(name);
        if (field == null) {
            throw new IllegalArgumentException("Unknown " + role + " '" + name
                    + "'; declared fields are " + fieldsByName.keySet() + ".");
        }
        return field;
    }

    private String getName() {
        String simple = getClass().getSimpleName();
        return simple.isEmpty() ? "Resource[" + store.getSchema().getModelName() + "]" : simple;
    }
}
