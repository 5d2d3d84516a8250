package com.nana.reconcile.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable outcome of one dataset row.
 *
 * <p>Built through {@link Builder}, which the engine fills in as the row
 * moves through its lifecycle and freezes once the row is finished.
 */
public final class RowResult {

    private final int rowNumber;
    private final ImportType importType;
    private final List<String> diff;
    private final List<ImportError> errors;
    private final String objectRepr;
    private final Object objectId;
    private final boolean newRecord;

    private RowResult(Builder builder) {
        this.rowNumber  = builder.rowNumber;
        this.importType = builder.importType;
        this.diff       = Collections.unmodifiableList(new ArrayList<>(builder.diff));
        this.errors     = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.objectRepr = builder.objectRepr;
        this.objectId   = builder.objectId;
        this.newRecord  = builder.newRecord;
    }

    /** @return 1-based row position in the dataset */
    public int getRowNumber()         { return rowNumber; }

    public ImportType getImportType() { return importType; }

    /** @return rendered per-field diffs in field order; empty for errored rows */
    public List<String> getDiff()     { return diff; }

    public List<ImportError> getErrors() { return errors; }

    /** @return text form of the saved object, or {@code null} if none was saved */
    public String getObjectRepr()     { return objectRepr; }

    public Object getObjectId()       { return objectId; }

    /** @return {@code true} when the row resolved to no existing object */
    public boolean isNewRecord()      { return newRecord; }

    public boolean hasErrors()        { return !errors.isEmpty(); }

    @Override
    public String toString() {
        return "RowResult{row=" + rowNumber
               + ", type=" + importType
               + (objectId == null ? "" : ", id=" + objectId)
               + (errors.isEmpty() ? "" : ", errors=" + errors)
               + "}";
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder {

        private final int rowNumber;
        private ImportType importType;
        private List<String> diff = new ArrayList<>();
        private final List<ImportError> errors = new ArrayList<>();
        private String objectRepr;
        private Object objectId;
        private boolean newRecord;

        public Builder(int rowNumber) {
            this.rowNumber = rowNumber;
        }

        public Builder importType(ImportType importType) {
            this.importType = importType;
            return this;
        }

        public ImportType getImportType() {
            return importType;
        }

        public Builder diff(List<String> diff) {
            this.diff = new ArrayList<>(diff);
            return this;
        }

        public Builder addError(Throwable error) {
            errors.add(new ImportError(error));
            return this;
        }

        public Builder objectRepr(String objectRepr) {
            this.objectRepr = objectRepr;
            return this;
        }

        public Builder objectId(Object objectId) {
            this.objectId = objectId;
            return this;
        }

        public Builder newRecord(boolean newRecord) {
            this.newRecord = newRecord;
            return this;
        }

        /**
         * @return the frozen result
         * @throws IllegalStateException if no import type was set
         */
        public RowResult build() {
            if (importType == null) {
                throw new IllegalStateException("Row " + rowNumber + " has no import type.");
            }
            return new RowResult(this);
        }
    }
}
