package com.nana.reconcile.result;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one import batch.
 *
 * <p>Holds the reported {@link RowResult}s in dataset order, the base errors
 * raised outside row processing, and per-type totals. Totals include
 * skipped rows even when skipped rows are not reported individually.
 *
 * <p>{@link #toReportText()} renders a plain-text report that can be written
 * next to the imported file.
 */
public final class Result {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String source;
    private final boolean dryRun;
    private final LocalDateTime importedAt;
    private final List<RowResult> rows;
    private final List<ImportError> baseErrors;
    private final Map<ImportType, Integer> totals;

    private Result(Builder builder) {
        this.source     = builder.source;
        this.dryRun     = builder.dryRun;
        this.importedAt = builder.importedAt;
        this.rows       = Collections.unmodifiableList(new ArrayList<>(builder.rows));
        this.baseErrors = Collections.unmodifiableList(new ArrayList<>(builder.baseErrors));
        this.totals     = Collections.unmodifiableMap(new EnumMap<>(builder.totals));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return name of what was imported, e.g. the resource class */
    public String getSource()              { return source; }

    public boolean isDryRun()              { return dryRun; }

    public LocalDateTime getImportedAt()   { return importedAt; }

    public List<RowResult> getRows()       { return rows; }

    public List<ImportError> getBaseErrors() { return baseErrors; }

    /** @return {@code true} if any base error or any row error was recorded */
    public boolean hasErrors() {
        return !baseErrors.isEmpty() || rows.stream().anyMatch(RowResult::hasErrors);
    }

    /** @return rows processed with the given outcome, reported or not */
    public int getTotal(ImportType type) {
        return totals.getOrDefault(type, 0);
    }

    public int getTotalRows() {
        return totals.values().stream().mapToInt(Integer::intValue).sum();
    }

    public List<RowResult> getErrorRows() {
        return rows.stream().filter(RowResult::hasErrors).toList();
    }

    /**
     * @return one-line summary such as
     *         {@code "5 rows: 2 new, 1 updated, 0 deleted, 1 skipped, 1 failed."}
     */
    public String getSummary() {
        if (!baseErrors.isEmpty()) {
            return "Before-import step failed: " + baseErrors.get(0).getMessage();
        }
        if (getTotalRows() == 0) {
            return "No data rows found.";
        }
        return String.format("%d rows: %d new, %d updated, %d deleted, %d skipped, %d failed.%s",
                getTotalRows(),
                getTotal(ImportType.NEW),
                getTotal(ImportType.UPDATE),
                getTotal(ImportType.DELETE),
                getTotal(ImportType.SKIP),
                getTotal(ImportType.ERROR),
                dryRun ? " (dry run)" : "");
    }

    /**
     * Renders a plain-text report.
     *
     * <pre>
     * ============================================================
     *  Import Report
     * ============================================================
     *  Source        : BookResource
     *  Imported At   : 2025-01-15 14:32:00
     *  Dry Run       : no
     *  Total Rows    : 3
     *  New           : 1
     *  ...
     * ------------------------------------------------------------
     *  FAILED ROWS:
     * ------------------------------------------------------------
     *  Row 3     | 'abc' is not a valid integer.
     * ============================================================
     * </pre>
     *
     * @return the multi-line report
     */
    public String toReportText() {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);

        sb.append(line60).append("\n");
        sb.append(" Import Report\n");
        sb.append(line60).append("\n");
        sb.append(String.format(" %-14s: %s%n", "Source", source == null ? "Unknown" : source));
        sb.append(String.format(" %-14s: %s%n", "Imported At", importedAt.format(DISPLAY_FORMAT)));
        sb.append(String.format(" %-14s: %s%n", "Dry Run", dryRun ? "yes" : "no"));
        sb.append(String.format(" %-14s: %d%n", "Total Rows", getTotalRows()));
        sb.append(String.format(" %-14s: %d%n", "New", getTotal(ImportType.NEW)));
        sb.append(String.format(" %-14s: %d%n", "Updated", getTotal(ImportType.UPDATE)));
        sb.append(String.format(" %-14s: %d%n", "Deleted", getTotal(ImportType.DELETE)));
        sb.append(String.format(" %-14s: %d%n", "Skipped", getTotal(ImportType.SKIP)));
        sb.append(String.format(" %-14s: %d%n", "Failed", getTotal(ImportType.ERROR)));
        sb.append(line60d).append("\n");

        if (!baseErrors.isEmpty()) {
            sb.append(" BATCH ERRORS:\n");
            for (ImportError error : baseErrors) {
                sb.append(" ").append(error.getMessage()).append("\n");
            }
            sb.append(line60d).append("\n");
        }

        List<RowResult> failed = getErrorRows();
        if (failed.isEmpty()) {
            sb.append(" No row errors.\n");
        } else {
            sb.append(" FAILED ROWS:\n");
            sb.append(line60d).append("\n");
            for (RowResult rr : failed) {
                for (ImportError error : rr.getErrors()) {
                    sb.append(String.format(" Row %-5d | %s%n", rr.getRowNumber(), error.getMessage()));
                }
            }
        }
        sb.append(line60).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Result{rows=" + rows.size()
               + ", totals=" + totals
               + ", baseErrors=" + baseErrors.size() + "}";
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    /**
     * Accumulates rows while a batch runs.
     */
    public static final class Builder {

        private final String source;
        private final boolean dryRun;
        private final LocalDateTime importedAt = LocalDateTime.now();
        private final List<RowResult> rows = new ArrayList<>();
        private final List<ImportError> baseErrors = new ArrayList<>();
        private final Map<ImportType, Integer> totals = new EnumMap<>(ImportType.class);

        public Builder(String source, boolean dryRun) {
            this.source = source;
            this.dryRun = dryRun;
        }

        /** Records a reported row and counts it. */
        public Builder addRow(RowResult row) {
            rows.add(row);
            count(row.getImportType());
            return this;
        }

        /** Counts a skipped row that is not reported. */
        public Builder countSkipped() {
            count(ImportType.SKIP);
            return this;
        }

        public Builder addBaseError(Throwable error) {
            baseErrors.add(new ImportError(error));
            return this;
        }

        /** @return {@code true} once any base or row error was recorded */
        public boolean hasErrors() {
            return !baseErrors.isEmpty() || rows.stream().anyMatch(RowResult::hasErrors);
        }

        public Result build() {
            return new Result(this);
        }

        private void count(ImportType type) {
            totals.merge(type, 1, Integer::sum);
        }
    }
}
