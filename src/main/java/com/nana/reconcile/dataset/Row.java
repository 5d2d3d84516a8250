package com.nana.reconcile.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One dataset record: column name to raw cell text.
 *
 * <p>A column missing from the row is different from a column present with
 * an empty cell. {@link #containsColumn(String)} distinguishes the two, which
 * lets imports update only the columns a file actually carries.
 */
public final class Row {

    private final int number;
    private final Map<String, String> cells;

    /**
     * @param number 1-based position of the row in its dataset
     * @param cells  column to raw value; copied, insertion order kept
     */
    public Row(int number, Map<String, String> cells) {
        this.number = number;
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    /** @return the 1-based row number within the dataset */
    public int getNumber() { return number; }

    public boolean containsColumn(String column) {
        return cells.containsKey(column);
    }

    /**
     * @param column the column name
     * @return the raw cell, or {@code null} when the column is absent
     */
    public String get(String column) {
        return cells.get(column);
    }

    public Set<String> getColumns() {
        return cells.keySet();
    }

    /** @return an unmodifiable view of the cells */
    public Map<String, String> asMap() {
        return cells;
    }

    @Override
    public String toString() {
        return "Row{" + number + ", " + cells + "}";
    }
}
