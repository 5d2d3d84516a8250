package com.nana.reconcile.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * An ordered table of raw string cells with a header row.
 *
 * <p>Serves both directions: imports iterate it as {@link Row}s, exports
 * {@link #append(List) append} rendered values to it. Rows shorter than the
 * header are allowed; the missing trailing columns are simply absent from
 * the corresponding {@link Row}.
 */
public final class Dataset implements Iterable<Row> {

    private final List<String> headers;
    private final List<List<String>> data = new ArrayList<>();

    /**
     * @param headers column names; must be unique
     * @throws IllegalArgumentException if a header repeats
     */
    public Dataset(List<String> headers) {
        List<String> copy = new ArrayList<>(headers);
        if (copy.stream().distinct().count() != copy.size()) {
            throw new IllegalArgumentException("Duplicate column header in " + headers);
        }
        this.headers = Collections.unmodifiableList(copy);
    }

    public static Dataset withHeaders(String... headers) {
        return new Dataset(List.of(headers));
    }

    public List<String> getHeaders() { return headers; }

    public int size() { return data.size(); }

    public boolean isEmpty() { return data.isEmpty(); }

    /**
     * Appends one record.
     *
     * @param values cell values in header order
     * @return this dataset for chaining
     * @throws IllegalArgumentException if there are more values than headers
     */
    public Dataset append(List<String> values) {
        if (values.size() > headers.size()) {
            throw new IllegalArgumentException("Row has " + values.size()
                    + " values but dataset has " + headers.size() + " columns.");
        }
        data.add(Collections.unmodifiableList(new ArrayList<>(values)));
        return this;
    }

    public Dataset append(String... values) {
        return append(List.of(values));
    }

    /** @return the raw cell lists in insertion order */
    public List<List<String>> getData() {
        return Collections.unmodifiableList(data);
    }

    /**
     * @param index 0-based record index
     * @return the record as a {@link Row} numbered {@code index + 1}
     */
    public Row getRow(int index) {
        List<String> values = data.get(index);
        Map<String, String> cells = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            cells.put(headers.get(i), values.get(i));
        }
        return new Row(index + 1, cells);
    }

    @Override
    public Iterator<Row> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < data.size();
            }

            @Override
            public Row next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return getRow(next++);
            }
        };
    }

    @Override
    public String toString() {
        return "Dataset{headers=" + headers + ", rows=" + data.size() + "}";
    }
}
