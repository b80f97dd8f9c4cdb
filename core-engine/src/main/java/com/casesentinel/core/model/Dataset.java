package com.casesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered, read-only table of {@link Row}s ingested from one source.
 *
 * <p>
 * Every row carries exactly the dataset's column set; this is checked on
 * construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dataset {

    private final List<String> columns;
    private final List<Row> rows;

    /**
     * @param columns column names (normalized on construction)
     * @param rows    the rows; each must have exactly these columns
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if a row disagrees with the column set
     */
    public Dataset(List<String> columns, List<Row> rows) {
        Objects.requireNonNull(columns, "Columns must not be null");
        Objects.requireNonNull(rows, "Rows must not be null");

        Set<String> normalized = new LinkedHashSet<>();
        for (String column : columns) {
            if (!normalized.add(ColumnNames.normalize(column))) {
                throw new IllegalArgumentException(
                        "Duplicate column after normalization: " + ColumnNames.normalize(column));
            }
        }
        for (int i = 0; i < rows.size(); i++) {
            Row row = Objects.requireNonNull(rows.get(i), "Row at index " + i + " is null");
            if (!row.columns().equals(normalized)) {
                throw new IllegalArgumentException("Row " + i + " has columns " + row.columns()
                        + " but dataset declares " + normalized);
            }
        }
        this.columns = List.copyOf(normalized);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /**
     * Build a dataset whose columns are taken from the first row.
     *
     * @param rows the rows
     * @return a new dataset (no columns when {@code rows} is empty)
     */
    public static Dataset ofRows(List<Row> rows) {
        Objects.requireNonNull(rows, "Rows must not be null");
        List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).columns());
        return new Dataset(columns, rows);
    }

    /**
     * @return an empty dataset without columns
     */
    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @param index zero-based row index
     * @return the row, or empty if {@code index} is out of bounds
     */
    public Optional<Row> row(int index) {
        if (index < 0 || index >= rows.size()) {
            return Optional.empty();
        }
        return Optional.of(rows.get(index));
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
