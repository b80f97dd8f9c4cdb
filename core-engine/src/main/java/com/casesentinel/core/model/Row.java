package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One immutable record of a {@link Dataset}.
 *
 * <p>
 * Stores column name to {@link CellValue} in column order. Column names are
 * normalized on construction and every lookup normalizes the requested name,
 * so {@code row.get("Event Time")} and {@code row.get("event_time")} are
 * equivalent.
 * </p>
 *
 * @since 1.0.0
 */
public final class Row {

    private final Map<String, CellValue> cells;

    /**
     * @param values column name to raw value; values are wrapped with
     *               {@link CellValue#of(Object)}
     * @throws NullPointerException     if {@code values} is {@code null}
     * @throws IllegalArgumentException if two names normalize to the same
     *                                  column
     */
    public Row(Map<String, ?> values) {
        Objects.requireNonNull(values, "Row values must not be null");
        Map<String, CellValue> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String column = ColumnNames.normalize(entry.getKey());
            if (copy.put(column, CellValue.of(entry.getValue())) != null) {
                throw new IllegalArgumentException("Duplicate column after normalization: " + column);
            }
        }
        this.cells = Collections.unmodifiableMap(copy);
    }

    /**
     * Convenience factory for tests and small fixtures.
     *
     * @param keysAndValues alternating column names and values
     * @return a new row
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static Row of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Row.of expects column/value pairs");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            values.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return new Row(values);
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    /**
     * @return the normalized column names, in column order
     */
    public Set<String> columns() {
        return cells.keySet();
    }

    /**
     * @param column column name (any case or spacing)
     * @return {@code true} if the column exists in this row
     */
    public boolean hasColumn(String column) {
        return cells.containsKey(ColumnNames.normalize(column));
    }

    /**
     * @param column column name (any case or spacing)
     * @return the cell, or the null cell when the column is absent
     */
    public CellValue get(String column) {
        return cells.getOrDefault(ColumnNames.normalize(column), CellValue.nullValue());
    }

    /**
     * @param column column name (any case or spacing)
     * @return the text of the cell, or empty if absent or null
     */
    public Optional<String> text(String column) {
        return get(column).asText();
    }

    /**
     * Return the text of the first alias column that exists with a non-null
     * value.
     *
     * @param aliases candidate column names in priority order
     * @return the first present value, or empty when no alias resolves
     */
    public Optional<String> firstPresent(List<String> aliases) {
        for (String alias : aliases) {
            Optional<String> value = text(alias);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * @return unmodifiable view of all cells
     */
    public Map<String, CellValue> cells() {
        return cells;
    }

    @JsonValue
    Map<String, CellValue> jsonValue() {
        return cells;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Row that))
            return false;
        return cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + cells;
    }
}
