package com.casesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Case-folded, read-only view of a {@link Dataset}.
 *
 * <p>
 * Each cell's text is lowercased once ({@link Locale#ROOT}) when the view is
 * built, so that a scan over many patterns or indicators does not fold the
 * same cell repeatedly. The source dataset is never modified.
 * </p>
 *
 * @since 1.0.0
 */
public final class FoldedDataset {

    private final Dataset dataset;
    private final Map<String, String[]> folded = new LinkedHashMap<>();
    private final Map<String, boolean[]> textCells = new LinkedHashMap<>();
    private final List<String> textualColumns;

    /**
     * @param dataset the dataset to fold; must not be {@code null}
     */
    public FoldedDataset(Dataset dataset) {
        this.dataset = Objects.requireNonNull(dataset, "Dataset must not be null");
        List<String> textual = new ArrayList<>();
        int size = dataset.size();
        for (String column : dataset.getColumns()) {
            String[] values = new String[size];
            boolean[] isText = new boolean[size];
            boolean anyText = false;
            for (int i = 0; i < size; i++) {
                CellValue cell = dataset.getRows().get(i).get(column);
                values[i] = cell.asText().map(t -> t.toLowerCase(Locale.ROOT)).orElse(null);
                isText[i] = cell.isText();
                anyText |= isText[i];
            }
            folded.put(column, values);
            textCells.put(column, isText);
            if (anyText) {
                textual.add(column);
            }
        }
        this.textualColumns = Collections.unmodifiableList(textual);
    }

    public Dataset getDataset() {
        return dataset;
    }

    public List<String> getColumns() {
        return dataset.getColumns();
    }

    /**
     * @return columns holding at least one text cell, in column order
     */
    public List<String> getTextualColumns() {
        return textualColumns;
    }

    public int size() {
        return dataset.size();
    }

    /**
     * @param column normalized column name
     * @param row    row index
     * @return lowercased cell text, or {@code null} for null cells and unknown
     *         columns
     */
    public String folded(String column, int row) {
        String[] values = folded.get(column);
        return values != null ? values[row] : null;
    }

    /**
     * @param column normalized column name
     * @param row    row index
     * @return {@code true} if the original cell is a text cell
     */
    public boolean isText(String column, int row) {
        boolean[] values = textCells.get(column);
        return values != null && values[row];
    }
}
