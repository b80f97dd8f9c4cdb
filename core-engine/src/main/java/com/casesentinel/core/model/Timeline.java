package com.casesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The ordered incident timeline: dated findings in chronological order
 * followed by undated findings in insertion order.
 *
 * <p>
 * {@link #toRows()} renders findings with exactly the columns in
 * {@link #COLUMNS}, which is what delimited-file writers consume. An empty
 * timeline still exposes {@link #COLUMNS}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Timeline {

    public static final String COL_TIMESTAMP = "Timestamp";
    public static final String COL_DEVICE_NAME = "Device Name";
    public static final String COL_ACCOUNT = "Account";
    public static final String COL_EVENT = "Event";
    public static final String COL_ARTIFACT = "Artifact";
    public static final String COL_EVENT_ID = "Event ID";
    public static final String COL_ANALYST = "Analyst";
    public static final String COL_COMMENTS = "Comments";
    public static final String COL_LEVEL = "Level";

    /** Output columns, in order. */
    public static final List<String> COLUMNS = List.of(
            COL_TIMESTAMP, COL_DEVICE_NAME, COL_ACCOUNT, COL_EVENT, COL_ARTIFACT,
            COL_EVENT_ID, COL_ANALYST, COL_COMMENTS, COL_LEVEL);

    private final List<Finding> findings;

    /**
     * @param findings findings in final timeline order
     */
    public Timeline(List<Finding> findings) {
        Objects.requireNonNull(findings, "Findings must not be null");
        this.findings = Collections.unmodifiableList(new ArrayList<>(findings));
    }

    public static Timeline empty() {
        return new Timeline(List.of());
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public List<String> getColumns() {
        return COLUMNS;
    }

    public int size() {
        return findings.size();
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    /**
     * Render every finding as an ordered column-to-text map. Absent fields
     * become empty strings.
     *
     * @return one map per finding, keys in {@link #COLUMNS} order
     */
    public List<Map<String, String>> toRows() {
        List<Map<String, String>> rows = new ArrayList<>(findings.size());
        for (Finding f : findings) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(COL_TIMESTAMP, orEmpty(f.getTimestamp()));
            row.put(COL_DEVICE_NAME, orEmpty(f.getDeviceName()));
            row.put(COL_ACCOUNT, orEmpty(f.getAccount()));
            row.put(COL_EVENT, f.getEvent());
            row.put(COL_ARTIFACT, f.getArtifact());
            row.put(COL_EVENT_ID, orEmpty(f.getEventId()));
            row.put(COL_ANALYST, f.getAnalyst());
            row.put(COL_COMMENTS, f.getComments());
            row.put(COL_LEVEL, f.getLevel().label());
            rows.add(Collections.unmodifiableMap(row));
        }
        return Collections.unmodifiableList(rows);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    @Override
    public String toString() {
        return "Timeline{findings=" + findings.size() + '}';
    }
}
