package com.casesentinel.core.detection;

import com.casesentinel.core.model.Anomaly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a detection sweep over a whole record store.
 *
 * <p>
 * {@link #getBySource()} only lists sources with at least one anomaly;
 * {@link #getAll()} is the flat list in source order.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final Map<String, List<Anomaly>> bySource;
    private final List<Anomaly> all;

    DetectionResult(Map<String, List<Anomaly>> bySource) {
        Map<String, List<Anomaly>> copy = new LinkedHashMap<>();
        List<Anomaly> flat = new ArrayList<>();
        for (Map.Entry<String, List<Anomaly>> entry : bySource.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                copy.put(entry.getKey(), List.copyOf(entry.getValue()));
                flat.addAll(entry.getValue());
            }
        }
        this.bySource = Collections.unmodifiableMap(copy);
        this.all = Collections.unmodifiableList(flat);
    }

    public static DetectionResult empty() {
        return new DetectionResult(Map.of());
    }

    public Map<String, List<Anomaly>> getBySource() {
        return bySource;
    }

    public List<Anomaly> getAll() {
        return all;
    }

    public int total() {
        return all.size();
    }

    @Override
    public String toString() {
        return "DetectionResult{sources=" + bySource.keySet() + ", total=" + all.size() + '}';
    }
}
