package com.casesentinel.core.matching;

import com.casesentinel.core.model.Match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of matching indicators against a whole record store.
 *
 * <p>
 * {@link #getBySource()} omits sources without matches; {@link #getAll()}
 * is the flat combined list in source order.
 * </p>
 *
 * @since 1.0.0
 */
public final class MatchResult {

    private final Map<String, List<Match>> bySource;
    private final List<Match> all;

    MatchResult(Map<String, List<Match>> bySource) {
        Map<String, List<Match>> copy = new LinkedHashMap<>();
        List<Match> flat = new ArrayList<>();
        for (Map.Entry<String, List<Match>> entry : bySource.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                copy.put(entry.getKey(), List.copyOf(entry.getValue()));
                flat.addAll(entry.getValue());
            }
        }
        this.bySource = Collections.unmodifiableMap(copy);
        this.all = Collections.unmodifiableList(flat);
    }

    public static MatchResult empty() {
        return new MatchResult(Map.of());
    }

    public Map<String, List<Match>> getBySource() {
        return bySource;
    }

    public List<Match> getAll() {
        return all;
    }

    public int total() {
        return all.size();
    }

    @Override
    public String toString() {
        return "MatchResult{sources=" + bySource.keySet() + ", total=" + all.size() + '}';
    }
}
