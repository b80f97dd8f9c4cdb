package com.casesentinel.core.summary;

import com.casesentinel.core.model.Match;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate counts over a list of matches. Each grouping sums to
 * {@link #getTotal()}; keys keep first-seen order and indicator kinds are
 * keyed by wire name.
 *
 * @since 1.0.0
 */
public final class MatchSummary {

    private final int total;
    private final Map<String, Integer> bySource;
    private final Map<String, Integer> byIndicatorKind;
    private final Map<String, Integer> byIndicator;

    private MatchSummary(int total, Map<String, Integer> bySource,
                         Map<String, Integer> byIndicatorKind, Map<String, Integer> byIndicator) {
        this.total = total;
        this.bySource = Collections.unmodifiableMap(bySource);
        this.byIndicatorKind = Collections.unmodifiableMap(byIndicatorKind);
        this.byIndicator = Collections.unmodifiableMap(byIndicator);
    }

    public static MatchSummary of(List<Match> matches) {
        Objects.requireNonNull(matches, "Matches must not be null");
        Map<String, Integer> bySource = new LinkedHashMap<>();
        Map<String, Integer> byKind = new LinkedHashMap<>();
        Map<String, Integer> byIndicator = new LinkedHashMap<>();
        for (Match match : matches) {
            bySource.merge(match.getSource(), 1, Integer::sum);
            byKind.merge(match.getIndicatorKind().wireName(), 1, Integer::sum);
            byIndicator.merge(match.getIndicator(), 1, Integer::sum);
        }
        return new MatchSummary(matches.size(), bySource, byKind, byIndicator);
    }

    @JsonProperty("total_matches")
    public int getTotal() {
        return total;
    }

    @JsonProperty("by_source")
    public Map<String, Integer> getBySource() {
        return bySource;
    }

    @JsonProperty("by_ioc_type")
    public Map<String, Integer> getByIndicatorKind() {
        return byIndicatorKind;
    }

    @JsonProperty("by_ioc")
    public Map<String, Integer> getByIndicator() {
        return byIndicator;
    }

    @Override
    public String toString() {
        return "MatchSummary{total=" + total + ", bySource=" + bySource + ", byIndicatorKind=" + byIndicatorKind + '}';
    }
}
