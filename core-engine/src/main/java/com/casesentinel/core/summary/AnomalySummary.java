package com.casesentinel.core.summary;

import com.casesentinel.core.model.Anomaly;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate counts over a list of anomalies, keyed by source name, rule
 * type and severity wire names.
 *
 * @since 1.0.0
 */
public final class AnomalySummary {

    private final int total;
    private final Map<String, Integer> bySource;
    private final Map<String, Integer> byRuleType;
    private final Map<String, Integer> bySeverity;

    private AnomalySummary(int total, Map<String, Integer> bySource,
                           Map<String, Integer> byRuleType, Map<String, Integer> bySeverity) {
        this.total = total;
        this.bySource = Collections.unmodifiableMap(bySource);
        this.byRuleType = Collections.unmodifiableMap(byRuleType);
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
    }

    public static AnomalySummary of(List<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "Anomalies must not be null");
        Map<String, Integer> bySource = new LinkedHashMap<>();
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            bySource.merge(anomaly.getSource(), 1, Integer::sum);
            byType.merge(anomaly.getRuleType().wireName(), 1, Integer::sum);
            bySeverity.merge(anomaly.getSeverity().wireName(), 1, Integer::sum);
        }
        return new AnomalySummary(anomalies.size(), bySource, byType, bySeverity);
    }

    @JsonProperty("total_anomalies")
    public int getTotal() {
        return total;
    }

    @JsonProperty("by_source")
    public Map<String, Integer> getBySource() {
        return bySource;
    }

    @JsonProperty("by_type")
    public Map<String, Integer> getByRuleType() {
        return byRuleType;
    }

    @JsonProperty("by_severity")
    public Map<String, Integer> getBySeverity() {
        return bySeverity;
    }

    @Override
    public String toString() {
        return "AnomalySummary{total=" + total + ", byRuleType=" + byRuleType + ", bySeverity=" + bySeverity + '}';
    }
}
