package com.casesentinel.core.detection;

import com.casesentinel.core.config.PatternsConfig;
import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.Dataset;
import com.casesentinel.core.model.FoldedDataset;
import com.casesentinel.core.model.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scans datasets for fixed heuristic suspicion patterns.
 *
 * <p>
 * Every rule runs over every dataset; rules are evaluated in list order and
 * each contributes its hits independently, so a single cell can produce
 * several anomalies. Results are deterministic for an unmodified dataset.
 * </p>
 *
 * <h3>Failure semantics</h3>
 * <p>
 * A dataset without textual columns yields no anomalies. During
 * {@link #detectAll(RecordStore)}, an unexpected failure on one source is
 * logged and that source is skipped; the sweep continues.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleBasedAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RuleBasedAnomalyDetector.class);

    private final List<AnomalyRule> rules;

    /**
     * @param rules rules in evaluation order; must not be {@code null}
     */
    public RuleBasedAnomalyDetector(List<AnomalyRule> rules) {
        Objects.requireNonNull(rules, "Anomaly rules must not be null");
        this.rules = List.copyOf(rules);
    }

    /**
     * @param config validated pattern tables
     * @return a detector running the three standard rule families
     */
    public static RuleBasedAnomalyDetector fromConfig(PatternsConfig config) {
        return new RuleBasedAnomalyDetector(AnomalyRules.fromConfig(config));
    }

    /**
     * Detect anomalies in one dataset.
     *
     * @param dataset the dataset; must not be {@code null}
     * @param source  its source name; must not be {@code null}
     * @return all anomalies, possibly empty
     */
    public List<Anomaly> detect(Dataset dataset, String source) {
        return detect(new FoldedDataset(dataset), source);
    }

    List<Anomaly> detect(FoldedDataset folded, String source) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (AnomalyRule rule : rules) {
            anomalies.addAll(rule.scan(folded, source));
        }
        return anomalies;
    }

    /**
     * Detect anomalies in every dataset, in store order.
     *
     * @param store the record store; must not be {@code null}
     * @return per-source and flat anomaly lists
     */
    public DetectionResult detectAll(RecordStore store) {
        Objects.requireNonNull(store, "RecordStore must not be null");
        LOG.info("Scanning {} data source(s) for suspicious patterns", store.size());

        Map<String, List<Anomaly>> bySource = new LinkedHashMap<>();
        for (Map.Entry<String, Dataset> entry : store.getDatasets().entrySet()) {
            String source = entry.getKey();
            try {
                List<Anomaly> anomalies = detect(entry.getValue(), source);
                bySource.put(source, anomalies);
                if (anomalies.isEmpty()) {
                    LOG.info("  {}: no pattern-based anomalies", source);
                } else {
                    LOG.info("  {}: {} pattern-based anomal(ies)", source, anomalies.size());
                }
            } catch (RuntimeException e) {
                LOG.error("Anomaly detection failed for source [{}] – continuing with next source", source, e);
            }
        }

        DetectionResult result = new DetectionResult(bySource);
        LOG.info("Total pattern-based anomalies detected: {}", result.total());
        return result;
    }

    public List<AnomalyRule> getRules() {
        return rules;
    }
}
