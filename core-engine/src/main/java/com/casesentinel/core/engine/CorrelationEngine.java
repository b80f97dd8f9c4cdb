package com.casesentinel.core.engine;

import com.casesentinel.core.config.PatternsConfig;
import com.casesentinel.core.detection.DetectionResult;
import com.casesentinel.core.detection.RuleBasedAnomalyDetector;
import com.casesentinel.core.matching.IndicatorClassifier;
import com.casesentinel.core.matching.IndicatorMatcher;
import com.casesentinel.core.matching.MatchResult;
import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.Match;
import com.casesentinel.core.model.RecordStore;
import com.casesentinel.core.model.Threat;
import com.casesentinel.core.model.Timeline;
import com.casesentinel.core.timeline.FindingNormalizer;
import com.casesentinel.core.timeline.TimelineBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Runs anomaly detection and indicator matching over a record store and
 * assembles the resulting timeline.
 *
 * <h3>Pass</h3>
 * <ol>
 * <li>Detect anomalies in every source, in store order.</li>
 * <li>Match indicators in every source, in store order.</li>
 * <li>Feed matches, then anomalies, then threats into a fresh
 * {@link TimelineBuilder} and build it.</li>
 * </ol>
 * <p>
 * Synchronous and single-threaded. The record store is only read. Each call
 * uses its own timeline builder, so one engine may be reused.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    private final RuleBasedAnomalyDetector detector;
    private final IndicatorMatcher matcher;
    private final FindingNormalizer normalizer;
    private final String analyst;

    public CorrelationEngine(RuleBasedAnomalyDetector detector, IndicatorMatcher matcher,
                             FindingNormalizer normalizer, String analyst) {
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
        this.matcher = Objects.requireNonNull(matcher, "Matcher must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "FindingNormalizer must not be null");
        this.analyst = analyst != null ? analyst : "";
    }

    /**
     * Wire every component from one pattern configuration, rendering epoch
     * timestamps in UTC.
     */
    public static CorrelationEngine fromConfig(PatternsConfig config, String analyst) {
        return fromConfig(config, analyst, ZoneOffset.UTC);
    }

    public static CorrelationEngine fromConfig(PatternsConfig config, String analyst, ZoneId zone) {
        Objects.requireNonNull(config, "PatternsConfig must not be null");
        return new CorrelationEngine(
                RuleBasedAnomalyDetector.fromConfig(config),
                new IndicatorMatcher(IndicatorClassifier.fromConfig(config)),
                new FindingNormalizer(config, zone),
                analyst);
    }

    /**
     * @param store      loaded datasets; must not be {@code null}
     * @param indicators indicators to search for; may be empty
     * @param threats    externally supplied threats; may be empty
     * @return the correlation result
     */
    public CorrelationResult correlate(RecordStore store, List<String> indicators, List<Threat> threats) {
        Objects.requireNonNull(store, "RecordStore must not be null");
        List<String> iocs = indicators != null ? indicators : List.of();
        List<Threat> external = threats != null ? threats : List.of();

        LOG.info("Correlating {} source(s) with {} indicator(s) and {} threat(s)",
                store.size(), iocs.size(), external.size());

        DetectionResult detection = detector.detectAll(store);
        MatchResult matches = matcher.searchAll(store, iocs);

        TimelineBuilder timeline = new TimelineBuilder(analyst, normalizer);
        for (Match match : matches.getAll()) {
            store.get(match.getSource()).ifPresent(dataset -> timeline.addMatch(match, dataset));
        }
        for (Anomaly anomaly : detection.getAll()) {
            store.get(anomaly.getSource()).ifPresent(dataset -> timeline.addAnomaly(anomaly, dataset));
        }
        for (Threat threat : external) {
            timeline.addThreat(threat, threat.getSource() != null ? store.get(threat.getSource()).orElse(null) : null);
        }
        Timeline built = timeline.build();

        CorrelationResult result = new CorrelationResult(detection, matches, external, built);
        LOG.info("Correlation complete: {}", result);
        return result;
    }

    public RuleBasedAnomalyDetector getDetector() {
        return detector;
    }

    public IndicatorMatcher getMatcher() {
        return matcher;
    }

    public FindingNormalizer getNormalizer() {
        return normalizer;
    }
}
