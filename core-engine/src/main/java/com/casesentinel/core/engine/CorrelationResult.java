package com.casesentinel.core.engine;

import com.casesentinel.core.detection.DetectionResult;
import com.casesentinel.core.matching.MatchResult;
import com.casesentinel.core.model.Threat;
import com.casesentinel.core.model.Timeline;
import com.casesentinel.core.summary.AnomalySummary;
import com.casesentinel.core.summary.MatchSummary;

import java.util.List;
import java.util.Objects;

/**
 * Everything one correlation pass produced.
 *
 * @since 1.0.0
 */
public final class CorrelationResult {

    private final DetectionResult detection;
    private final MatchResult matches;
    private final List<Threat> threats;
    private final Timeline timeline;
    private final MatchSummary matchSummary;
    private final AnomalySummary anomalySummary;

    CorrelationResult(DetectionResult detection, MatchResult matches, List<Threat> threats, Timeline timeline) {
        this.detection = Objects.requireNonNull(detection, "DetectionResult must not be null");
        this.matches = Objects.requireNonNull(matches, "MatchResult must not be null");
        this.threats = List.copyOf(threats);
        this.timeline = Objects.requireNonNull(timeline, "Timeline must not be null");
        this.matchSummary = MatchSummary.of(matches.getAll());
        this.anomalySummary = AnomalySummary.of(detection.getAll());
    }

    public DetectionResult getDetection() {
        return detection;
    }

    public MatchResult getMatches() {
        return matches;
    }

    public List<Threat> getThreats() {
        return threats;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    public MatchSummary getMatchSummary() {
        return matchSummary;
    }

    public AnomalySummary getAnomalySummary() {
        return anomalySummary;
    }

    @Override
    public String toString() {
        return "CorrelationResult{anomalies=" + detection.total()
                + ", matches=" + matches.total()
                + ", threats=" + threats.size()
                + ", timeline=" + timeline.size() + '}';
    }
}
