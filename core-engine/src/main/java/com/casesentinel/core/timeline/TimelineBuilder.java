package com.casesentinel.core.timeline;

import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.Dataset;
import com.casesentinel.core.model.Finding;
import com.casesentinel.core.model.Match;
import com.casesentinel.core.model.Threat;
import com.casesentinel.core.model.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates findings and produces the ordered {@link Timeline}.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * The builder is append-only until {@link #build()}, which may be called
 * once. Any add or build after that throws {@link IllegalStateException}.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Findings whose timestamp parses come first, sorted ascending with ties in
 * insertion order, and are rendered in canonical form. Findings without a
 * parseable timestamp follow in insertion order, unchanged. Duplicates are
 * kept.
 * </p>
 *
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class TimelineBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TimelineBuilder.class);

    private final String analyst;
    private final FindingNormalizer normalizer;
    private final List<Finding> findings = new ArrayList<>();
    private boolean built;

    /**
     * @param analyst    name stamped on every finding that has none
     * @param normalizer converts detections to findings
     */
    public TimelineBuilder(String analyst, FindingNormalizer normalizer) {
        this.analyst = analyst != null ? analyst : "";
        this.normalizer = Objects.requireNonNull(normalizer, "FindingNormalizer must not be null");
    }

    public TimelineBuilder addMatch(Match match, Dataset dataset) {
        return addFinding(normalizer.fromMatch(match, dataset));
    }

    public TimelineBuilder addAnomaly(Anomaly anomaly, Dataset dataset) {
        return addFinding(normalizer.fromAnomaly(anomaly, dataset));
    }

    /**
     * @param dataset the threat's source dataset, or {@code null}
     */
    public TimelineBuilder addThreat(Threat threat, Dataset dataset) {
        return addFinding(normalizer.fromThreat(threat, dataset));
    }

    /**
     * Append a finding as-is, stamping the analyst when it has none.
     */
    public TimelineBuilder addFinding(Finding finding) {
        Objects.requireNonNull(finding, "Finding must not be null");
        checkOpen();
        findings.add(finding.getAnalyst().isEmpty() ? finding.toBuilder().analyst(analyst).build() : finding);
        return this;
    }

    public int size() {
        return findings.size();
    }

    /**
     * Order the accumulated findings. Terminal.
     *
     * @return the timeline
     * @throws IllegalStateException if already built
     */
    public Timeline build() {
        checkOpen();
        built = true;

        TimestampExtractor timestamps = normalizer.getTimestampExtractor();
        List<Dated> dated = new ArrayList<>();
        List<Finding> undated = new ArrayList<>();
        for (Finding finding : findings) {
            Optional<LocalDateTime> at = finding.hasTimestamp()
                    ? timestamps.extractDateTime(finding.getTimestamp())
                    : Optional.empty();
            if (at.isPresent()) {
                dated.add(new Dated(at.get(), finding));
            } else {
                undated.add(finding);
            }
        }
        // List.sort is stable
        dated.sort(Comparator.comparing((Dated d) -> d.at));

        List<Finding> ordered = new ArrayList<>(findings.size());
        for (Dated d : dated) {
            ordered.add(d.finding.toBuilder().timestamp(TimestampExtractor.CANONICAL.format(d.at)).build());
        }
        ordered.addAll(undated);

        LOG.info("Timeline built: {} finding(s), {} dated, {} undated",
                ordered.size(), dated.size(), undated.size());
        return new Timeline(ordered);
    }

    private void checkOpen() {
        if (built) {
            throw new IllegalStateException("Timeline already built; create a new TimelineBuilder");
        }
    }

    private static final class Dated {
        private final LocalDateTime at;
        private final Finding finding;

        private Dated(LocalDateTime at, Finding finding) {
            this.at = at;
            this.finding = finding;
        }
    }
}
