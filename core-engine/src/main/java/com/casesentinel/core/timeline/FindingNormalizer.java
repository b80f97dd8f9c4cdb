package com.casesentinel.core.timeline;

import com.casesentinel.core.config.PatternsConfig;
import com.casesentinel.core.model.Anomaly;
import com.casesentinel.core.model.Dataset;
import com.casesentinel.core.model.Finding;
import com.casesentinel.core.model.Match;
import com.casesentinel.core.model.Row;
import com.casesentinel.core.model.Threat;
import com.casesentinel.core.model.ThreatLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Turns matches, anomalies and externally supplied threats into
 * {@link Finding}s.
 *
 * <h3>Row-derived fields</h3>
 * <p>
 * Timestamp, device name, account and event id come from the row the
 * detection points at. Device, account and event id each use an ordered
 * alias list; the first alias present with a non-null value wins. A row
 * index outside the dataset is logged and leaves all four fields absent.
 * </p>
 *
 * <h3>Levels</h3>
 * <p>
 * Matches and anomalies are always {@link ThreatLevel#SUSPICIOUS}; threats
 * follow {@link ThreatLevel#fromSeverity}.
 * </p>
 *
 * <p>
 * The analyst is not set here; {@link TimelineBuilder} stamps it.
 * </p>
 *
 * @since 1.0.0
 */
public class FindingNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(FindingNormalizer.class);

    static final String UNKNOWN_THREAT = "Unknown threat";
    static final String UNKNOWN_SOURCE = "unknown";

    private final TimestampExtractor timestamps;
    private final ArtifactTypeResolver artifacts;
    private final List<String> deviceColumns;
    private final List<String> accountColumns;
    private final List<String> eventIdColumns;

    public FindingNormalizer(PatternsConfig config) {
        this(config, ZoneOffset.UTC);
    }

    /**
     * @param config pattern tables supplying column aliases and artifact
     *               rules; must not be {@code null}
     * @param zone   zone epoch timestamps are rendered in
     */
    public FindingNormalizer(PatternsConfig config, ZoneId zone) {
        Objects.requireNonNull(config, "PatternsConfig must not be null");
        this.timestamps = TimestampExtractor.fromConfig(config, zone);
        this.artifacts = ArtifactTypeResolver.fromConfig(config);
        this.deviceColumns = config.getDeviceColumns();
        this.accountColumns = config.getAccountColumns();
        this.eventIdColumns = config.getEventIdColumns();
    }

    // ---------------------------------------------------------------
    // Conversions
    // ---------------------------------------------------------------

    /**
     * @param match   the match; must not be {@code null}
     * @param dataset the dataset the match was found in; must not be
     *                {@code null}
     */
    public Finding fromMatch(Match match, Dataset dataset) {
        Objects.requireNonNull(match, "Match must not be null");
        Objects.requireNonNull(dataset, "Dataset must not be null");

        Row row = rowAt(dataset, match.getRowIndex(), match.getSource());
        Finding.Builder builder = Finding.builder()
                .event(String.format("IOC Match: %s found in %s: %s",
                        match.getIndicator(), match.getColumn(), match.getMatchedValue()))
                .artifact(artifacts.resolve(match.getSource(), dataset.getColumns()))
                .comments(String.format("Matched IOC (%s) in %s",
                        match.getIndicatorKind().wireName(), match.getColumn()))
                .level(ThreatLevel.SUSPICIOUS);
        return withRowFields(builder, match.getMatchedValue(), row).build();
    }

    /**
     * @param anomaly the anomaly; must not be {@code null}
     * @param dataset the dataset the anomaly was found in; must not be
     *                {@code null}
     */
    public Finding fromAnomaly(Anomaly anomaly, Dataset dataset) {
        Objects.requireNonNull(anomaly, "Anomaly must not be null");
        Objects.requireNonNull(dataset, "Dataset must not be null");

        Row row = rowAt(dataset, anomaly.getRowIndex(), anomaly.getSource());
        // the anomaly keeps folded text; timestamps are read from the original cell
        String direct = row != null ? row.text(anomaly.getColumn()).orElse(null) : null;
        Finding.Builder builder = Finding.builder()
                .event(anomaly.getDescription())
                .artifact(artifacts.resolve(anomaly.getSource(), dataset.getColumns()))
                .comments(String.format("Detected %s pattern in %s",
                        anomaly.getRuleType().wireName(), anomaly.getColumn()))
                .level(ThreatLevel.SUSPICIOUS);
        return withRowFields(builder, direct, row).build();
    }

    /**
     * @param threat  the threat; must not be {@code null}
     * @param dataset the threat's source dataset, or {@code null} when the
     *                source is not a loaded dataset
     */
    public Finding fromThreat(Threat threat, Dataset dataset) {
        Objects.requireNonNull(threat, "Threat must not be null");

        String source = threat.getSource() != null ? threat.getSource() : UNKNOWN_SOURCE;
        Finding.Builder builder = Finding.builder()
                .event(threatEvent(threat))
                .artifact(dataset != null ? artifacts.resolve(source, dataset.getColumns()) : source)
                .comments(threatComments(threat))
                .level(ThreatLevel.fromSeverity(threat.getSeverity()));

        if (dataset != null && threat.getRowIndex() != null) {
            withRowFields(builder, null, rowAt(dataset, threat.getRowIndex(), source));
        }
        return builder.build();
    }

    public TimestampExtractor getTimestampExtractor() {
        return timestamps;
    }

    public ArtifactTypeResolver getArtifactTypeResolver() {
        return artifacts;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Finding.Builder withRowFields(Finding.Builder builder, String directValue, Row row) {
        builder.timestamp(timestamps.resolve(directValue, row).orElse(null));
        if (row != null) {
            builder.deviceName(row.firstPresent(deviceColumns).orElse(null))
                    .account(row.firstPresent(accountColumns).orElse(null))
                    .eventId(row.firstPresent(eventIdColumns).orElse(null));
        }
        return builder;
    }

    private static Row rowAt(Dataset dataset, int index, String source) {
        Row row = dataset.row(index).orElse(null);
        if (row == null) {
            LOG.warn("Row index {} is outside source [{}] ({} rows) – row-derived fields left empty",
                    index, source, dataset.size());
        }
        return row;
    }

    private static String threatEvent(Threat threat) {
        if (threat.getDescription() != null && !threat.getDescription().isBlank()) {
            return threat.getDescription();
        }
        if (threat.getType() != null && !threat.getType().isBlank()) {
            return threat.getType();
        }
        return UNKNOWN_THREAT;
    }

    private static String threatComments(Threat threat) {
        String comments = threat.getRecommendation() != null ? threat.getRecommendation() : "";
        if (!threat.getIndicators().isEmpty()) {
            comments += " Indicators: " + String.join(", ", threat.getIndicators());
        }
        return comments;
    }
}
