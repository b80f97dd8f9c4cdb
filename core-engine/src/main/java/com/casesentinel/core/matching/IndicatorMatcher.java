package com.casesentinel.core.matching;

import com.casesentinel.core.model.Dataset;
import com.casesentinel.core.model.FoldedDataset;
import com.casesentinel.core.model.IndicatorKind;
import com.casesentinel.core.model.Match;
import com.casesentinel.core.model.MatchKind;
import com.casesentinel.core.model.RecordStore;
import com.casesentinel.core.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Searches datasets for indicators of compromise.
 *
 * <h3>Matching</h3>
 * <p>
 * Indicators and cells are compared after trimming the indicator and
 * case-folding both sides. A cell is an <em>exact</em> match when its text
 * equals the indicator; this applies to every non-null cell, numeric ones
 * included. A text cell is a <em>partial</em> match when it contains the
 * indicator as a literal substring. Each (indicator, column, row) yields at
 * most one {@link Match}; exact wins over partial.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Sources in store order, then indicators in list order, then columns,
 * then rows.
 * </p>
 *
 * <h3>Cost</h3>
 * <p>
 * O(indicators × columns × rows). Each dataset is case-folded once per call,
 * and indicators are normalized and classified once per call, not once per
 * dataset.
 * </p>
 *
 * @since 1.0.0
 */
public class IndicatorMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorMatcher.class);

    private final IndicatorClassifier classifier;

    /**
     * @param classifier classifier used to tag every match; must not be
     *                   {@code null}
     */
    public IndicatorMatcher(IndicatorClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "IndicatorClassifier must not be null");
    }

    /**
     * Search one dataset.
     *
     * @param dataset    the dataset; must not be {@code null}
     * @param source     its source name; must not be {@code null}
     * @param indicators raw indicators; blanks and case-insensitive
     *                   duplicates are ignored
     * @return all matches, possibly empty
     */
    public List<Match> search(Dataset dataset, String source, List<String> indicators) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        Objects.requireNonNull(source, "Source name must not be null");
        return search(new FoldedDataset(dataset), source, prepare(indicators));
    }

    /**
     * Search every dataset in store order.
     *
     * @param store      the record store; must not be {@code null}
     * @param indicators raw indicators
     * @return per-source and flat match lists
     */
    public MatchResult searchAll(RecordStore store, List<String> indicators) {
        Objects.requireNonNull(store, "RecordStore must not be null");
        List<PreparedIndicator> prepared = prepare(indicators);
        LOG.info("Searching for {} IOC(s) across {} data source(s)", prepared.size(), store.size());

        Map<String, List<Match>> bySource = new LinkedHashMap<>();
        for (Map.Entry<String, Dataset> entry : store.getDatasets().entrySet()) {
            String source = entry.getKey();
            try {
                List<Match> matches = search(new FoldedDataset(entry.getValue()), source, prepared);
                bySource.put(source, matches);
                if (matches.isEmpty()) {
                    LOG.info("  {}: no matches", source);
                } else {
                    LOG.info("  {}: {} match(es)", source, matches.size());
                }
            } catch (RuntimeException e) {
                LOG.error("IOC search failed for source [{}] – continuing with next source", source, e);
            }
        }

        MatchResult result = new MatchResult(bySource);
        LOG.info("Total matches found: {}", result.total());
        return result;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Match> search(FoldedDataset data, String source, List<PreparedIndicator> indicators) {
        List<Match> matches = new ArrayList<>();
        if (indicators.isEmpty() || data.size() == 0) {
            return matches;
        }
        Dataset dataset = data.getDataset();

        for (PreparedIndicator indicator : indicators) {
            for (String column : data.getColumns()) {
                for (int row = 0; row < data.size(); row++) {
                    String cell = data.folded(column, row);
                    if (cell == null) {
                        continue;
                    }
                    boolean exact = cell.equals(indicator.normalized);
                    boolean partial = !exact && data.isText(column, row) && cell.contains(indicator.normalized);
                    if (!exact && !partial) {
                        continue;
                    }
                    Row fullRow = dataset.getRows().get(row);
                    matches.add(Match.builder()
                            .source(source)
                            .indicator(indicator.raw)
                            .indicatorKind(indicator.kind)
                            .matchKind(exact ? MatchKind.EXACT : MatchKind.PARTIAL)
                            .column(column)
                            .rowIndex(row)
                            .matchedValue(fullRow.text(column).orElse(""))
                            .fullRow(fullRow)
                            .build());
                }
            }
        }
        return matches;
    }

    private List<PreparedIndicator> prepare(List<String> indicators) {
        List<PreparedIndicator> prepared = new ArrayList<>();
        if (indicators == null) {
            return prepared;
        }
        Set<String> seen = new HashSet<>();
        for (String raw : indicators) {
            String normalized = Indicators.normalize(raw);
            if (normalized.isEmpty() || !seen.add(normalized)) {
                continue;
            }
            prepared.add(new PreparedIndicator(raw.trim(), normalized, classifier.classify(raw)));
        }
        return prepared;
    }

    /** An indicator normalized and classified once per search. */
    private static final class PreparedIndicator {
        private final String raw;
        private final String normalized;
        private final IndicatorKind kind;

        private PreparedIndicator(String raw, String normalized, IndicatorKind kind) {
            this.raw = raw;
            this.normalized = normalized;
            this.kind = kind;
        }
    }
}
