package com.casesentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the ordered artifact-type table.
 *
 * <p>
 * The rule applies when every keyword is a substring of the lowercased
 * source name. With {@code matchColumns} set, the joined column names are
 * searched as well.
 * </p>
 *
 * <pre>
 * artifactTypes:
 *   - label: Amcache
 *     keywords: [amcache]
 *     matchColumns: true
 * </pre>
 *
 * @since 1.0.0
 */
public class ArtifactTypeRule {

    /** Human-readable artifact category, e.g. {@code Prefetch}. */
    private String label;

    /** Substrings that must all be present. */
    private List<String> keywords = new ArrayList<>();

    /** Whether column names count as evidence too. */
    private boolean matchColumns;

    /** No-arg constructor required by SnakeYAML. */
    public ArtifactTypeRule() {
    }

    public ArtifactTypeRule(String label, List<String> keywords, boolean matchColumns) {
        this.label = label;
        setKeywords(keywords);
        this.matchColumns = matchColumns;
    }

    /**
     * @param source        lowercased source name
     * @param joinedColumns lowercased column names joined by spaces
     * @return {@code true} if this rule identifies the source
     */
    public boolean matches(String source, String joinedColumns) {
        if (keywords.isEmpty()) {
            return false;
        }
        if (containsAll(source)) {
            return true;
        }
        return matchColumns && containsAll(joinedColumns);
    }

    private boolean containsAll(String haystack) {
        for (String keyword : keywords) {
            if (!haystack.contains(keyword)) {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public List<String> getKeywords() {
        return Collections.unmodifiableList(keywords);
    }

    /**
     * Set the keywords, normalised to lowercase.
     *
     * @param keywords keyword list
     */
    public void setKeywords(List<String> keywords) {
        this.keywords = new ArrayList<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                this.keywords.add(keyword != null ? keyword.toLowerCase(Locale.ROOT) : null);
            }
        }
    }

    public boolean isMatchColumns() {
        return matchColumns;
    }

    public void setMatchColumns(boolean matchColumns) {
        this.matchColumns = matchColumns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ArtifactTypeRule that))
            return false;
        return matchColumns == that.matchColumns
                && Objects.equals(label, that.label)
                && Objects.equals(keywords, that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, keywords, matchColumns);
    }

    @Override
    public String toString() {
        return "ArtifactTypeRule{label='" + label + "', keywords=" + keywords
                + ", matchColumns=" + matchColumns + '}';
    }
}
