package com.casesentinel.core.timeline;

import com.casesentinel.core.config.ArtifactTypeRule;
import com.casesentinel.core.config.PatternsConfig;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Infers a human-readable artifact category from a source name and its
 * columns. The first matching rule wins; when none matches, the source name
 * is returned unchanged.
 *
 * @since 1.0.0
 */
public class ArtifactTypeResolver {

    private final List<ArtifactTypeRule> rules;

    public ArtifactTypeResolver(List<ArtifactTypeRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Artifact rules must not be null"));
    }

    public static ArtifactTypeResolver fromConfig(PatternsConfig config) {
        Objects.requireNonNull(config, "PatternsConfig must not be null");
        return new ArtifactTypeResolver(config.getArtifactTypes());
    }

    /**
     * @param source  source name; must not be {@code null}
     * @param columns column names of the source, possibly empty
     * @return the artifact label
     */
    public String resolve(String source, Collection<String> columns) {
        Objects.requireNonNull(source, "Source name must not be null");
        String sourceLower = source.toLowerCase(Locale.ROOT);
        String columnsLower = columns == null ? "" : String.join(" ", columns).toLowerCase(Locale.ROOT);
        for (ArtifactTypeRule rule : rules) {
            if (rule.matches(sourceLower, columnsLower)) {
                return rule.getLabel();
            }
        }
        return source;
    }

    public List<ArtifactTypeRule> getRules() {
        return rules;
    }
}
