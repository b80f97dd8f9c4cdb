package com.casesentinel.core.detection;

import com.casesentinel.core.model.AnomalyRuleType;
import com.casesentinel.core.model.Severity;

import java.util.List;
import java.util.Locale;

/**
 * Literal substring rule, used for executable extensions and suspicious
 * keywords. Patterns are lowercased on construction.
 *
 * @since 1.0.0
 */
public class SubstringRule extends PatternRule {

    private final String[] needles;

    public SubstringRule(AnomalyRuleType type, Severity severity, List<String> patterns,
            String descriptionFormat) {
        super(type, severity, lowercase(patterns), descriptionFormat);
        this.needles = getPatterns().toArray(new String[0]);
    }

    @Override
    protected boolean matches(String foldedText, int patternIndex) {
        return foldedText.contains(needles[patternIndex]);
    }

    private static List<String> lowercase(List<String> patterns) {
        return patterns.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
    }
}
