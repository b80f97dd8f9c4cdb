package com.casesentinel.core.detection;

import com.casesentinel.core.model.AnomalyRuleType;
import com.casesentinel.core.model.Severity;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Regular-expression rule, used for suspicious path fragments. A pattern
 * matches when it is found anywhere in the lowercased cell text.
 *
 * @since 1.0.0
 */
public class RegexRule extends PatternRule {

    private final Pattern[] compiled;

    /**
     * @throws java.util.regex.PatternSyntaxException if a pattern does not
     *                                                compile
     */
    public RegexRule(AnomalyRuleType type, Severity severity, List<String> patterns,
            String descriptionFormat) {
        super(type, severity, patterns, descriptionFormat);
        this.compiled = getPatterns().stream()
                .map(Pattern::compile)
                .toArray(Pattern[]::new);
    }

    @Override
    protected boolean matches(String foldedText, int patternIndex) {
        return compiled[patternIndex].matcher(foldedText).find();
    }
}
