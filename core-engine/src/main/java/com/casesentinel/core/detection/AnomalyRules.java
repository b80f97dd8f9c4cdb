package com.casesentinel.core.detection;

import com.casesentinel.core.config.PatternsConfig;
import com.casesentinel.core.model.AnomalyRuleType;
import com.casesentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyRule} instances from pattern tables.
 *
 * <p>
 * This is the single point of extension when adding new rule families:
 * register the new type here and create the corresponding rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRules {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyRules.class);

    private AnomalyRules() {
        // utility class — not instantiable
    }

    /**
     * Create the rule for one family.
     *
     * @param type     the rule family; must not be {@code null}
     * @param patterns the family's patterns; must not be {@code null}
     * @return the rule, with the family's fixed severity
     * @throws IllegalArgumentException if a path pattern does not compile
     */
    public static AnomalyRule create(AnomalyRuleType type, List<String> patterns) {
        Objects.requireNonNull(type, "Rule type must not be null");
        Objects.requireNonNull(patterns, "Patterns must not be null");
        return switch (type) {
            case SUSPICIOUS_EXTENSION -> new SubstringRule(type, Severity.MEDIUM, patterns,
                    "Found suspicious extension %s in %s");
            case SUSPICIOUS_KEYWORD -> new SubstringRule(type, Severity.HIGH, patterns,
                    "Found suspicious keyword '%s' in %s");
            case SUSPICIOUS_PATH -> new RegexRule(type, Severity.MEDIUM, patterns,
                    "Found suspicious path pattern '%s' in %s");
        };
    }

    /**
     * Create a rule from its wire name, e.g. {@code suspicious_keyword}.
     *
     * @param type     rule family name
     * @param patterns the family's patterns
     * @return the rule
     * @throws IllegalArgumentException if the type is unknown
     */
    public static AnomalyRule create(String type, List<String> patterns) {
        return create(AnomalyRuleType.fromWireName(type), patterns);
    }

    /**
     * Create the three families in evaluation order: extensions, keywords,
     * paths.
     *
     * @param config validated pattern tables; must not be {@code null}
     * @return unmodifiable list of rules
     */
    public static List<AnomalyRule> fromConfig(PatternsConfig config) {
        Objects.requireNonNull(config, "PatternsConfig must not be null");
        List<AnomalyRule> rules = List.of(
                create(AnomalyRuleType.SUSPICIOUS_EXTENSION, config.getExecutableExtensions()),
                create(AnomalyRuleType.SUSPICIOUS_KEYWORD, config.getSuspiciousKeywords()),
                create(AnomalyRuleType.SUSPICIOUS_PATH, config.getSuspiciousPaths()));
        LOG.info("Created {} anomaly rule famil(ies) from configuration", rules.size());
        return rules;
    }
}
