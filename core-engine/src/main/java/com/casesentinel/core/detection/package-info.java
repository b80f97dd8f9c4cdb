/**
 * Rule-based suspicion detection over ingested datasets.
 *
 * <p>
 * All rules implement {@link com.casesentinel.core.detection.AnomalyRule}
 * and are created via {@link com.casesentinel.core.detection.AnomalyRules}.
 * Built-in rule families:
 * </p>
 * <ul>
 * <li>{@code suspicious_extension} — executable extension substrings
 * (medium)</li>
 * <li>{@code suspicious_keyword} — malware-related keyword substrings
 * (high)</li>
 * <li>{@code suspicious_path} — path fragment regular expressions
 * (medium)</li>
 * </ul>
 * <p>
 * {@link com.casesentinel.core.detection.RuleBasedAnomalyDetector} runs the
 * families over one dataset or a whole record store.
 * </p>
 *
 * @since 1.0.0
 */
package com.casesentinel.core.detection;
