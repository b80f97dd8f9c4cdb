/**
 * Indicator-of-compromise matching.
 *
 * <p>
 * {@link com.casesentinel.core.matching.IndicatorClassifier} tags each
 * indicator with its kind,
 * {@link com.casesentinel.core.matching.IndicatorMatcher} finds exact and
 * partial occurrences across datasets, and
 * {@link com.casesentinel.core.matching.Indicators} assembles indicator lists
 * from pasted text and intelligence feeds.
 * </p>
 *
 * @since 1.0.0
 */
package com.casesentinel.core.matching;
