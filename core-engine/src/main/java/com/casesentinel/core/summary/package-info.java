/**
 * Count aggregates over matches and anomalies for reporting.
 *
 * @since 1.0.0
 */
package com.casesentinel.core.summary;
