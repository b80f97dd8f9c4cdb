/**
 * End-to-end correlation of a record store: anomaly detection, indicator
 * matching and timeline assembly in one synchronous pass.
 *
 * @since 1.0.0
 */
package com.casesentinel.core.engine;
