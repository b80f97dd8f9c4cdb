/**
 * Command-line analysis run: CSV ingestion, indicator and threat loading,
 * correlation and report writing.
 *
 * @since 1.0.0
 */
package com.casesentinel.cli;
