/**
 * Configuration loading and validation for the detection pattern tables.
 *
 * <p>
 * Tables are defined in YAML and loaded by
 * {@link com.casesentinel.core.config.PatternsLoader} into a
 * {@link com.casesentinel.core.config.PatternsConfig} instance. Validation
 * runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.casesentinel.core.config;
