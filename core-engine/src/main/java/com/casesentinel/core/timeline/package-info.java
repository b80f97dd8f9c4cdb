/**
 * Finding normalization and timeline assembly.
 *
 * <p>
 * {@link com.casesentinel.core.timeline.FindingNormalizer} converts
 * detections into findings, resolving timestamps with
 * {@link com.casesentinel.core.timeline.TimestampExtractor} and artifact
 * categories with
 * {@link com.casesentinel.core.timeline.ArtifactTypeResolver};
 * {@link com.casesentinel.core.timeline.TimelineBuilder} orders them.
 * </p>
 *
 * @since 1.0.0
 */
package com.casesentinel.core.timeline;
