/**
 * Domain model classes for Case Sentinel.
 *
 * <p>
 * Input side: {@link com.casesentinel.core.model.RecordStore} holds one
 * {@link com.casesentinel.core.model.Dataset} per ingested source, made of
 * {@link com.casesentinel.core.model.Row}s of typed
 * {@link com.casesentinel.core.model.CellValue}s.
 * </p>
 * <p>
 * Output side: detections ({@link com.casesentinel.core.model.Match},
 * {@link com.casesentinel.core.model.Anomaly}, external
 * {@link com.casesentinel.core.model.Threat}) are normalized into
 * {@link com.casesentinel.core.model.Finding}s and ordered into a
 * {@link com.casesentinel.core.model.Timeline}.
 * </p>
 *
 * @since 1.0.0
 */
package com.casesentinel.core.model;
