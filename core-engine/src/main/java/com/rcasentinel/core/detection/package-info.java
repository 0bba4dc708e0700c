/**
 * Anomaly detection over per-service metric series.
 *
 * <p>
 * {@link com.rcasentinel.core.detection.AnomalyDetector} splits each series
 * into a baseline and a recent window and runs the configured
 * {@link com.rcasentinel.core.detection.MetricCheck}s:
 * </p>
 * <ul>
 * <li>{@link com.rcasentinel.core.detection.ThresholdCheck} for absolute
 * bounds</li>
 * <li>{@link com.rcasentinel.core.detection.ZScoreCheck} for statistical
 * deviation from the baseline</li>
 * <li>{@link com.rcasentinel.core.detection.VariabilityCheck} for unstable
 * throughput</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.detection;
