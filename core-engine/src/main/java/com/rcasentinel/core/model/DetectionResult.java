package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Output of one {@link com.rcasentinel.core.detection.AnomalyDetector} pass.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "anomalies", "detection_timestamp", "metrics_summary" })
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AnomalyBuckets anomalies;
    private final Instant detectionTimestamp;
    private final MetricsSummary metricsSummary;

    @JsonCreator
    public DetectionResult(@JsonProperty("anomalies") AnomalyBuckets anomalies,
            @JsonProperty("detection_timestamp") Instant detectionTimestamp,
            @JsonProperty("metrics_summary") MetricsSummary metricsSummary) {
        this.anomalies = anomalies != null ? anomalies : AnomalyBuckets.empty();
        this.detectionTimestamp = Objects.requireNonNull(detectionTimestamp,
                "detectionTimestamp must not be null");
        this.metricsSummary = Objects.requireNonNull(metricsSummary, "metricsSummary must not be null");
    }

    @JsonProperty("anomalies")
    public AnomalyBuckets getAnomalies() {
        return anomalies;
    }

    @JsonProperty("detection_timestamp")
    public Instant getDetectionTimestamp() {
        return detectionTimestamp;
    }

    @JsonProperty("metrics_summary")
    public MetricsSummary getMetricsSummary() {
        return metricsSummary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return anomalies.equals(that.anomalies)
                && detectionTimestamp.equals(that.detectionTimestamp)
                && metricsSummary.equals(that.metricsSummary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalies, detectionTimestamp, metricsSummary);
    }

    @Override
    public String toString() {
        return "DetectionResult{anomalies=" + anomalies
                + ", detectionTimestamp=" + detectionTimestamp
                + ", metricsSummary=" + metricsSummary + '}';
    }
}
