package com.rcasentinel.core.model;

/**
 * Semantic class of a metric series. Decides which threshold applies and in
 * which direction a deviation is adverse.
 *
 * @since 1.0.0
 */
public enum MetricKind {

    /** Response time / duration in milliseconds. Higher is worse. */
    LATENCY(AnomalyKind.LATENCY_SPIKE, true),

    /** Share of failed calls in percent. Higher is worse. */
    ERROR_RATE(AnomalyKind.ERROR_RATE_SPIKE, true),

    /** Calls per minute. Lower is worse. */
    THROUGHPUT(AnomalyKind.THROUGHPUT_DROP, false),

    /** Share of successful calls (SLA) in percent. Lower is worse. */
    SUCCESS_RATIO(AnomalyKind.SLA_DROP, false);

    private final AnomalyKind anomalyKind;
    private final boolean higherIsWorse;

    MetricKind(AnomalyKind anomalyKind, boolean higherIsWorse) {
        this.anomalyKind = anomalyKind;
        this.higherIsWorse = higherIsWorse;
    }

    /**
     * @return the anomaly kind reported when a rule fires on this metric kind
     */
    public AnomalyKind anomalyKind() {
        return anomalyKind;
    }

    public boolean higherIsWorse() {
        return higherIsWorse;
    }

    /**
     * @return {@code true} when values are percentages bounded by [0, 100]
     */
    public boolean isPercentage() {
        return this == ERROR_RATE || this == SUCCESS_RATIO;
    }
}
