package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Anomaly emitted by the detector for one (service, metric) pair.
 *
 * <p>
 * Instances are immutable and created once per detection pass.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code service}, {@code metric}, {@code kind} and
 * {@code priority} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = Anomaly.Builder.class)
@JsonPropertyOrder({ "service", "metric", "kind", "priority", "observed_value", "threshold",
        "deviation", "z_score", "observed_at", "description" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Graph node id of the owning service. */
    private final String service;

    /** Name of the metric series that triggered the anomaly. */
    private final String metric;

    private final AnomalyKind kind;
    private final Priority priority;

    /** Mean of the recent window of the series. */
    private final double observedValue;

    /** Threshold the observed value was compared against, if a threshold rule fired. */
    private final Double threshold;

    /**
     * Deviation magnitude: the z-score when the statistical rule produced one,
     * otherwise the relative excess over the threshold.
     */
    private final double deviation;

    private final Double zScore;

    /** Time of the latest sample in the recent window; used for correlation. */
    private final Instant observedAt;

    private final String description;

    private Anomaly(Builder builder) {
        this.service = Objects.requireNonNull(builder.service, "service must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.priority = Objects.requireNonNull(builder.priority, "priority must not be null");
        this.observedValue = builder.observedValue;
        this.threshold = builder.threshold;
        this.deviation = builder.deviation;
        this.zScore = builder.zScore;
        this.observedAt = builder.observedAt;
        this.description = builder.description;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly}; also used by Jackson when reading
     * serialized detection results.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String service;
        private String metric;
        private AnomalyKind kind;
        private Priority priority;
        private double observedValue;
        private Double threshold;
        private double deviation;
        private Double zScore;
        private Instant observedAt;
        private String description;

        public Builder() {
        }

        @JsonProperty("service")
        public Builder service(String service) {
            this.service = service;
            return this;
        }

        @JsonProperty("metric")
        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        @JsonProperty("kind")
        public Builder kind(AnomalyKind kind) {
            this.kind = kind;
            return this;
        }

        @JsonProperty("priority")
        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        @JsonProperty("observed_value")
        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        @JsonProperty("threshold")
        public Builder threshold(Double threshold) {
            this.threshold = threshold;
            return this;
        }

        @JsonProperty("deviation")
        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        @JsonProperty("z_score")
        public Builder zScore(Double zScore) {
            this.zScore = zScore;
            return this;
        }

        @JsonProperty("observed_at")
        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        @JsonProperty("description")
        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException if a required field is missing
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("service")
    public String getService() {
        return service;
    }

    @JsonProperty("metric")
    public String getMetric() {
        return metric;
    }

    @JsonProperty("kind")
    public AnomalyKind getKind() {
        return kind;
    }

    @JsonProperty("priority")
    public Priority getPriority() {
        return priority;
    }

    @JsonProperty("observed_value")
    public double getObservedValue() {
        return observedValue;
    }

    @JsonProperty("threshold")
    public Double getThreshold() {
        return threshold;
    }

    @JsonProperty("deviation")
    public double getDeviation() {
        return deviation;
    }

    @JsonProperty("z_score")
    public Double getZScore() {
        return zScore;
    }

    @JsonProperty("observed_at")
    public Instant getObservedAt() {
        return observedAt;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Double.compare(observedValue, that.observedValue) == 0
                && Double.compare(deviation, that.deviation) == 0
                && service.equals(that.service)
                && metric.equals(that.metric)
                && kind == that.kind
                && priority == that.priority
                && Objects.equals(threshold, that.threshold)
                && Objects.equals(zScore, that.zScore)
                && Objects.equals(observedAt, that.observedAt)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, metric, kind, priority, observedValue, threshold,
                deviation, zScore, observedAt, description);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "service='" + service + '\'' +
                ", metric='" + metric + '\'' +
                ", kind=" + kind +
                ", priority=" + priority +
                ", observedValue=" + observedValue +
                ", deviation=" + deviation +
                '}';
    }
}
