package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Anomalies grouped by priority tier.
 *
 * <p>
 * Each bucket keeps detection order; nothing is re-sorted by magnitude, so the
 * first entries of a bucket are a stable "top N" preview.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "high_priority", "medium_priority", "low_priority" })
public final class AnomalyBuckets implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final AnomalyBuckets EMPTY = new AnomalyBuckets(List.of(), List.of(), List.of());

    private final List<Anomaly> highPriority;
    private final List<Anomaly> mediumPriority;
    private final List<Anomaly> lowPriority;

    @JsonCreator
    public AnomalyBuckets(@JsonProperty("high_priority") List<Anomaly> highPriority,
            @JsonProperty("medium_priority") List<Anomaly> mediumPriority,
            @JsonProperty("low_priority") List<Anomaly> lowPriority) {
        this.highPriority = highPriority != null ? List.copyOf(highPriority) : List.of();
        this.mediumPriority = mediumPriority != null ? List.copyOf(mediumPriority) : List.of();
        this.lowPriority = lowPriority != null ? List.copyOf(lowPriority) : List.of();
    }

    public static AnomalyBuckets empty() {
        return EMPTY;
    }

    /**
     * Distribute anomalies into buckets, keeping their relative order.
     *
     * @param anomalies anomalies in detection order
     * @return grouped anomalies
     */
    public static AnomalyBuckets of(List<Anomaly> anomalies) {
        List<Anomaly> high = new ArrayList<>();
        List<Anomaly> medium = new ArrayList<>();
        List<Anomaly> low = new ArrayList<>();
        for (Anomaly anomaly : anomalies) {
            switch (anomaly.getPriority()) {
                case HIGH -> high.add(anomaly);
                case MEDIUM -> medium.add(anomaly);
                case LOW -> low.add(anomaly);
            }
        }
        return new AnomalyBuckets(high, medium, low);
    }

    @JsonProperty("high_priority")
    public List<Anomaly> getHighPriority() {
        return highPriority;
    }

    @JsonProperty("medium_priority")
    public List<Anomaly> getMediumPriority() {
        return mediumPriority;
    }

    @JsonProperty("low_priority")
    public List<Anomaly> getLowPriority() {
        return lowPriority;
    }

    public List<Anomaly> get(Priority priority) {
        return switch (priority) {
            case HIGH -> highPriority;
            case MEDIUM -> mediumPriority;
            case LOW -> lowPriority;
        };
    }

    /**
     * @return every anomaly, high bucket first, each bucket in detection order
     */
    @JsonIgnore
    public List<Anomaly> all() {
        List<Anomaly> all = new ArrayList<>(size());
        all.addAll(highPriority);
        all.addAll(mediumPriority);
        all.addAll(lowPriority);
        return all;
    }

    @JsonIgnore
    public int size() {
        return highPriority.size() + mediumPriority.size() + lowPriority.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyBuckets that))
            return false;
        return highPriority.equals(that.highPriority)
                && mediumPriority.equals(that.mediumPriority)
                && lowPriority.equals(that.lowPriority);
    }

    @Override
    public int hashCode() {
        return Objects.hash(highPriority, mediumPriority, lowPriority);
    }

    @Override
    public String toString() {
        return "AnomalyBuckets{high=" + highPriority.size()
                + ", medium=" + mediumPriority.size()
                + ", low=" + lowPriority.size() + '}';
    }
}
