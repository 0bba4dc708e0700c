package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Downstream service that is reachable from a root-cause candidate and carries
 * anomalies of its own.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "service", "anomaly_count", "hop_distance" })
public final class AffectedService implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String service;
    private final int anomalyCount;
    private final int hopDistance;

    @JsonCreator
    public AffectedService(@JsonProperty("service") String service,
            @JsonProperty("anomaly_count") int anomalyCount,
            @JsonProperty("hop_distance") int hopDistance) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.anomalyCount = anomalyCount;
        this.hopDistance = hopDistance;
    }

    @JsonProperty("service")
    public String getService() {
        return service;
    }

    @JsonProperty("anomaly_count")
    public int getAnomalyCount() {
        return anomalyCount;
    }

    @JsonProperty("hop_distance")
    public int getHopDistance() {
        return hopDistance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AffectedService that))
            return false;
        return anomalyCount == that.anomalyCount
                && hopDistance == that.hopDistance
                && service.equals(that.service);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, anomalyCount, hopDistance);
    }

    @Override
    public String toString() {
        return service + "(anomalies=" + anomalyCount + ", hops=" + hopDistance + ')';
    }
}
