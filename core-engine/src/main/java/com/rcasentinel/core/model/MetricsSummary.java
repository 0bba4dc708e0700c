package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Counters describing one detection pass.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "total_services", "services_with_anomalies", "total_anomalies" })
public final class MetricsSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int totalServices;
    private final int servicesWithAnomalies;
    private final int totalAnomalies;

    @JsonCreator
    public MetricsSummary(@JsonProperty("total_services") int totalServices,
            @JsonProperty("services_with_anomalies") int servicesWithAnomalies,
            @JsonProperty("total_anomalies") int totalAnomalies) {
        this.totalServices = totalServices;
        this.servicesWithAnomalies = servicesWithAnomalies;
        this.totalAnomalies = totalAnomalies;
    }

    @JsonProperty("total_services")
    public int getTotalServices() {
        return totalServices;
    }

    @JsonProperty("services_with_anomalies")
    public int getServicesWithAnomalies() {
        return servicesWithAnomalies;
    }

    @JsonProperty("total_anomalies")
    public int getTotalAnomalies() {
        return totalAnomalies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricsSummary that))
            return false;
        return totalServices == that.totalServices
                && servicesWithAnomalies == that.servicesWithAnomalies
                && totalAnomalies == that.totalAnomalies;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalServices, servicesWithAnomalies, totalAnomalies);
    }

    @Override
    public String toString() {
        return "MetricsSummary{totalServices=" + totalServices
                + ", servicesWithAnomalies=" + servicesWithAnomalies
                + ", totalAnomalies=" + totalAnomalies + '}';
    }
}
