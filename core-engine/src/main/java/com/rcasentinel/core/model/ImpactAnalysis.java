package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Downstream blast radius of a root-cause candidate.
 *
 * <p>
 * {@code propagationPaths} holds one rendered call path per affected service,
 * e.g. {@code "gateway -> orders -> payments"}, in the same order as
 * {@code affectedServices}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "affected_services", "impact_severity", "propagation_paths" })
public final class ImpactAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final ImpactAnalysis NONE = new ImpactAnalysis(List.of(), ImpactSeverity.LOW, List.of());

    private final List<AffectedService> affectedServices;
    private final ImpactSeverity impactSeverity;
    private final List<String> propagationPaths;

    @JsonCreator
    public ImpactAnalysis(@JsonProperty("affected_services") List<AffectedService> affectedServices,
            @JsonProperty("impact_severity") ImpactSeverity impactSeverity,
            @JsonProperty("propagation_paths") List<String> propagationPaths) {
        this.affectedServices = affectedServices != null ? List.copyOf(affectedServices) : List.of();
        this.impactSeverity = Objects.requireNonNull(impactSeverity, "impactSeverity must not be null");
        this.propagationPaths = propagationPaths != null ? List.copyOf(propagationPaths) : List.of();
    }

    /**
     * @return impact of a candidate with no anomalous downstream service
     */
    public static ImpactAnalysis none() {
        return NONE;
    }

    @JsonProperty("affected_services")
    public List<AffectedService> getAffectedServices() {
        return affectedServices;
    }

    @JsonProperty("impact_severity")
    public ImpactSeverity getImpactSeverity() {
        return impactSeverity;
    }

    @JsonProperty("propagation_paths")
    public List<String> getPropagationPaths() {
        return propagationPaths;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ImpactAnalysis that))
            return false;
        return affectedServices.equals(that.affectedServices)
                && impactSeverity == that.impactSeverity
                && propagationPaths.equals(that.propagationPaths);
    }

    @Override
    public int hashCode() {
        return Objects.hash(affectedServices, impactSeverity, propagationPaths);
    }

    @Override
    public String toString() {
        return "ImpactAnalysis{severity=" + impactSeverity + ", affected=" + affectedServices + '}';
    }
}
