package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Service ranked by the root-cause analyzer as a likely origin of the
 * observed anomalies.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code rootService} is required; list fields
 * default to empty and {@code impactAnalysis} defaults to
 * {@link ImpactAnalysis#none()}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = RootCauseCandidate.Builder.class)
@JsonPropertyOrder({ "root_service", "root_cause_score", "confidence", "criticality_score",
        "anomalies", "impact_analysis", "upstream_services", "downstream_services",
        "correlated_services", "recommendation" })
public final class RootCauseCandidate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String rootService;
    private final double rootCauseScore;

    /** In [0, 1]. */
    private final double confidence;

    private final double criticalityScore;

    /** Anomalies owned by the candidate itself. */
    private final List<Anomaly> anomalies;

    private final ImpactAnalysis impactAnalysis;

    /** Immediate callers of the candidate. */
    private final List<String> upstreamServices;

    /** Immediate callees of the candidate. */
    private final List<String> downstreamServices;

    /** Downstream anomalous services whose symptoms were attributed to this candidate. */
    private final List<String> correlatedServices;

    private final String recommendation;

    private RootCauseCandidate(Builder builder) {
        this.rootService = Objects.requireNonNull(builder.rootService, "rootService must not be null");
        this.rootCauseScore = builder.rootCauseScore;
        this.confidence = builder.confidence;
        this.criticalityScore = builder.criticalityScore;
        this.anomalies = builder.anomalies != null ? List.copyOf(builder.anomalies) : List.of();
        this.impactAnalysis = builder.impactAnalysis != null ? builder.impactAnalysis : ImpactAnalysis.none();
        this.upstreamServices = builder.upstreamServices != null ? List.copyOf(builder.upstreamServices) : List.of();
        this.downstreamServices = builder.downstreamServices != null
                ? List.copyOf(builder.downstreamServices)
                : List.of();
        this.correlatedServices = builder.correlatedServices != null
                ? List.copyOf(builder.correlatedServices)
                : List.of();
        this.recommendation = builder.recommendation != null ? builder.recommendation : "";
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String rootService;
        private double rootCauseScore;
        private double confidence;
        private double criticalityScore;
        private List<Anomaly> anomalies;
        private ImpactAnalysis impactAnalysis;
        private List<String> upstreamServices;
        private List<String> downstreamServices;
        private List<String> correlatedServices;
        private String recommendation;

        public Builder() {
        }

        @JsonProperty("root_service")
        public Builder rootService(String rootService) {
            this.rootService = rootService;
            return this;
        }

        @JsonProperty("root_cause_score")
        public Builder rootCauseScore(double rootCauseScore) {
            this.rootCauseScore = rootCauseScore;
            return this;
        }

        @JsonProperty("confidence")
        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        @JsonProperty("criticality_score")
        public Builder criticalityScore(double criticalityScore) {
            this.criticalityScore = criticalityScore;
            return this;
        }

        @JsonProperty("anomalies")
        public Builder anomalies(List<Anomaly> anomalies) {
            this.anomalies = anomalies;
            return this;
        }

        @JsonProperty("impact_analysis")
        public Builder impactAnalysis(ImpactAnalysis impactAnalysis) {
            this.impactAnalysis = impactAnalysis;
            return this;
        }

        @JsonProperty("upstream_services")
        public Builder upstreamServices(List<String> upstreamServices) {
            this.upstreamServices = upstreamServices;
            return this;
        }

        @JsonProperty("downstream_services")
        public Builder downstreamServices(List<String> downstreamServices) {
            this.downstreamServices = downstreamServices;
            return this;
        }

        @JsonProperty("correlated_services")
        public Builder correlatedServices(List<String> correlatedServices) {
            this.correlatedServices = correlatedServices;
            return this;
        }

        @JsonProperty("recommendation")
        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public RootCauseCandidate build() {
            return new RootCauseCandidate(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("root_service")
    public String getRootService() {
        return rootService;
    }

    @JsonProperty("root_cause_score")
    public double getRootCauseScore() {
        return rootCauseScore;
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("criticality_score")
    public double getCriticalityScore() {
        return criticalityScore;
    }

    @JsonProperty("anomalies")
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    @JsonProperty("impact_analysis")
    public ImpactAnalysis getImpactAnalysis() {
        return impactAnalysis;
    }

    @JsonProperty("upstream_services")
    public List<String> getUpstreamServices() {
        return upstreamServices;
    }

    @JsonProperty("downstream_services")
    public List<String> getDownstreamServices() {
        return downstreamServices;
    }

    @JsonProperty("correlated_services")
    public List<String> getCorrelatedServices() {
        return correlatedServices;
    }

    @JsonProperty("recommendation")
    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootCauseCandidate that))
            return false;
        return Double.compare(rootCauseScore, that.rootCauseScore) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Double.compare(criticalityScore, that.criticalityScore) == 0
                && rootService.equals(that.rootService)
                && anomalies.equals(that.anomalies)
                && impactAnalysis.equals(that.impactAnalysis)
                && upstreamServices.equals(that.upstreamServices)
                && downstreamServices.equals(that.downstreamServices)
                && correlatedServices.equals(that.correlatedServices)
                && recommendation.equals(that.recommendation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootService, rootCauseScore, confidence, criticalityScore, anomalies,
                impactAnalysis, upstreamServices, downstreamServices, correlatedServices, recommendation);
    }

    @Override
    public String toString() {
        return "RootCauseCandidate{" +
                "rootService='" + rootService + '\'' +
                ", score=" + rootCauseScore +
                ", confidence=" + confidence +
                ", criticality=" + criticalityScore +
                ", anomalies=" + anomalies.size() +
                ", impact=" + impactAnalysis.getImpactSeverity() +
                '}';
    }
}
