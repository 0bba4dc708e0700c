package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ranked root-cause candidates plus the diagnostics recorded while computing
 * them.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "analysis_timestamp", "service_graph_stats", "root_causes", "diagnostics" })
public final class AnalysisResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant analysisTimestamp;
    private final GraphStats serviceGraphStats;
    private final List<RootCauseCandidate> rootCauses;
    private final List<String> diagnostics;

    @JsonCreator
    public AnalysisResult(@JsonProperty("analysis_timestamp") Instant analysisTimestamp,
            @JsonProperty("service_graph_stats") GraphStats serviceGraphStats,
            @JsonProperty("root_causes") List<RootCauseCandidate> rootCauses,
            @JsonProperty("diagnostics") List<String> diagnostics) {
        this.analysisTimestamp = Objects.requireNonNull(analysisTimestamp, "analysisTimestamp must not be null");
        this.serviceGraphStats = Objects.requireNonNull(serviceGraphStats, "serviceGraphStats must not be null");
        this.rootCauses = rootCauses != null ? List.copyOf(rootCauses) : List.of();
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    @JsonProperty("analysis_timestamp")
    public Instant getAnalysisTimestamp() {
        return analysisTimestamp;
    }

    @JsonProperty("service_graph_stats")
    public GraphStats getServiceGraphStats() {
        return serviceGraphStats;
    }

    /**
     * @return candidates sorted by descending root-cause score
     */
    @JsonProperty("root_causes")
    public List<RootCauseCandidate> getRootCauses() {
        return rootCauses;
    }

    @JsonProperty("diagnostics")
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisResult that))
            return false;
        return analysisTimestamp.equals(that.analysisTimestamp)
                && serviceGraphStats.equals(that.serviceGraphStats)
                && rootCauses.equals(that.rootCauses)
                && diagnostics.equals(that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(analysisTimestamp, serviceGraphStats, rootCauses, diagnostics);
    }

    @Override
    public String toString() {
        return "AnalysisResult{analysisTimestamp=" + analysisTimestamp
                + ", graph=" + serviceGraphStats
                + ", rootCauses=" + rootCauses.size()
                + ", diagnostics=" + diagnostics + '}';
    }
}
