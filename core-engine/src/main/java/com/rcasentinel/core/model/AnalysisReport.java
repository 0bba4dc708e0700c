package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one pipeline pass produced, as handed to a result sink.
 *
 * <p>
 * {@code detection} and {@code analysis} are absent when the snapshot could
 * not be fetched ({@link ReportStatus#NO_DATA}).
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "status", "detection", "analysis", "narratives", "diagnostics" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ReportStatus status;
    private final DetectionResult detection;
    private final AnalysisResult analysis;
    private final Map<String, String> narratives;
    private final List<String> diagnostics;

    @JsonCreator
    public AnalysisReport(@JsonProperty("status") ReportStatus status,
            @JsonProperty("detection") DetectionResult detection,
            @JsonProperty("analysis") AnalysisResult analysis,
            @JsonProperty("narratives") Map<String, String> narratives,
            @JsonProperty("diagnostics") List<String> diagnostics) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.detection = detection;
        this.analysis = analysis;
        this.narratives = narratives != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(narratives))
                : Map.of();
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    /**
     * @param diagnostic why no data was analysed
     * @return a report carrying no detection or analysis output
     */
    public static AnalysisReport noData(String diagnostic) {
        return new AnalysisReport(ReportStatus.NO_DATA, null, null, Map.of(), List.of(diagnostic));
    }

    @JsonProperty("status")
    public ReportStatus getStatus() {
        return status;
    }

    @JsonProperty("detection")
    public DetectionResult getDetection() {
        return detection;
    }

    @JsonProperty("analysis")
    public AnalysisResult getAnalysis() {
        return analysis;
    }

    /**
     * @return prose keyed by analysis type ({@code anomaly_analysis},
     *         {@code root_cause_analysis}); empty when narratives were skipped
     */
    @JsonProperty("narratives")
    public Map<String, String> getNarratives() {
        return narratives;
    }

    @JsonProperty("diagnostics")
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisReport that))
            return false;
        return status == that.status
                && Objects.equals(detection, that.detection)
                && Objects.equals(analysis, that.analysis)
                && narratives.equals(that.narratives)
                && diagnostics.equals(that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, detection, analysis, narratives, diagnostics);
    }

    @Override
    public String toString() {
        return "AnalysisReport{status=" + status
                + ", detection=" + detection
                + ", analysis=" + analysis
                + ", narratives=" + narratives.keySet()
                + ", diagnostics=" + diagnostics + '}';
    }
}
