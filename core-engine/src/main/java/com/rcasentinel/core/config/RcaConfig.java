package com.rcasentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the RCA YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * anomalyDetection:
 *   responseTimeThreshold: 1000
 *   errorRateThreshold: 5.0
 *   algorithms: [threshold, z_score]
 * rootCauseAnalysis:
 *   maxDepth: 5
 *   correlationThreshold: 0.1
 * pipeline:
 *   narrativeEnabled: true
 * </pre>
 *
 * <p>
 * Every section is optional and falls back to its defaults. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class RcaConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectionConfig anomalyDetection = new DetectionConfig();
    private AnalysisConfig rootCauseAnalysis = new AnalysisConfig();
    private PipelineConfig pipeline = new PipelineConfig();

    /**
     * @return a configuration holding every default
     */
    public static RcaConfig defaults() {
        return new RcaConfig();
    }

    /**
     * Validate every section. Collects all errors and throws a single
     * exception if any section is invalid.
     *
     * @throws IllegalStateException if one or more options are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collect(errors, anomalyDetection::validate);
        collect(errors, rootCauseAnalysis::validate);
        collect(errors, pipeline::validate);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "RCA configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    private static void collect(List<String> errors, Runnable validation) {
        try {
            validation.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    public DetectionConfig getAnomalyDetection() {
        return anomalyDetection;
    }

    public void setAnomalyDetection(DetectionConfig anomalyDetection) {
        this.anomalyDetection = anomalyDetection != null ? anomalyDetection : new DetectionConfig();
    }

    public AnalysisConfig getRootCauseAnalysis() {
        return rootCauseAnalysis;
    }

    public void setRootCauseAnalysis(AnalysisConfig rootCauseAnalysis) {
        this.rootCauseAnalysis = rootCauseAnalysis != null ? rootCauseAnalysis : new AnalysisConfig();
    }

    public PipelineConfig getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineConfig pipeline) {
        this.pipeline = pipeline != null ? pipeline : new PipelineConfig();
    }

    @Override
    public String toString() {
        return "RcaConfig{anomalyDetection=" + anomalyDetection
                + ", rootCauseAnalysis=" + rootCauseAnalysis
                + ", pipeline=" + pipeline + '}';
    }
}
