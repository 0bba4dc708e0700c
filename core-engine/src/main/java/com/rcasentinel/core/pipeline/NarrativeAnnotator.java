package com.rcasentinel.core.pipeline;

import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.DetectionResult;

import java.io.IOException;
import java.util.Map;

/**
 * Produces human-readable prose for detection and analysis output.
 *
 * <p>
 * Implementations only read their inputs. A failed or missing narrative
 * never affects the computed results.
 * </p>
 */
public interface NarrativeAnnotator {

    /** Key of the prose describing the detected anomalies. */
    String ANOMALY_ANALYSIS = "anomaly_analysis";

    /** Key of the prose describing the ranked root causes. */
    String ROOT_CAUSE_ANALYSIS = "root_cause_analysis";

    /**
     * @param detection detector output
     * @param analysis  analyzer output
     * @return prose keyed by {@link #ANOMALY_ANALYSIS} and
     *         {@link #ROOT_CAUSE_ANALYSIS}; a key may be absent when its
     *         narrative could not be produced
     * @throws IOException if the annotator backend cannot be reached
     */
    Map<String, String> annotate(DetectionResult detection, AnalysisResult analysis) throws IOException;
}
