package com.rcasentinel.core.config;

import java.io.Serializable;

/**
 * Per-run pipeline switches ({@code pipeline} YAML section).
 *
 * @since 1.0.0
 */
public class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Ask the narrative annotator for prose when anomalies were found. */
    private boolean narrativeEnabled = true;

    /** Entries per list in the pass summary log. */
    private int summaryTopN = 3;

    public void validate() {
        if (summaryTopN < 0) {
            throw new IllegalStateException("Invalid pipeline config: 'summaryTopN' must be >= 0, got "
                    + summaryTopN);
        }
    }

    public boolean isNarrativeEnabled() {
        return narrativeEnabled;
    }

    public void setNarrativeEnabled(boolean narrativeEnabled) {
        this.narrativeEnabled = narrativeEnabled;
    }

    public int getSummaryTopN() {
        return summaryTopN;
    }

    public void setSummaryTopN(int summaryTopN) {
        this.summaryTopN = summaryTopN;
    }

    @Override
    public String toString() {
        return "PipelineConfig{narrativeEnabled=" + narrativeEnabled + ", summaryTopN=" + summaryTopN + '}';
    }
}
