package com.rcasentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the root-cause analyzer ({@code rootCauseAnalysis} YAML
 * section).
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    static final int MAX_DEPTH_LIMIT = 32;

    /** Upstream / downstream hops considered when propagating blame. */
    private int maxDepth = 5;

    /** Candidates scoring below this share of the best score are dropped. */
    private double correlationThreshold = 0.1;

    /** Minutes within which two anomalies count as temporally correlated. */
    private int timeCorrelationWindow = 5;

    /**
     * @throws IllegalStateException listing every invalid option
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
            errors.add("'maxDepth' must be in [1, " + MAX_DEPTH_LIMIT + "], got " + maxDepth);
        }
        if (!(correlationThreshold >= 0 && correlationThreshold <= 1)) {
            errors.add("'correlationThreshold' must be in [0, 1], got " + correlationThreshold);
        }
        if (timeCorrelationWindow <= 0) {
            errors.add("'timeCorrelationWindow' must be > 0 minutes, got " + timeCorrelationWindow);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid rootCauseAnalysis config: " + String.join("; ", errors));
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    public void setCorrelationThreshold(double correlationThreshold) {
        this.correlationThreshold = correlationThreshold;
    }

    public int getTimeCorrelationWindow() {
        return timeCorrelationWindow;
    }

    public void setTimeCorrelationWindow(int timeCorrelationWindow) {
        this.timeCorrelationWindow = timeCorrelationWindow;
    }

    @Override
    public String toString() {
        return "AnalysisConfig{maxDepth=" + maxDepth
                + ", correlationThreshold=" + correlationThreshold
                + ", timeCorrelationWindow=" + timeCorrelationWindow + '}';
    }
}
