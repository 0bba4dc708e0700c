package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.AnomalyKind;

import java.util.Objects;

/**
 * A rule that fired on one series window.
 *
 * @since 1.0.0
 */
public final class CheckResult {

    private final String algorithm;
    private final AnomalyKind kind;
    private final Double threshold;
    private final Double zScore;
    private final double deviation;
    private final boolean marginal;

    /**
     * @param algorithm name of the check that fired
     * @param kind      anomaly kind reported
     * @param threshold absolute bound that was crossed, if any
     * @param zScore    normalised deviation, if the check computed one
     * @param deviation deviation magnitude
     * @param marginal  whether the violation lies close to the bound
     */
    public CheckResult(String algorithm, AnomalyKind kind, Double threshold, Double zScore,
            double deviation, boolean marginal) {
        this.algorithm = Objects.requireNonNull(algorithm, "Algorithm must not be null");
        this.kind = Objects.requireNonNull(kind, "Kind must not be null");
        this.threshold = threshold;
        this.zScore = zScore;
        this.deviation = deviation;
        this.marginal = marginal;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public AnomalyKind getKind() {
        return kind;
    }

    public Double getThreshold() {
        return threshold;
    }

    public Double getZScore() {
        return zScore;
    }

    public double getDeviation() {
        return deviation;
    }

    public boolean isMarginal() {
        return marginal;
    }

    /**
     * @return {@code true} for results of an absolute-threshold rule
     */
    public boolean isAbsolute() {
        return ThresholdCheck.NAME.equals(algorithm);
    }

    @Override
    public String toString() {
        return "CheckResult{algorithm='" + algorithm + "', kind=" + kind
                + ", threshold=" + threshold + ", zScore=" + zScore
                + ", deviation=" + deviation + ", marginal=" + marginal + '}';
    }
}
