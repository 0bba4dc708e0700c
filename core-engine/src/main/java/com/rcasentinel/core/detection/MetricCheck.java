package com.rcasentinel.core.detection;

import java.io.Serializable;
import java.util.Optional;

/**
 * Contract for all detection rules.
 * <p>
 * Checks are <strong>stateless</strong>: each call evaluates one series
 * window on its own, so one instance can serve concurrent detection workers.
 * </p>
 * <p>
 * Checks must be {@link Serializable} because the Flink job ships the
 * detector to its task managers.
 * </p>
 */
public interface MetricCheck extends Serializable {

    /**
     * Evaluate one series window.
     *
     * @param window the window to evaluate
     * @return a {@link CheckResult} if the rule fires, empty otherwise
     */
    Optional<CheckResult> evaluate(SeriesWindow window);

    /**
     * @return the algorithm name used in configuration
     */
    String getAlgorithmName();
}
