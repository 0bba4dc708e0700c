package com.rcasentinel.core.detection;

import com.rcasentinel.core.config.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Statistical deviation rule.
 *
 * <p>
 * Computes the z-score of the recent-window mean against the baseline mean
 * and standard deviation, measured in the adverse direction of the metric
 * (upward for latency and error rate, downward for throughput and success
 * ratio). The rule fires when the z-score exceeds {@code zscoreThreshold}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * The rule only engages with at least {@value #MIN_BASELINE_SIZE} baseline
 * samples. On a flat baseline (standard deviation zero) the z-score is
 * undefined: an adverse change of at least {@value #MIN_RELATIVE_CHANGE} of
 * the baseline mean yields {@link #SATURATED_Z}, a smaller one is ignored.
 * Below a mean of 1 the change is measured in absolute units.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreCheck implements MetricCheck {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ZScoreCheck.class);

    public static final String NAME = "z_score";

    static final int MIN_BASELINE_SIZE = 2;

    static final double SATURATED_Z = 10.0;

    /** Smallest relative change that counts on a flat baseline. */
    static final double MIN_RELATIVE_CHANGE = 0.05;

    /** A deviation up to this factor of the bound is marginal. */
    static final double MARGINAL_FACTOR = 1.25;

    private final double bound;

    public ZScoreCheck(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.bound = config.getZscoreThreshold();
    }

    @Override
    public Optional<CheckResult> evaluate(SeriesWindow window) {
        Objects.requireNonNull(window, "Window must not be null");

        if (window.baselineSize() < MIN_BASELINE_SIZE) {
            LOG.trace("Metric '{}': baseline too short for z-score ({} samples)",
                    window.getMetric(), window.baselineSize());
            return Optional.empty();
        }

        double mean = window.baselineMean();
        double stddev = window.baselineStdDev();
        double diff = window.getKind().higherIsWorse()
                ? window.current() - mean
                : mean - window.current();
        if (!(diff > 0)) {
            return Optional.empty();
        }

        if (stddev == 0 && diff / Math.max(Math.abs(mean), 1.0) < MIN_RELATIVE_CHANGE) {
            LOG.trace("Metric '{}': change {} on a flat baseline is within noise", window.getMetric(), diff);
            return Optional.empty();
        }

        double z = stddev == 0 ? SATURATED_Z : diff / stddev;
        if (z <= bound) {
            return Optional.empty();
        }

        LOG.debug("Z-score rule fired on '{}': current={} mean={} stddev={} z={}",
                window.getMetric(), window.current(), mean, stddev, z);
        return Optional.of(new CheckResult(NAME, window.getKind().anomalyKind(), null, z, z,
                z <= MARGINAL_FACTOR * bound));
    }

    @Override
    public String getAlgorithmName() {
        return NAME;
    }
}
