package com.rcasentinel.core.detection;

import com.rcasentinel.core.config.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Absolute threshold rule.
 *
 * <ul>
 * <li>latency above {@code responseTimeThreshold}</li>
 * <li>error rate above {@code errorRateThreshold}</li>
 * <li>success ratio below {@code slaThreshold}</li>
 * <li>throughput below {@code (1 - throughputDropThreshold / 100)} times the
 * baseline mean</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ThresholdCheck implements MetricCheck {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ThresholdCheck.class);

    public static final String NAME = "threshold";

    private final double responseTimeThreshold;
    private final double errorRateThreshold;
    private final double throughputDropThreshold;
    private final double slaThreshold;

    public ThresholdCheck(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.responseTimeThreshold = config.getResponseTimeThreshold();
        this.errorRateThreshold = config.getErrorRateThreshold();
        this.throughputDropThreshold = config.getThroughputDropThreshold();
        this.slaThreshold = config.getSlaThreshold();
    }

    @Override
    public Optional<CheckResult> evaluate(SeriesWindow window) {
        Objects.requireNonNull(window, "Window must not be null");

        double current = window.current();
        double bound;
        boolean violated;
        switch (window.getKind()) {
            case LATENCY -> {
                bound = responseTimeThreshold;
                violated = current > bound;
            }
            case ERROR_RATE -> {
                bound = errorRateThreshold;
                violated = current > bound;
            }
            case SUCCESS_RATIO -> {
                bound = slaThreshold;
                violated = current < bound;
            }
            case THROUGHPUT -> {
                double baselineMean = window.baselineMean();
                if (window.baselineSize() == 0 || !(baselineMean > 0)) {
                    LOG.trace("Metric '{}': no usable baseline for the throughput drop rule", window.getMetric());
                    return Optional.empty();
                }
                bound = (1 - throughputDropThreshold / 100.0) * baselineMean;
                violated = current < bound;
            }
            default -> throw new IllegalStateException("Unhandled metric kind: " + window.getKind());
        }

        if (!violated) {
            return Optional.empty();
        }

        double deviation = bound == 0 ? Math.abs(current) : Math.abs(current - bound) / bound;
        LOG.debug("Threshold rule fired on '{}': current={} bound={}", window.getMetric(), current, bound);
        return Optional.of(new CheckResult(NAME, window.getKind().anomalyKind(), bound, null, deviation, false));
    }

    @Override
    public String getAlgorithmName() {
        return NAME;
    }
}
