package com.rcasentinel.core.detection;

import com.rcasentinel.core.config.DetectionConfig;
import com.rcasentinel.core.model.AnomalyKind;
import com.rcasentinel.core.model.MetricKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Throughput instability rule: fires when the coefficient of variation
 * (standard deviation over mean) of a throughput series exceeds
 * {@code variabilityThreshold}. Other metric kinds are ignored.
 *
 * @since 1.0.0
 */
public class VariabilityCheck implements MetricCheck {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(VariabilityCheck.class);

    public static final String NAME = "variability";

    private final double bound;

    public VariabilityCheck(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.bound = config.getVariabilityThreshold();
    }

    @Override
    public Optional<CheckResult> evaluate(SeriesWindow window) {
        Objects.requireNonNull(window, "Window must not be null");
        if (window.getKind() != MetricKind.THROUGHPUT) {
            return Optional.empty();
        }

        double[] values = window.allValues();
        if (values.length < 2) {
            return Optional.empty();
        }
        double mean = SeriesWindow.mean(values);
        if (!(mean > 0)) {
            return Optional.empty();
        }
        double cv = SeriesWindow.stdDev(values, mean) / mean;
        if (cv <= bound) {
            return Optional.empty();
        }

        LOG.debug("Variability rule fired on '{}': mean={} cv={}", window.getMetric(), mean, cv);
        return Optional.of(new CheckResult(NAME, AnomalyKind.THROUGHPUT_INSTABILITY, bound, null, cv,
                cv <= ZScoreCheck.MARGINAL_FACTOR * bound));
    }

    @Override
    public String getAlgorithmName() {
        return NAME;
    }
}
