package com.rcasentinel.core.detection;

import com.rcasentinel.core.config.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link MetricCheck} instances from algorithm names.
 *
 * <p>
 * This is the single point of extension when adding new algorithms:
 * register the name here and create the corresponding check.
 * </p>
 *
 * @since 1.0.0
 */
public final class CheckFactory {

    private static final Logger LOG = LoggerFactory.getLogger(CheckFactory.class);

    private CheckFactory() {
        // utility class
    }

    /**
     * Create the check for one algorithm.
     *
     * @param algorithm algorithm name; must not be {@code null}
     * @param config    detector settings; must not be {@code null}
     * @return the check
     * @throws IllegalArgumentException if the algorithm is unknown
     */
    public static MetricCheck create(String algorithm, DetectionConfig config) {
        Objects.requireNonNull(algorithm, "Algorithm must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        return switch (algorithm.toLowerCase(Locale.ROOT)) {
            case ThresholdCheck.NAME -> new ThresholdCheck(config);
            case ZScoreCheck.NAME -> new ZScoreCheck(config);
            case VariabilityCheck.NAME -> new VariabilityCheck(config);
            default -> throw new IllegalArgumentException(
                    "Unknown algorithm: '" + algorithm + "'. Supported algorithms: threshold, z_score, variability");
        };
    }

    /**
     * Create a check for every configured algorithm, in configuration order.
     *
     * @param config detector settings; must not be {@code null}
     * @return unmodifiable list of checks
     */
    public static List<MetricCheck> createAll(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        LOG.info("Creating {} metric check(s): {}", config.getAlgorithms().size(), config.getAlgorithms());
        List<MetricCheck> checks = config.getAlgorithms().stream()
                .distinct()
                .map(algorithm -> create(algorithm, config))
                .toList();
        return Collections.unmodifiableList(checks);
    }
}
