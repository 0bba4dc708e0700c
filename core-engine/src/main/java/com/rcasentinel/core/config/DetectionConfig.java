package com.rcasentinel.core.config;

import com.rcasentinel.core.model.MetricKind;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Settings of the anomaly detector ({@code anomalyDetection} YAML section).
 *
 * <p>
 * Percentages are expressed in percent (5.0 means 5 %), latency in
 * milliseconds and time spans in minutes.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Algorithm names understood by the detector. */
    public static final Set<String> SUPPORTED_ALGORITHMS = Set.of("threshold", "z_score", "variability");

    private double responseTimeThreshold = 1000.0;
    private double errorRateThreshold = 5.0;
    private double throughputDropThreshold = 30.0;
    private double slaThreshold = 95.0;
    private int timeWindow = 60;
    private List<String> algorithms = new ArrayList<>(List.of("threshold", "z_score"));
    private double zscoreThreshold = 3.0;
    private double variabilityThreshold = 0.5;
    private int recentSamples = 3;
    private boolean parallel;
    private Map<String, String> metricKinds = defaultMetricKinds();

    private static Map<String, String> defaultMetricKinds() {
        Map<String, String> kinds = new LinkedHashMap<>();
        kinds.put("service_resp_time", MetricKind.LATENCY.name());
        kinds.put("service_cpm", MetricKind.THROUGHPUT.name());
        kinds.put("service_sla", MetricKind.SUCCESS_RATIO.name());
        kinds.put("service_error_rate", MetricKind.ERROR_RATE.name());
        return kinds;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every invalid option
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(responseTimeThreshold > 0)) {
            errors.add("'responseTimeThreshold' must be > 0, got " + responseTimeThreshold);
        }
        if (!(errorRateThreshold > 0 && errorRateThreshold <= 100)) {
            errors.add("'errorRateThreshold' must be in (0, 100], got " + errorRateThreshold);
        }
        if (!(throughputDropThreshold > 0 && throughputDropThreshold < 100)) {
            errors.add("'throughputDropThreshold' must be in (0, 100), got " + throughputDropThreshold);
        }
        if (!(slaThreshold > 0 && slaThreshold <= 100)) {
            errors.add("'slaThreshold' must be in (0, 100], got " + slaThreshold);
        }
        if (timeWindow <= 0) {
            errors.add("'timeWindow' must be > 0 minutes, got " + timeWindow);
        }
        if (algorithms.isEmpty()) {
            errors.add("'algorithms' must name at least one algorithm");
        }
        for (String algorithm : algorithms) {
            if (algorithm == null || !SUPPORTED_ALGORITHMS.contains(algorithm)) {
                errors.add("Unknown algorithm: '" + algorithm + "'. Supported: threshold, z_score, variability");
            }
        }
        if (!(zscoreThreshold > 0)) {
            errors.add("'zscoreThreshold' must be > 0, got " + zscoreThreshold);
        }
        if (!(variabilityThreshold > 0)) {
            errors.add("'variabilityThreshold' must be > 0, got " + variabilityThreshold);
        }
        if (recentSamples < 1) {
            errors.add("'recentSamples' must be >= 1, got " + recentSamples);
        }
        metricKinds.forEach((metric, kind) -> {
            if (parseKind(kind).isEmpty()) {
                errors.add("Metric '" + metric + "' maps to unknown kind '" + kind
                        + "'. Supported: LATENCY, ERROR_RATE, THROUGHPUT, SUCCESS_RATIO");
            }
        });

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid anomalyDetection config: " + String.join("; ", errors));
        }
    }

    /**
     * @param metricName metric series name
     * @return the configured kind, or empty when the metric is not mapped
     */
    public Optional<MetricKind> kindOf(String metricName) {
        String kind = metricKinds.get(metricName);
        return kind == null ? Optional.empty() : parseKind(kind);
    }

    public boolean isEnabled(String algorithm) {
        return algorithms.contains(algorithm);
    }

    private static Optional<MetricKind> parseKind(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(MetricKind.valueOf(kind.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getResponseTimeThreshold() {
        return responseTimeThreshold;
    }

    public void setResponseTimeThreshold(double responseTimeThreshold) {
        this.responseTimeThreshold = responseTimeThreshold;
    }

    public double getErrorRateThreshold() {
        return errorRateThreshold;
    }

    public void setErrorRateThreshold(double errorRateThreshold) {
        this.errorRateThreshold = errorRateThreshold;
    }

    public double getThroughputDropThreshold() {
        return throughputDropThreshold;
    }

    public void setThroughputDropThreshold(double throughputDropThreshold) {
        this.throughputDropThreshold = throughputDropThreshold;
    }

    public double getSlaThreshold() {
        return slaThreshold;
    }

    public void setSlaThreshold(double slaThreshold) {
        this.slaThreshold = slaThreshold;
    }

    public int getTimeWindow() {
        return timeWindow;
    }

    public void setTimeWindow(int timeWindow) {
        this.timeWindow = timeWindow;
    }

    public List<String> getAlgorithms() {
        return Collections.unmodifiableList(algorithms);
    }

    /**
     * Set the enabled algorithms, normalised to lowercase.
     *
     * @param algorithms algorithm names
     */
    public void setAlgorithms(List<String> algorithms) {
        List<String> normalised = new ArrayList<>();
        if (algorithms != null) {
            for (String algorithm : algorithms) {
                normalised.add(algorithm != null ? algorithm.trim().toLowerCase(Locale.ROOT) : null);
            }
        }
        this.algorithms = normalised;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getVariabilityThreshold() {
        return variabilityThreshold;
    }

    public void setVariabilityThreshold(double variabilityThreshold) {
        this.variabilityThreshold = variabilityThreshold;
    }

    public int getRecentSamples() {
        return recentSamples;
    }

    public void setRecentSamples(int recentSamples) {
        this.recentSamples = recentSamples;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public Map<String, String> getMetricKinds() {
        return Collections.unmodifiableMap(metricKinds);
    }

    /**
     * Replace the metric name to kind mapping. An absent mapping keeps the
     * defaults.
     *
     * @param metricKinds metric name to {@link MetricKind} name
     */
    public void setMetricKinds(Map<String, String> metricKinds) {
        this.metricKinds = metricKinds != null ? new LinkedHashMap<>(metricKinds) : defaultMetricKinds();
    }

    @Override
    public String toString() {
        return "DetectionConfig{responseTimeThreshold=" + responseTimeThreshold
                + ", errorRateThreshold=" + errorRateThreshold
                + ", throughputDropThreshold=" + throughputDropThreshold
                + ", slaThreshold=" + slaThreshold
                + ", timeWindow=" + timeWindow
                + ", algorithms=" + algorithms
                + ", zscoreThreshold=" + zscoreThreshold
                + ", recentSamples=" + recentSamples
                + ", parallel=" + parallel + '}';
    }
}
