package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.MetricKind;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.Sample;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A metric series split into a <i>recent</i> window (the last
 * {@code recentSamples} samples) and the <i>baseline</i> preceding it.
 *
 * <p>
 * When the series is not longer than the recent window the baseline is empty
 * and only absolute rules can fire.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesWindow {

    private final String metric;
    private final MetricKind kind;
    private final double[] baseline;
    private final double[] recent;
    private final double current;
    private final Instant observedAt;

    private SeriesWindow(String metric, MetricKind kind, double[] baseline, double[] recent,
            Instant observedAt) {
        this.metric = metric;
        this.kind = kind;
        this.baseline = baseline;
        this.recent = recent;
        this.current = mean(recent);
        this.observedAt = observedAt;
    }

    /**
     * @param series        non-empty, well-formed series
     * @param kind          kind of the series
     * @param recentSamples size of the recent window
     * @return the split window
     * @throws IllegalArgumentException if the series is empty
     */
    public static SeriesWindow of(MetricSeries series, MetricKind kind, int recentSamples) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(kind, "Metric kind must not be null");
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Series '" + series.getName() + "' is empty");
        }
        List<Sample> samples = series.getSamples();
        int split = Math.max(0, samples.size() - Math.max(1, recentSamples));
        double[] baseline = new double[split];
        double[] recent = new double[samples.size() - split];
        for (int i = 0; i < samples.size(); i++) {
            double v = samples.get(i).getValue();
            if (i < split) {
                baseline[i] = v;
            } else {
                recent[i - split] = v;
            }
        }
        return new SeriesWindow(series.getName(), kind, baseline, recent, series.latestTimestamp());
    }

    /**
     * Describe why a series cannot be evaluated.
     *
     * @param series series to check
     * @param kind   kind of the series
     * @return the problem, or empty when every sample is usable
     */
    public static Optional<String> malformedReason(MetricSeries series, MetricKind kind) {
        for (Sample sample : series.getSamples()) {
            double v = sample.getValue();
            if (!Double.isFinite(v)) {
                return Optional.of("non-numeric sample " + v);
            }
            if (v < 0 && (kind == MetricKind.LATENCY || kind == MetricKind.THROUGHPUT)) {
                return Optional.of("negative value " + v);
            }
            if (kind.isPercentage() && (v < 0 || v > 100)) {
                return Optional.of("percentage out of [0, 100]: " + v);
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double stdDev(double[] values, double mean) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public MetricKind getKind() {
        return kind;
    }

    /** Mean of the recent window. */
    public double current() {
        return current;
    }

    public int baselineSize() {
        return baseline.length;
    }

    /** Mean of the baseline, {@code NaN} when it is empty. */
    public double baselineMean() {
        return mean(baseline);
    }

    /** Population standard deviation of the baseline, {@code NaN} when empty. */
    public double baselineStdDev() {
        return stdDev(baseline, baselineMean());
    }

    /**
     * @return every value, baseline first
     */
    public double[] allValues() {
        double[] all = new double[baseline.length + recent.length];
        System.arraycopy(baseline, 0, all, 0, baseline.length);
        System.arraycopy(recent, 0, all, baseline.length, recent.length);
        return all;
    }

    /** Timestamp of the latest sample, or {@code null}. */
    public Instant observedAt() {
        return observedAt;
    }

    @Override
    public String toString() {
        return "SeriesWindow{metric='" + metric + "', kind=" + kind
                + ", baseline=" + baseline.length + ", recent=" + recent.length
                + ", current=" + current + '}';
    }
}
