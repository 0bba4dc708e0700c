package com.rcasentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Named, time-ordered sequence of samples for one service.
 *
 * <p>
 * An empty series is legal: the service exists but produced no samples in the
 * analysis window. It is never interpreted as a series of zeros.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final List<Sample> samples;

    public MetricSeries(String name, List<Sample> samples) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
        this.samples = List.copyOf(Objects.requireNonNull(samples, "Samples must not be null"));
    }

    /**
     * Convenience factory for untimed samples.
     *
     * @param name   metric name
     * @param values sample values in time order
     * @return a new series
     */
    public static MetricSeries of(String name, double... values) {
        return new MetricSeries(name, Arrays.stream(values).mapToObj(Sample::of).toList());
    }

    public String getName() {
        return name;
    }

    public List<Sample> getSamples() {
        return samples;
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int size() {
        return samples.size();
    }

    /**
     * @return timestamp of the last sample that carries one, or {@code null}
     */
    public Instant latestTimestamp() {
        for (int i = samples.size() - 1; i >= 0; i--) {
            Instant ts = samples.get(i).getTimestamp();
            if (ts != null) {
                return ts;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSeries that))
            return false;
        return name.equals(that.name) && samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, samples);
    }

    @Override
    public String toString() {
        return "MetricSeries{name='" + name + "', samples=" + samples.size() + '}';
    }
}
