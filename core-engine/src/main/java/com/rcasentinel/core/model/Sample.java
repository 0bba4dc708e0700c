package com.rcasentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One data point of a {@link MetricSeries}.
 *
 * <p>
 * A raw point that could not be read as a number is kept as {@link Double#NaN}
 * so that the detector can reject the whole series as malformed instead of
 * silently analysing a shorter one.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Sample time, or {@code null} when the source did not report one. */
    private final Instant timestamp;

    private final double value;

    public Sample(Instant timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public static Sample of(double value) {
        return new Sample(null, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(value, that.value) == 0 && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return timestamp == null ? String.valueOf(value) : timestamp + "=" + value;
    }
}
