package com.rcasentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Summary of one sampled trace of a service.
 *
 * @since 1.0.0
 */
public final class TraceRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Trace duration in milliseconds. Negative values are malformed input. */
    private final double duration;

    /** Trace start, or {@code null} when unknown. */
    private final Instant start;

    private final boolean error;

    public TraceRecord(double duration, Instant start, boolean error) {
        this.duration = duration;
        this.start = start;
        this.error = error;
    }

    public double getDuration() {
        return duration;
    }

    public Instant getStart() {
        return start;
    }

    public boolean isError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TraceRecord that))
            return false;
        return Double.compare(duration, that.duration) == 0
                && error == that.error
                && Objects.equals(start, that.start);
    }

    @Override
    public int hashCode() {
        return Objects.hash(duration, start, error);
    }

    @Override
    public String toString() {
        return "TraceRecord{duration=" + duration + ", start=" + start + ", error=" + error + '}';
    }
}
