package com.rcasentinel.core.analysis;

import com.rcasentinel.core.model.Anomaly;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Temporal correlation strength between anomalies.
 *
 * <p>
 * Two timestamped anomalies {@code Δt} apart correlate with strength
 * {@code 1 - |Δt| / window} inside the window and {@code 0} beyond it. When
 * either timestamp is missing the strength is {@value #UNKNOWN_TIME_STRENGTH}:
 * weak evidence, never strong.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemporalCorrelation implements Serializable {

    private static final long serialVersionUID = 1L;

    static final double UNKNOWN_TIME_STRENGTH = 0.4;

    /** Strength at or above which a correlation counts as strong. */
    public static final double STRONG = 0.5;

    private final long windowMillis;

    public TemporalCorrelation(Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Correlation window must be positive, got " + window);
        }
        this.windowMillis = window.toMillis();
    }

    public double strength(Anomaly a, Anomaly b) {
        return strength(a.getObservedAt(), b.getObservedAt());
    }

    double strength(Instant a, Instant b) {
        if (a == null || b == null) {
            return UNKNOWN_TIME_STRENGTH;
        }
        long delta = Math.abs(Duration.between(a, b).toMillis());
        if (delta > windowMillis) {
            return 0.0;
        }
        return 1.0 - (double) delta / windowMillis;
    }

    /**
     * @return the strongest correlation over every pair drawn from the two
     *         lists, {@code 0} when either is empty
     */
    public double strongest(List<Anomaly> left, List<Anomaly> right) {
        double best = 0.0;
        for (Anomaly a : left) {
            for (Anomaly b : right) {
                best = Math.max(best, strength(a, b));
            }
        }
        return best;
    }

    public static boolean isStrong(double strength) {
        return strength >= STRONG;
    }
}
