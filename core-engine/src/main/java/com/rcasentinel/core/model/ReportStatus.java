package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one pipeline pass.
 *
 * @since 1.0.0
 */
public enum ReportStatus {

    /** No anomaly was detected. A successful pass with zero findings. */
    HEALTHY,

    /** At least one anomaly was detected. */
    FINDINGS,

    /** The snapshot was missing or had no topology to analyse. */
    NO_DATA;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReportStatus fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
