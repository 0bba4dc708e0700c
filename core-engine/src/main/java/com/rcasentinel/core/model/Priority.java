package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse severity tier of a detected anomaly.
 *
 * @since 1.0.0
 */
public enum Priority {

    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    Priority(int weight) {
        this.weight = weight;
    }

    /**
     * @return contribution of one anomaly of this tier to a service's local
     *         anomaly density
     */
    public int weight() {
        return weight;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
