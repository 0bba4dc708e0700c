package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How badly a root-cause candidate's failure spreads downstream.
 *
 * @since 1.0.0
 */
public enum ImpactSeverity {

    LOW,
    MEDIUM,
    HIGH;

    /**
     * @param affectedServices number of reachable downstream services that
     *                         carry anomalies themselves
     * @return severity label for that count
     */
    public static ImpactSeverity forAffectedCount(int affectedServices) {
        if (affectedServices >= 3) {
            return HIGH;
        }
        return affectedServices >= 1 ? MEDIUM : LOW;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ImpactSeverity fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
