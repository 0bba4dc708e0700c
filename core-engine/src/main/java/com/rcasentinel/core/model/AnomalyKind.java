package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of anomaly kinds the detector can emit.
 *
 * @since 1.0.0
 */
public enum AnomalyKind {

    LATENCY_SPIKE("Check the performance bottleneck of %s; the code path may need optimisation or more resources"),
    ERROR_RATE_SPIKE("Inspect the error logs of %s to find what drives the error rate up"),
    THROUGHPUT_DROP("Verify that %s is receiving traffic; check upstream routing and instance health"),
    SLA_DROP("Check the availability of %s and make sure all instances are serving"),
    THROUGHPUT_INSTABILITY("Review load balancing and resource allocation of %s");

    private final String advice;

    AnomalyKind(String advice) {
        this.advice = advice;
    }

    /**
     * @param service service id to mention
     * @return remediation advice for this kind of anomaly
     */
    public String advice(String service) {
        return String.format(advice, service);
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalyKind fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
