package com.rcasentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyBuckets}.
 */
class AnomalyBucketsTest {

    @Test
    @DisplayName("Should group anomalies by priority keeping detection order")
    void shouldGroupInDetectionOrder() {
        Anomaly a = anomaly("a", Priority.MEDIUM);
        Anomaly b = anomaly("b", Priority.HIGH);
        Anomaly c = anomaly("c", Priority.MEDIUM);
        Anomaly d = anomaly("d", Priority.LOW);

        AnomalyBuckets buckets = AnomalyBuckets.of(List.of(a, b, c, d));

        assertThat(buckets.getHighPriority()).containsExactly(b);
        assertThat(buckets.getMediumPriority()).containsExactly(a, c);
        assertThat(buckets.get(Priority.LOW)).containsExactly(d);
        assertThat(buckets.all()).containsExactly(b, a, c, d);
        assertThat(buckets.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should treat missing buckets as empty")
    void shouldDefaultMissingBuckets() {
        AnomalyBuckets buckets = new AnomalyBuckets(null, List.of(anomaly("a", Priority.MEDIUM)), null);

        assertThat(buckets.getHighPriority()).isEmpty();
        assertThat(buckets.getLowPriority()).isEmpty();
        assertThat(buckets.isEmpty()).isFalse();
        assertThat(AnomalyBuckets.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should expose unmodifiable buckets")
    void shouldBeImmutable() {
        AnomalyBuckets buckets = AnomalyBuckets.of(List.of(anomaly("a", Priority.HIGH)));

        assertThatThrownBy(() -> buckets.getHighPriority().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should require service, metric, kind and priority on an anomaly")
    void shouldRequireAnomalyIdentity() {
        assertThatThrownBy(() -> Anomaly.builder().metric("m").kind(AnomalyKind.SLA_DROP)
                .priority(Priority.LOW).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("service");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Anomaly anomaly(String service, Priority priority) {
        return Anomaly.builder()
                .service(service)
                .metric("service_resp_time")
                .kind(AnomalyKind.LATENCY_SPIKE)
                .priority(priority)
                .observedValue(1500)
                .build();
    }
}
