package com.rcasentinel.core.analysis;

import com.rcasentinel.core.model.AffectedService;
import com.rcasentinel.core.model.Anomaly;
import com.rcasentinel.core.model.AnomalyKind;
import com.rcasentinel.core.model.ImpactAnalysis;
import com.rcasentinel.core.model.ImpactSeverity;
import com.rcasentinel.core.model.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Recommendations}.
 */
class RecommendationsTest {

    @Test
    @DisplayName("Should give one piece of advice per distinct anomaly kind")
    void shouldAdvisePerKind() {
        String text = Recommendations.forCandidate("db", List.of(
                anomaly(AnomalyKind.ERROR_RATE_SPIKE),
                anomaly(AnomalyKind.LATENCY_SPIKE),
                anomaly(AnomalyKind.LATENCY_SPIKE)), ImpactAnalysis.none());

        assertThat(text.split(" \\| ")).containsExactly(
                AnomalyKind.LATENCY_SPIKE.advice("db"),
                AnomalyKind.ERROR_RATE_SPIKE.advice("db"));
    }

    @Test
    @DisplayName("Should add urgency for a wide impact")
    void shouldAddUrgency() {
        ImpactAnalysis impact = new ImpactAnalysis(List.of(
                new AffectedService("a", 1, 1),
                new AffectedService("b", 2, 1),
                new AffectedService("c", 1, 2)), ImpactSeverity.HIGH, List.of());

        String text = Recommendations.forCandidate("db", List.of(anomaly(AnomalyKind.SLA_DROP)), impact);

        assertThat(text)
                .contains("Prioritise db: it affects 3 downstream services")
                .endsWith("Act immediately: impact severity is high");
    }

    @Test
    @DisplayName("Should fall back to a generic hint without anomalies")
    void shouldFallBack() {
        assertThat(Recommendations.forCandidate("db", List.of(), ImpactAnalysis.none()))
                .isEqualTo("Investigate the anomalies of db further");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Anomaly anomaly(AnomalyKind kind) {
        return Anomaly.builder()
                .service("db")
                .metric("m")
                .kind(kind)
                .priority(Priority.MEDIUM)
                .build();
    }
}
