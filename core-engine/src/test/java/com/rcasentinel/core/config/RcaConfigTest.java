package com.rcasentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RcaConfig} and its sections.
 */
class RcaConfigTest {

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        assertThatCode(() -> RcaConfig.defaults().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should replace a null section with its defaults")
    void shouldDefaultNullSections() {
        RcaConfig config = new RcaConfig();
        config.setAnomalyDetection(null);
        config.setRootCauseAnalysis(null);
        config.setPipeline(null);

        assertThat(config.getAnomalyDetection()).isNotNull();
        assertThat(config.getRootCauseAnalysis().getMaxDepth()).isEqualTo(5);
        assertThat(config.getPipeline().getSummaryTopN()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should normalise algorithm names")
    void shouldNormaliseAlgorithms() {
        DetectionConfig config = new DetectionConfig();
        config.setAlgorithms(List.of(" Z_Score ", "THRESHOLD"));

        assertThat(config.getAlgorithms()).containsExactly("z_score", "threshold");
        assertThat(config.isEnabled("z_score")).isTrue();
        assertThat(config.isEnabled("variability")).isFalse();
    }

    @Test
    @DisplayName("Should reject an empty algorithm list")
    void shouldRejectNoAlgorithms() {
        DetectionConfig config = new DetectionConfig();
        config.setAlgorithms(List.of());

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("algorithms");
    }

    @Test
    @DisplayName("Should reject a metric mapped to an unknown kind")
    void shouldRejectUnknownMetricKind() {
        DetectionConfig config = new DetectionConfig();
        config.setMetricKinds(Map.of("queue_depth", "BACKLOG"));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("queue_depth");
    }

    @Test
    @DisplayName("Should reject out-of-range analysis settings")
    void shouldRejectBadAnalysisSettings() {
        AnalysisConfig config = new AnalysisConfig();
        config.setMaxDepth(33);
        config.setTimeCorrelationWindow(0);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxDepth")
                .hasMessageContaining("timeCorrelationWindow");
    }
}
