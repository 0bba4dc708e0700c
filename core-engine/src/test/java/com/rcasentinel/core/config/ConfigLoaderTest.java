package com.rcasentinel.core.config;

import com.rcasentinel.core.model.MetricKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaults() {
        RcaConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        DetectionConfig detection = config.getAnomalyDetection();
        assertThat(detection.getResponseTimeThreshold()).isEqualTo(1000.0);
        assertThat(detection.getAlgorithms()).containsExactly("threshold", "z_score", "variability");
        assertThat(detection.kindOf("service_cpm")).contains(MetricKind.THROUGHPUT);
        assertThat(config.getRootCauseAnalysis().getMaxDepth()).isEqualTo(5);
        assertThat(config.getRootCauseAnalysis().getCorrelationThreshold()).isEqualTo(0.1);
        assertThat(config.getPipeline().isNarrativeEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should load overrides and keep defaults for omitted settings")
    void shouldLoadOverrides() {
        RcaConfig config = ConfigLoader.fromClasspath("config/test-rca.yml");

        DetectionConfig detection = config.getAnomalyDetection();
        assertThat(detection.getResponseTimeThreshold()).isEqualTo(500.0);
        assertThat(detection.getErrorRateThreshold()).isEqualTo(2.5);
        assertThat(detection.getSlaThreshold()).isEqualTo(95.0);
        assertThat(detection.getAlgorithms()).containsExactly("threshold", "variability");
        assertThat(detection.getRecentSamples()).isEqualTo(2);
        assertThat(detection.isParallel()).isTrue();
        assertThat(detection.kindOf("p99_latency_ms")).contains(MetricKind.LATENCY);
        assertThat(detection.kindOf("service_resp_time")).isEmpty();
        assertThat(config.getRootCauseAnalysis().getMaxDepth()).isEqualTo(3);
        assertThat(config.getRootCauseAnalysis().getTimeCorrelationWindow()).isEqualTo(5);
        assertThat(config.getPipeline().getSummaryTopN()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should list every invalid setting in one error")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("config/invalid-rca.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("responseTimeThreshold")
                .hasMessageContaining("isolation_forest")
                .hasMessageContaining("maxDepth")
                .hasMessageContaining("correlationThreshold")
                .hasMessageContaining("summaryTopN");
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("config/malformed-rca.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed RCA config");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        RcaConfig config = ConfigLoader.fromClasspath("config/empty-rca.yml");

        assertThat(config.getAnomalyDetection().getAlgorithms()).containsExactly("threshold", "z_score");
        assertThat(config.getRootCauseAnalysis().getMaxDepth()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file system path")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("rca.yml");
        Files.writeString(file, "rootCauseAnalysis:\n  maxDepth: 7\n");

        RcaConfig config = ConfigLoader.load(file.toString());

        assertThat(config.getRootCauseAnalysis().getMaxDepth()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should throw when the config file does not exist")
    void shouldThrowForMissingFile() {
        String missing = tempDir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> ConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Should fall back to the classpath default when the path does not exist")
    void shouldFallBackToClasspath() {
        RcaConfig config = ConfigLoader.load(tempDir.resolve("missing.yml").toString());

        assertThat(config.getAnomalyDetection().getAlgorithms()).contains("variability");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() throws IOException {
        Path file = tempDir.resolve("dup.yml");
        Files.writeString(file, "rootCauseAnalysis:\n  maxDepth: 3\n  maxDepth: 4\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }
}
