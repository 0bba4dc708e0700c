package com.rcasentinel.core.detection;

import com.rcasentinel.core.config.DetectionConfig;
import com.rcasentinel.core.model.AnomalyKind;
import com.rcasentinel.core.model.MetricKind;
import com.rcasentinel.core.model.MetricSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ThresholdCheck}.
 */
class ThresholdCheckTest {

    private ThresholdCheck check;

    @BeforeEach
    void setUp() {
        check = new ThresholdCheck(new DetectionConfig());
    }

    @Test
    @DisplayName("Should fire when latency exceeds the response time threshold")
    void shouldFireOnHighLatency() {
        Optional<CheckResult> result = check.evaluate(window(MetricKind.LATENCY, 1200, 1300, 1100));

        assertThat(result).isPresent();
        assertThat(result.get().getKind()).isEqualTo(AnomalyKind.LATENCY_SPIKE);
        assertThat(result.get().getThreshold()).isEqualTo(1000.0);
        assertThat(result.get().getDeviation()).isCloseTo(0.2, within(1e-9));
        assertThat(result.get().isAbsolute()).isTrue();
        assertThat(result.get().isMarginal()).isFalse();
    }

    @Test
    @DisplayName("Should NOT fire when latency stays below the threshold")
    void shouldNotFireOnNormalLatency() {
        assertThat(check.evaluate(window(MetricKind.LATENCY, 200, 250, 300))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when the error rate equals the threshold exactly")
    void shouldNotFireAtExactErrorRate() {
        assertThat(check.evaluate(window(MetricKind.ERROR_RATE, 5, 5, 5))).isEmpty();
    }

    @Test
    @DisplayName("Should fire when the success ratio falls below the SLA")
    void shouldFireOnSlaDrop() {
        Optional<CheckResult> result = check.evaluate(window(MetricKind.SUCCESS_RATIO, 99, 99, 99, 90, 91, 89));

        assertThat(result).isPresent();
        assertThat(result.get().getKind()).isEqualTo(AnomalyKind.SLA_DROP);
        assertThat(result.get().getThreshold()).isEqualTo(95.0);
    }

    @Test
    @DisplayName("Should fire when throughput drops below the baseline by more than the configured share")
    void shouldFireOnThroughputDrop() {
        Optional<CheckResult> result = check.evaluate(window(MetricKind.THROUGHPUT, 100, 100, 100, 50, 50, 50));

        assertThat(result).isPresent();
        assertThat(result.get().getKind()).isEqualTo(AnomalyKind.THROUGHPUT_DROP);
        assertThat(result.get().getThreshold()).isCloseTo(70.0, within(1e-9));
    }

    @Test
    @DisplayName("Should NOT judge throughput without a baseline")
    void shouldSkipThroughputWithoutBaseline() {
        assertThat(check.evaluate(window(MetricKind.THROUGHPUT, 1, 1, 1))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire on a moderate throughput dip")
    void shouldNotFireOnModerateDip() {
        assertThat(check.evaluate(window(MetricKind.THROUGHPUT, 100, 100, 100, 80, 80, 80))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SeriesWindow window(MetricKind kind, double... values) {
        return SeriesWindow.of(MetricSeries.of("metric", values), kind, 3);
    }
}
