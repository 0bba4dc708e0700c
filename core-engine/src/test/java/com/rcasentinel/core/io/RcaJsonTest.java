package com.rcasentinel.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.rcasentinel.core.config.RcaConfig;
import com.rcasentinel.core.model.AnalysisReport;
import com.rcasentinel.core.model.CallEdge;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.ReportStatus;
import com.rcasentinel.core.model.ServiceNode;
import com.rcasentinel.core.model.ServiceSnapshot;
import com.rcasentinel.core.model.Snapshot;
import com.rcasentinel.core.model.Topology;
import com.rcasentinel.core.pipeline.RcaPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RcaJson}.
 */
class RcaJsonTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("Should write reports with snake_case keys and lowercase labels")
    void shouldWriteWireFormat() throws IOException {
        AnalysisReport report = findingsReport();

        JsonNode tree = RcaJson.objectMapper().readTree(RcaJson.writeReport(report));

        assertThat(tree.get("status").asText()).isEqualTo("findings");
        assertThat(tree.at("/detection/detection_timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(tree.at("/detection/metrics_summary/total_services").asInt()).isEqualTo(1);
        assertThat(tree.at("/detection/anomalies/medium_priority/0/kind").asText()).isEqualTo("latency_spike");
        assertThat(tree.at("/detection/anomalies/medium_priority/0/priority").asText()).isEqualTo("medium");
        assertThat(tree.at("/detection/anomalies/medium_priority/0/observed_value").asDouble()).isEqualTo(1500.0);
        assertThat(tree.at("/detection/anomalies/medium_priority/0").has("z_score")).isFalse();
        assertThat(tree.at("/analysis/service_graph_stats/edges").asInt()).isEqualTo(1);
        assertThat(tree.at("/analysis/root_causes/0/root_service").asText()).isEqualTo("b");
        assertThat(tree.at("/analysis/root_causes/0/impact_analysis/impact_severity").asText()).isEqualTo("low");
    }

    @Test
    @DisplayName("Should read back an equal report")
    void shouldReadBackEqualReport() throws IOException {
        AnalysisReport report = findingsReport();

        assertThat(RcaJson.readReport(RcaJson.writeReport(report))).isEqualTo(report);
    }

    @Test
    @DisplayName("Should omit absent sections of a no-data report")
    void shouldOmitAbsentSections() throws IOException {
        AnalysisReport report = AnalysisReport.noData("snapshot source returned no snapshot");

        JsonNode tree = RcaJson.objectMapper().readTree(RcaJson.writeReport(report));

        assertThat(tree.get("status").asText()).isEqualTo("no_data");
        assertThat(tree.has("detection")).isFalse();
        assertThat(tree.has("analysis")).isFalse();
        assertThat(tree.get("diagnostics").get(0).asText()).isEqualTo("snapshot source returned no snapshot");
        assertThat(RcaJson.readReport(RcaJson.writeReport(report)).getStatus()).isEqualTo(ReportStatus.NO_DATA);
    }

    @Test
    @DisplayName("Should ignore unknown properties when reading")
    void shouldIgnoreUnknownProperties() throws IOException {
        String json = "{\"status\":\"healthy\",\"schema_version\":2,\"diagnostics\":[]}";

        AnalysisReport report = RcaJson.readReport(json.getBytes(StandardCharsets.UTF_8));

        assertThat(report.getStatus()).isEqualTo(ReportStatus.HEALTHY);
        assertThat(report.getNarratives()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static AnalysisReport findingsReport() {
        Topology topology = new Topology(
                List.of(new ServiceNode("a", "a", true), new ServiceNode("b", "b", true)),
                List.of(new CallEdge("a", "b")));
        Snapshot snapshot = new Snapshot(NOW, topology, List.of(
                ServiceSnapshot.of("a", List.of(MetricSeries.of("service_resp_time", 100, 100, 100))),
                ServiceSnapshot.of("b", List.of(MetricSeries.of("service_resp_time", 1500, 1500, 1500)))));
        RcaPipeline pipeline = new RcaPipeline(RcaConfig.defaults(), null, Clock.fixed(NOW, ZoneOffset.UTC));
        return pipeline.analyze(snapshot);
    }
}
