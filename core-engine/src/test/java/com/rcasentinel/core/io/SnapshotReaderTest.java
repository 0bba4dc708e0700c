package com.rcasentinel.core.io;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.rcasentinel.core.model.CallEdge;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.Sample;
import com.rcasentinel.core.model.ServiceNode;
import com.rcasentinel.core.model.ServiceSnapshot;
import com.rcasentinel.core.model.Snapshot;
import com.rcasentinel.core.model.TraceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SnapshotReader}.
 */
class SnapshotReaderTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SnapshotReader reader;

    @BeforeEach
    void setUp() {
        reader = new SnapshotReader();
    }

    @Test
    @DisplayName("Should read topology nodes and calls, skipping incomplete entries")
    void shouldReadTopology() throws IOException {
        Snapshot snapshot = readSample();

        assertThat(snapshot.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(snapshot.getTopology().getNodes()).containsExactly(
                new ServiceNode("gw", "gateway", true),
                new ServiceNode("ord", "orders", true),
                new ServiceNode("db", "postgres", false),
                new ServiceNode("payments", "payments", true));
        assertThat(snapshot.getTopology().getCalls()).containsExactly(
                new CallEdge("gw", "ord"),
                new CallEdge("ord", "db"),
                new CallEdge("ord", "payments"));
    }

    @Test
    @DisplayName("Should unwrap every supported metric series envelope")
    void shouldUnwrapSeriesEnvelopes() throws IOException {
        ServiceSnapshot orders = readSample().getServices().get(0);

        assertThat(orders.getId()).isEqualTo("ord");
        assertThat(orders.getMetrics()).containsOnlyKeys("service_resp_time", "service_cpm", "service_sla");

        MetricSeries latency = orders.getMetrics().get("service_resp_time");
        assertThat(latency.getSamples()).extracting(Sample::getValue).containsExactly(100.0, 110.0, 90.0, 1500.0);
        assertThat(latency.getSamples()).extracting(Sample::getTimestamp).containsExactly(
                Instant.parse("2024-03-01T11:55:00Z"),
                Instant.parse("2024-03-01T11:56:00Z"),
                Instant.parse("2024-03-01T11:57:00Z"),
                Instant.parse("2024-03-01T11:59:00Z"));

        assertThat(orders.getMetrics().get("service_sla").getSamples())
                .extracting(Sample::getValue).containsExactly(99.5, 99.1);
    }

    @Test
    @DisplayName("Should keep non-numeric points as NaN and drop null points")
    void shouldFlagNonNumericPoints() throws IOException {
        MetricSeries throughput = readSample().getServices().get(0).getMetrics().get("service_cpm");

        assertThat(throughput.size()).isEqualTo(3);
        assertThat(throughput.getSamples().get(2).getValue()).isNaN();
    }

    @Test
    @DisplayName("Should read traces, instances and top-level service identities")
    void shouldReadTracesAndInstances() throws IOException {
        Snapshot snapshot = readSample();
        ServiceSnapshot orders = snapshot.getServices().get(0);

        assertThat(orders.getTraces()).containsExactly(
                new TraceRecord(820, Instant.parse("2024-03-01T11:58:20Z"), false),
                new TraceRecord(1210, Instant.parse("2024-03-01T11:58:30Z"), true),
                new TraceRecord(95, null, true));
        assertThat(orders.getInstances()).containsExactly("ord-1", "ord-2");

        assertThat(snapshot.getServices()).hasSize(2);
        assertThat(snapshot.getServices().get(1).getName()).isEqualTo("gateway");
        assertThat(snapshot.getServices().get(1).getMetrics().get("service_error_rate").size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should accept a document with nothing but an empty object")
    void shouldReadEmptyObject() throws IOException {
        Snapshot snapshot = reader.read("{}".getBytes(StandardCharsets.UTF_8));

        assertThat(snapshot.getTimestamp()).isNull();
        assertThat(snapshot.getTopology().getNodes()).isEmpty();
        assertThat(snapshot.getServices()).isEmpty();
    }

    @Test
    @DisplayName("Should reject documents that are not JSON objects")
    void shouldRejectNonObjects() {
        assertThatThrownBy(() -> reader.read("[1, 2]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(SnapshotFormatException.class)
                .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> reader.read("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(SnapshotFormatException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    @DisplayName("Should parse epoch seconds, epoch millis and ISO-8601 timestamps")
    void shouldParseTimestamps() {
        Instant expected = Instant.parse("2024-03-01T12:00:00Z");

        assertThat(SnapshotReader.parseInstant(NODES.numberNode(1709294400L))).isEqualTo(expected);
        assertThat(SnapshotReader.parseInstant(NODES.numberNode(1709294400000L))).isEqualTo(expected);
        assertThat(SnapshotReader.parseInstant(NODES.numberNode(1709294400.5)))
                .isEqualTo(expected.plusMillis(500));
        assertThat(SnapshotReader.parseInstant(NODES.textNode("1709294400"))).isEqualTo(expected);
        assertThat(SnapshotReader.parseInstant(NODES.textNode("2024-03-01T13:00:00+01:00"))).isEqualTo(expected);
        assertThat(SnapshotReader.parseInstant(NODES.textNode("2024-03-01T12:00:00"))).isEqualTo(expected);
        assertThat(SnapshotReader.parseInstant(NODES.textNode("yesterday"))).isNull();
        assertThat(SnapshotReader.parseInstant(NODES.nullNode())).isNull();
        assertThat(SnapshotReader.parseInstant(null)).isNull();
    }

    @Test
    @DisplayName("Should read plain arrays of numbers as untimed samples")
    void shouldReadPlainArrays() {
        List<Sample> samples = SnapshotReader.readSamples(NODES.arrayNode().add(1).add(2.5).add("3"));

        assertThat(samples).containsExactly(Sample.of(1), Sample.of(2.5), Sample.of(3));
        assertThat(SnapshotReader.readSamples(NODES.textNode("oops"))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Snapshot readSample() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/snapshots/sample-snapshot.json")) {
            assertThat(in).as("sample snapshot fixture").isNotNull();
            return reader.read(in);
        }
    }
}
