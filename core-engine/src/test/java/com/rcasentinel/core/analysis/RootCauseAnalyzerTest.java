package com.rcasentinel.core.analysis;

import com.rcasentinel.core.config.AnalysisConfig;
import com.rcasentinel.core.graph.ServiceGraph;
import com.rcasentinel.core.model.AffectedService;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.Anomaly;
import com.rcasentinel.core.model.AnomalyBuckets;
import com.rcasentinel.core.model.AnomalyKind;
import com.rcasentinel.core.model.CallEdge;
import com.rcasentinel.core.model.DetectionResult;
import com.rcasentinel.core.model.ImpactSeverity;
import com.rcasentinel.core.model.MetricsSummary;
import com.rcasentinel.core.model.Priority;
import com.rcasentinel.core.model.RootCauseCandidate;
import com.rcasentinel.core.model.ServiceNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RootCauseAnalyzer}.
 */
class RootCauseAnalyzerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(T0.plusSeconds(60), ZoneOffset.UTC);

    private RootCauseAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new RootCauseAnalyzer(new AnalysisConfig(), CLOCK);
    }

    @Test
    @DisplayName("Should report a healthy system when there are no anomalies")
    void shouldReportHealthy() {
        AnalysisResult result = analyzer.analyze(chain("a", "b"), detection());

        assertThat(result.getRootCauses()).isEmpty();
        assertThat(result.getDiagnostics()).containsExactly(RootCauseAnalyzer.SYSTEM_HEALTHY);
        assertThat(result.getAnalysisTimestamp()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    @DisplayName("Should report missing data when the graph is empty")
    void shouldReportNoData() {
        AnalysisResult result = analyzer.analyze(ServiceGraph.build(List.of(), List.of()),
                detection(anomaly("a", Priority.HIGH, T0)));

        assertThat(result.getRootCauses()).isEmpty();
        assertThat(result.getDiagnostics()).contains(RootCauseAnalyzer.NO_DATA);
    }

    @Test
    @DisplayName("Should skip anomalies of services missing from the graph")
    void shouldSkipUnknownServices() {
        AnalysisResult result = analyzer.analyze(chain("a", "b"), detection(anomaly("ghost", Priority.HIGH, T0)));

        assertThat(result.getRootCauses()).isEmpty();
        assertThat(result.getDiagnostics())
                .contains("anomalies of unknown service 'ghost' skipped", RootCauseAnalyzer.NO_KNOWN_SERVICE);
    }

    @Test
    @DisplayName("Should blame the only anomalous service and never a healthy caller")
    void shouldNotBlameHealthyCallers() {
        AnalysisResult result = analyzer.analyze(chain("a", "b", "c"), detection(anomaly("c", Priority.HIGH, T0)));

        assertThat(result.getRootCauses()).singleElement().satisfies(candidate -> {
            assertThat(candidate.getRootService()).isEqualTo("c");
            assertThat(candidate.getRootCauseScore()).isCloseTo(3 * (1 + 0.25 * Math.log(2)), within(1e-9));
            assertThat(candidate.getUpstreamServices()).containsExactly("b");
            assertThat(candidate.getDownstreamServices()).isEmpty();
            assertThat(candidate.getCorrelatedServices()).isEmpty();
            assertThat(candidate.getImpactAnalysis().getImpactSeverity()).isEqualTo(ImpactSeverity.LOW);
        });
    }

    @Test
    @DisplayName("Should rank a correlated anomalous caller above its symptomatic callee")
    void shouldRankCorroboratedCallerFirst() {
        AnalysisResult result = analyzer.analyze(chain("a", "b", "c"), detection(
                anomaly("c", Priority.HIGH, T0),
                anomaly("b", Priority.HIGH, T0)));

        List<RootCauseCandidate> causes = result.getRootCauses();
        assertThat(causes).extracting(RootCauseCandidate::getRootService).containsExactly("b", "c");

        RootCauseCandidate top = causes.get(0);
        double criticality = Math.log(2) + 0.5 * Math.log(2);
        assertThat(top.getRootCauseScore()).isCloseTo(3 * (1 + 0.25 * criticality) + 1.5, within(1e-9));
        assertThat(top.getCorrelatedServices()).containsExactly("c");
        assertThat(top.getImpactAnalysis().getAffectedServices())
                .containsExactly(new AffectedService("c", 1, 1));
        assertThat(top.getImpactAnalysis().getImpactSeverity()).isEqualTo(ImpactSeverity.MEDIUM);
        assertThat(top.getImpactAnalysis().getPropagationPaths()).containsExactly("b -> c");
        assertThat(top.getRecommendation()).contains("Prioritise b").contains("1 downstream service");
        assertThat(top.getConfidence()).isGreaterThan(causes.get(1).getConfidence());
    }

    @Test
    @DisplayName("Should not propagate between anomalies outside the correlation window")
    void shouldIgnoreUncorrelatedAnomalies() {
        AnalysisResult result = analyzer.analyze(chain("a", "b", "c"), detection(
                anomaly("c", Priority.HIGH, T0.plus(Duration.ofMinutes(10))),
                anomaly("b", Priority.HIGH, T0)));

        RootCauseCandidate b = find(result, "b");
        double criticality = Math.log(2) + 0.5 * Math.log(2);
        assertThat(b.getRootCauseScore()).isCloseTo(3 * (1 + 0.25 * criticality), within(1e-9));
        assertThat(b.getCorrelatedServices()).isEmpty();
    }

    @Test
    @DisplayName("Should treat anomalies without timestamps as weakly correlated")
    void shouldUseWeakCorrelationWithoutTimestamps() {
        AnalysisResult result = analyzer.analyze(chain("b", "c"), detection(
                anomaly("c", Priority.HIGH, null),
                anomaly("b", Priority.HIGH, null)));

        RootCauseCandidate b = find(result, "b");
        double criticality = 0.5 * Math.log(2);
        double propagated = 0.5 * 3 * TemporalCorrelation.UNKNOWN_TIME_STRENGTH;
        assertThat(b.getRootCauseScore()).isCloseTo(3 * (1 + 0.25 * criticality) + propagated, within(1e-9));
        assertThat(b.getCorrelatedServices()).containsExactly("c");
    }

    @Test
    @DisplayName("Should decay propagation with hop distance and stop at maxDepth")
    void shouldBoundPropagation() {
        AnalysisConfig shallow = new AnalysisConfig();
        shallow.setMaxDepth(2);
        RootCauseAnalyzer bounded = new RootCauseAnalyzer(shallow, CLOCK);
        ServiceGraph graph = chain("a", "b", "c", "d");
        DetectionResult detection = detection(anomaly("a", Priority.HIGH, T0), anomaly("d", Priority.HIGH, T0));

        RootCauseCandidate boundedA = find(bounded.analyze(graph, detection), "a");
        RootCauseCandidate deepA = find(analyzer.analyze(graph, detection), "a");

        assertThat(boundedA.getCorrelatedServices()).isEmpty();
        assertThat(deepA.getCorrelatedServices()).containsExactly("d");
        assertThat(deepA.getRootCauseScore() - boundedA.getRootCauseScore()).isCloseTo(0.5 * 3 / 3, within(1e-9));
    }

    @Test
    @DisplayName("Should rank a service with more callers higher")
    void shouldWeighFanIn() {
        List<ServiceNode> nodes = new ArrayList<>();
        List<CallEdge> edges = new ArrayList<>();
        nodes.add(node("hub"));
        nodes.add(node("leaf"));
        nodes.add(node("leaf-caller"));
        edges.add(new CallEdge("leaf-caller", "leaf"));
        for (int i = 0; i < 10; i++) {
            nodes.add(node("caller-" + i));
            edges.add(new CallEdge("caller-" + i, "hub"));
        }
        ServiceGraph graph = ServiceGraph.build(nodes, edges);

        AnalysisResult result = analyzer.analyze(graph, detection(
                anomaly("leaf", Priority.LOW, T0),
                anomaly("hub", Priority.LOW, T0)));

        assertThat(result.getRootCauses()).extracting(RootCauseCandidate::getRootService)
                .containsExactly("hub", "leaf");
        assertThat(result.getRootCauses().get(0).getCriticalityScore()).isCloseTo(Math.log(11), within(1e-9));
    }

    @Test
    @DisplayName("Should keep an isolated low-priority anomaly as a candidate")
    void shouldKeepIsolatedAnomaly() {
        ServiceGraph graph = ServiceGraph.build(List.of(node("solo")), List.of());

        AnalysisResult result = analyzer.analyze(graph, detection(anomaly("solo", Priority.LOW, T0)));

        assertThat(result.getRootCauses()).singleElement().satisfies(candidate -> {
            assertThat(candidate.getRootCauseScore()).isEqualTo(RootCauseAnalyzer.UNIT_SCORE);
            assertThat(candidate.getRecommendation()).contains("solo");
        });
    }

    @Test
    @DisplayName("Should drop weak candidates once the correlation threshold exceeds their share of the top score")
    void shouldDropWeakCandidatesAboveThreshold() {
        List<ServiceNode> nodes = new ArrayList<>(List.of(node("hub"), node("solo")));
        List<CallEdge> edges = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            nodes.add(node("caller-" + i));
            edges.add(new CallEdge("caller-" + i, "hub"));
        }
        ServiceGraph graph = ServiceGraph.build(nodes, edges);
        DetectionResult detection = detection(anomaly("hub", Priority.HIGH, T0), anomaly("solo", Priority.LOW, T0));

        // solo scores 1.0 against 3 * (1 + 0.25 * ln 11) for the hub, a share of about 0.21
        assertThat(analyzerWithThreshold(0.0).analyze(graph, detection).getRootCauses())
                .extracting(RootCauseCandidate::getRootService).containsExactly("hub", "solo");
        assertThat(analyzerWithThreshold(0.2).analyze(graph, detection).getRootCauses())
                .extracting(RootCauseCandidate::getRootService).containsExactly("hub", "solo");
        assertThat(analyzerWithThreshold(0.25).analyze(graph, detection).getRootCauses())
                .extracting(RootCauseCandidate::getRootService).containsExactly("hub");
        assertThat(analyzerWithThreshold(1.0).analyze(graph, detection).getRootCauses())
                .extracting(RootCauseCandidate::getRootService).containsExactly("hub");
    }

    @Test
    @DisplayName("Should rate impact high when three or more anomalous services sit downstream")
    void shouldRateWideImpactHigh() {
        ServiceGraph graph = ServiceGraph.build(
                List.of(node("root"), node("x"), node("y"), node("z")),
                List.of(new CallEdge("root", "x"), new CallEdge("root", "y"), new CallEdge("x", "z")));

        AnalysisResult result = analyzer.analyze(graph, detection(
                anomaly("root", Priority.HIGH, T0),
                anomaly("x", Priority.MEDIUM, T0),
                anomaly("y", Priority.MEDIUM, T0),
                anomaly("z", Priority.LOW, T0)));

        RootCauseCandidate root = result.getRootCauses().get(0);
        assertThat(root.getRootService()).isEqualTo("root");
        assertThat(root.getImpactAnalysis().getImpactSeverity()).isEqualTo(ImpactSeverity.HIGH);
        assertThat(root.getImpactAnalysis().getAffectedServices())
                .extracting(AffectedService::getService).containsExactly("x", "y", "z");
        assertThat(root.getImpactAnalysis().getPropagationPaths())
                .containsExactly("root -> x", "root -> y", "root -> x -> z");
        assertThat(root.getRecommendation()).contains("Act immediately");
    }

    @Test
    @DisplayName("Should produce sorted, bounded and order-independent output")
    void shouldBeDeterministic() {
        ServiceGraph graph = ServiceGraph.build(
                List.of(node("a"), node("b"), node("c"), node("d")),
                List.of(new CallEdge("a", "b"), new CallEdge("a", "c"), new CallEdge("c", "d")));
        List<Anomaly> anomalies = new ArrayList<>(List.of(
                anomaly("a", Priority.LOW, T0),
                anomaly("b", Priority.MEDIUM, T0.plusSeconds(30)),
                anomaly("c", Priority.HIGH, T0.plusSeconds(60)),
                anomaly("d", Priority.MEDIUM, null)));

        AnalysisResult first = analyzer.analyze(graph, detection(anomalies.toArray(new Anomaly[0])));
        Collections.reverse(anomalies);
        AnalysisResult second = analyzer.analyze(graph, detection(anomalies.toArray(new Anomaly[0])));

        assertThat(second).isEqualTo(first);
        assertThat(first.getRootCauses()).isSortedAccordingTo(RootCauseAnalyzer.RANKING);
        assertThat(first.getRootCauses()).allSatisfy(candidate -> {
            assertThat(candidate.getConfidence()).isBetween(0.0, 1.0);
            assertThat(candidate.getRootCauseScore()).isPositive();
        });
    }

    @Test
    @DisplayName("Should carry graph warnings into the diagnostics")
    void shouldReportGraphWarnings() {
        ServiceGraph graph = ServiceGraph.build(List.of(node("a")), List.of(new CallEdge("a", "missing")));

        AnalysisResult result = analyzer.analyze(graph, detection(anomaly("a", Priority.MEDIUM, T0)));

        assertThat(result.getDiagnostics()).anyMatch(d -> d.contains("missing"));
        assertThat(result.getServiceGraphStats().getDroppedEdges()).isEqualTo(1);
        assertThat(result.getRootCauses()).hasSize(1);
    }

    @Test
    @DisplayName("Should compute criticality from fan-in and fan-out")
    void shouldComputeCriticality() {
        assertThat(RootCauseAnalyzer.criticality(0, 0)).isZero();
        assertThat(RootCauseAnalyzer.criticality(3, 1)).isCloseTo(Math.log(4) + 0.5 * Math.log(2), within(1e-12));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RootCauseAnalyzer analyzerWithThreshold(double threshold) {
        AnalysisConfig config = new AnalysisConfig();
        config.setCorrelationThreshold(threshold);
        return new RootCauseAnalyzer(config, CLOCK);
    }

    private static ServiceGraph chain(String... ids) {
        List<ServiceNode> nodes = Arrays.stream(ids).map(RootCauseAnalyzerTest::node).toList();
        List<CallEdge> edges = new ArrayList<>();
        for (int i = 0; i + 1 < ids.length; i++) {
            edges.add(new CallEdge(ids[i], ids[i + 1]));
        }
        return ServiceGraph.build(nodes, edges);
    }

    private static ServiceNode node(String id) {
        return new ServiceNode(id, id, true);
    }

    private static Anomaly anomaly(String service, Priority priority, Instant observedAt) {
        return Anomaly.builder()
                .service(service)
                .metric("service_resp_time")
                .kind(AnomalyKind.LATENCY_SPIKE)
                .priority(priority)
                .observedValue(1500)
                .threshold(1000.0)
                .deviation(0.5)
                .observedAt(observedAt)
                .description("Latency spike on " + service)
                .build();
    }

    private static DetectionResult detection(Anomaly... anomalies) {
        List<Anomaly> list = Arrays.asList(anomalies);
        long services = list.stream().map(Anomaly::getService).distinct().count();
        return new DetectionResult(AnomalyBuckets.of(list), T0,
                new MetricsSummary((int) services, (int) services, list.size()));
    }

    private static RootCauseCandidate find(AnalysisResult result, String service) {
        return result.getRootCauses().stream()
                .filter(candidate -> candidate.getRootService().equals(service))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No candidate for " + service));
    }
}
