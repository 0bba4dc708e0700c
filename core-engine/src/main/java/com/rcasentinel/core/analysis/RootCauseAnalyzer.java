package com.rcasentinel.core.analysis;

import com.rcasentinel.core.config.AnalysisConfig;
import com.rcasentinel.core.graph.ServiceGraph;
import com.rcasentinel.core.model.AffectedService;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.Anomaly;
import com.rcasentinel.core.model.DetectionResult;
import com.rcasentinel.core.model.ImpactAnalysis;
import com.rcasentinel.core.model.ImpactSeverity;
import com.rcasentinel.core.model.RootCauseCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns a flat anomaly set into a ranked list of likely originating services.
 *
 * <h3>Scoring</h3>
 * <p>
 * For every service {@code s} owning anomalies:
 * </p>
 * <ul>
 * <li>{@code density(s)} is the sum of the priority weights of its
 * anomalies</li>
 * <li>{@code criticality(s) = ln(1 + fanIn) + 0.5 * ln(1 + fanOut)}, applied
 * as the multiplier {@code 1 + 0.25 * criticality}</li>
 * <li>every anomalous service {@code u} within {@code maxDepth} hops upstream
 * of {@code s}, temporally correlated with {@code s} at strength {@code c},
 * receives {@code 0.5 * density(s) * c / hops}</li>
 * </ul>
 * <p>
 * {@code score = density * multiplier + received propagation}. Blame only
 * flows toward callers that have symptoms of their own; a healthy caller is
 * never a candidate.
 * </p>
 * <p>
 * A candidate whose score divided by the best score of the pass is below
 * {@code correlationThreshold} is dropped.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Services are processed in id order and ties are broken by confidence,
 * criticality and id. The only clock read is the output timestamp.
 * </p>
 *
 * @since 1.0.0
 */
public class RootCauseAnalyzer implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RootCauseAnalyzer.class);

    public static final String SYSTEM_HEALTHY = "system healthy";
    public static final String NO_DATA = "no data to analyze";
    public static final String NO_KNOWN_SERVICE = "no anomalous service maps onto a known graph node";

    static final double CRITICALITY_WEIGHT = 0.25;
    static final double FAN_OUT_WEIGHT = 0.5;
    static final double PROPAGATION_FACTOR = 0.5;

    /** Score of a single low-priority anomaly on an isolated service. */
    static final double UNIT_SCORE = 1.0;

    /** Ranking order: score, confidence and criticality descending, then id. */
    static final Comparator<RootCauseCandidate> RANKING = Comparator
            .comparingDouble(RootCauseCandidate::getRootCauseScore).reversed()
            .thenComparing(Comparator.comparingDouble(RootCauseCandidate::getConfidence).reversed())
            .thenComparing(Comparator.comparingDouble(RootCauseCandidate::getCriticalityScore).reversed())
            .thenComparing(RootCauseCandidate::getRootService);

    private final AnalysisConfig config;
    private final TemporalCorrelation correlation;
    private final Clock clock;

    /**
     * @param config analyzer settings; validated here
     * @param clock  source of the analysis timestamp
     * @throws IllegalStateException if the settings are invalid
     */
    public RootCauseAnalyzer(AnalysisConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();
        this.correlation = new TemporalCorrelation(Duration.ofMinutes(config.getTimeCorrelationWindow()));
    }

    public RootCauseAnalyzer(AnalysisConfig config) {
        this(config, Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Rank the services owning anomalies in {@code detection}.
     *
     * @param graph     the call graph of the snapshot
     * @param detection detector output
     * @return ranked candidates and diagnostics; never {@code null}
     */
    public AnalysisResult analyze(ServiceGraph graph, DetectionResult detection) {
        Objects.requireNonNull(graph, "ServiceGraph must not be null");
        Objects.requireNonNull(detection, "DetectionResult must not be null");

        List<String> diagnostics = new ArrayList<>(graph.warnings());
        List<Anomaly> anomalies = detection.getAnomalies().all();

        if (anomalies.isEmpty()) {
            LOG.info("No anomalies to analyse: system healthy");
            diagnostics.add(SYSTEM_HEALTHY);
            return result(graph, List.of(), diagnostics);
        }
        if (graph.isEmpty()) {
            LOG.warn("Service graph is empty, {} anomalies cannot be attributed", anomalies.size());
            diagnostics.add(NO_DATA);
            return result(graph, List.of(), diagnostics);
        }

        SortedMap<String, List<Anomaly>> byService = groupByService(graph, anomalies, diagnostics);
        if (byService.isEmpty()) {
            LOG.warn("None of the {} anomalies belongs to a known service", anomalies.size());
            diagnostics.add(NO_KNOWN_SERVICE);
            return result(graph, List.of(), diagnostics);
        }

        LOG.info("Analysing {} anomalies on {} service(s), maxDepth={}", anomalies.size(), byService.size(),
                config.getMaxDepth());

        Map<String, Propagation> received = propagate(graph, byService);

        List<RootCauseCandidate> scored = new ArrayList<>();
        for (Map.Entry<String, List<Anomaly>> entry : byService.entrySet()) {
            scored.add(score(graph, entry.getKey(), entry.getValue(),
                    received.getOrDefault(entry.getKey(), Propagation.NONE), byService));
        }
        List<RootCauseCandidate> candidates = keepCorrelated(scored, config.getCorrelationThreshold());
        candidates.sort(RANKING);

        if (!candidates.isEmpty()) {
            RootCauseCandidate top = candidates.get(0);
            LOG.info("Identified {} root-cause candidate(s); top: {} (score={}, confidence={})",
                    candidates.size(), top.getRootService(), top.getRootCauseScore(), top.getConfidence());
        }
        return result(graph, candidates, diagnostics);
    }

    /**
     * Drop candidates whose score, normalized by the best score of the pass,
     * falls below {@code threshold}. The best candidate always survives.
     */
    static List<RootCauseCandidate> keepCorrelated(List<RootCauseCandidate> scored, double threshold) {
        double maxScore = scored.stream().mapToDouble(RootCauseCandidate::getRootCauseScore).max().orElse(0);
        List<RootCauseCandidate> kept = new ArrayList<>();
        for (RootCauseCandidate candidate : scored) {
            double normalized = maxScore > 0 ? candidate.getRootCauseScore() / maxScore : 1;
            if (normalized < threshold) {
                LOG.debug("Dropping candidate '{}': normalized score {} below {}", candidate.getRootService(),
                        normalized, threshold);
                continue;
            }
            kept.add(candidate);
        }
        return kept;
    }

    private AnalysisResult result(ServiceGraph graph, List<RootCauseCandidate> candidates,
            List<String> diagnostics) {
        return new AnalysisResult(clock.instant(), graph.stats(), candidates, diagnostics);
    }

    // ---------------------------------------------------------------
    // Steps
    // ---------------------------------------------------------------

    private static SortedMap<String, List<Anomaly>> groupByService(ServiceGraph graph, List<Anomaly> anomalies,
            List<String> diagnostics) {
        SortedMap<String, List<Anomaly>> byService = new TreeMap<>();
        SortedSet<String> unknown = new TreeSet<>();
        for (Anomaly anomaly : anomalies) {
            Optional<String> id = graph.resolve(anomaly.getService());
            if (id.isEmpty()) {
                unknown.add(anomaly.getService());
                continue;
            }
            byService.computeIfAbsent(id.get(), k -> new ArrayList<>()).add(anomaly);
        }
        for (String service : unknown) {
            LOG.warn("Skipping anomalies of unknown service '{}'", service);
            diagnostics.add("anomalies of unknown service '" + service + "' skipped");
        }
        return byService;
    }

    /**
     * Push a decayed share of every anomalous service's density to the
     * anomalous services upstream of it.
     */
    private Map<String, Propagation> propagate(ServiceGraph graph, SortedMap<String, List<Anomaly>> byService) {
        Map<String, Propagation> received = new TreeMap<>();
        for (Map.Entry<String, List<Anomaly>> entry : byService.entrySet()) {
            String symptom = entry.getKey();
            double density = density(entry.getValue());
            Map<String, Integer> upstream = graph.upstreamDistances(symptom, config.getMaxDepth());
            for (Map.Entry<String, Integer> hop : upstream.entrySet()) {
                List<Anomaly> callerAnomalies = byService.get(hop.getKey());
                if (callerAnomalies == null) {
                    continue;
                }
                double strength = correlation.strongest(callerAnomalies, entry.getValue());
                if (strength <= 0) {
                    continue;
                }
                double contribution = PROPAGATION_FACTOR * density * strength / hop.getValue();
                received.computeIfAbsent(hop.getKey(), k -> new Propagation())
                        .add(symptom, contribution, TemporalCorrelation.isStrong(strength));
                LOG.debug("Propagated {} from '{}' to '{}' ({} hop(s), strength {})",
                        contribution, symptom, hop.getKey(), hop.getValue(), strength);
            }
        }
        return received;
    }

    private RootCauseCandidate score(ServiceGraph graph, String service, List<Anomaly> anomalies,
            Propagation propagation, Map<String, List<Anomaly>> byService) {
        double criticality = criticality(graph.fanIn(service), graph.fanOut(service));
        double local = density(anomalies) * (1 + CRITICALITY_WEIGHT * criticality);
        double score = local + propagation.total();
        ImpactAnalysis impact = impact(graph, service, byService);

        return RootCauseCandidate.builder()
                .rootService(service)
                .rootCauseScore(score)
                .confidence(confidence(anomalies.size(), score, propagation))
                .criticalityScore(criticality)
                .anomalies(anomalies)
                .impactAnalysis(impact)
                .upstreamServices(new ArrayList<>(graph.upstream(service)))
                .downstreamServices(new ArrayList<>(graph.downstream(service)))
                .correlatedServices(new ArrayList<>(propagation.sources))
                .recommendation(Recommendations.forCandidate(service, anomalies, impact))
                .build();
    }

    private ImpactAnalysis impact(ServiceGraph graph, String service, Map<String, List<Anomaly>> byService) {
        List<AffectedService> affected = new ArrayList<>();
        List<String> paths = new ArrayList<>();
        graph.downstreamDistances(service, config.getMaxDepth()).entrySet().stream()
                .filter(e -> byService.containsKey(e.getKey()))
                .sorted(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .forEach(e -> {
                    affected.add(new AffectedService(e.getKey(), byService.get(e.getKey()).size(), e.getValue()));
                    paths.add(String.join(" -> ", graph.shortestPath(service, e.getKey(), config.getMaxDepth())));
                });
        return new ImpactAnalysis(affected, ImpactSeverity.forAffectedCount(affected.size()), paths);
    }

    // ---------------------------------------------------------------
    // Formula
    // ---------------------------------------------------------------

    static double density(List<Anomaly> anomalies) {
        double sum = 0;
        for (Anomaly anomaly : anomalies) {
            sum += anomaly.getPriority().weight();
        }
        return sum;
    }

    static double criticality(int fanIn, int fanOut) {
        return Math.log1p(fanIn) + FAN_OUT_WEIGHT * Math.log1p(fanOut);
    }

    /**
     * Confidence grows with the number of own anomalies, the share of the
     * score contributed by correlated downstream symptoms (strong ones count
     * more) and the number of corroborating services.
     */
    static double confidence(int ownAnomalies, double score, Propagation propagation) {
        double strongShare = score > 0 ? propagation.strong / score : 0;
        double weakShare = score > 0 ? propagation.weak / score : 0;
        double value = 0.3
                + 0.2 * Math.min(1.0, (ownAnomalies - 1) / 2.0)
                + 0.35 * strongShare
                + 0.15 * weakShare
                + 0.05 * Math.min(1.0, propagation.sources.size() / 2.0);
        return Math.max(0.0, Math.min(1.0, value));
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    /** Contributions received by one upstream service. */
    static final class Propagation {

        static final Propagation NONE = new Propagation();

        private double strong;
        private double weak;
        private final SortedSet<String> sources = new TreeSet<>();

        void add(String source, double contribution, boolean isStrong) {
            if (isStrong) {
                strong += contribution;
            } else {
                weak += contribution;
            }
            sources.add(source);
        }

        double total() {
            return strong + weak;
        }
    }
}
