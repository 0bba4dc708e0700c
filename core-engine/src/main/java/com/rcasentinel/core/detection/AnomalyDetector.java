package com.rcasentinel.core.detection;

import com.rcasentinel.core.config.DetectionConfig;
import com.rcasentinel.core.graph.ServiceGraph;
import com.rcasentinel.core.model.Anomaly;
import com.rcasentinel.core.model.AnomalyBuckets;
import com.rcasentinel.core.model.AnomalyKind;
import com.rcasentinel.core.model.DetectionResult;
import com.rcasentinel.core.model.MetricKind;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.MetricsSummary;
import com.rcasentinel.core.model.Priority;
import com.rcasentinel.core.model.Sample;
import com.rcasentinel.core.model.ServiceSnapshot;
import com.rcasentinel.core.model.Snapshot;
import com.rcasentinel.core.model.TraceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Runs the configured {@link MetricCheck}s over every (service, metric) pair
 * of a snapshot and groups the resulting anomalies by priority.
 *
 * <h3>Priority</h3>
 * <p>
 * Results of one series are grouped by anomaly kind. A kind flagged by both
 * an absolute and a statistical rule is {@code high}; a single non-marginal
 * rule gives {@code medium}; a marginal statistical deviation alone gives
 * {@code low}.
 * </p>
 *
 * <h3>Data quality</h3>
 * <p>
 * Empty series contribute nothing. Malformed series are skipped with a
 * warning; neither aborts the pass.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless between calls. With {@code parallel} enabled services are
 * evaluated on a parallel stream and merged in encounter order, so the
 * buckets are identical to a sequential run.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /** Name of the series derived from trace durations. */
    public static final String TRACE_DURATION = "trace_duration";

    /** Name of the series derived from the share of failed traces. */
    public static final String TRACE_ERROR_RATE = "trace_error_rate";

    private final DetectionConfig config;
    private final List<MetricCheck> checks;
    private final Clock clock;

    /**
     * @param config detector settings; validated here
     * @param clock  source of the detection timestamp
     * @throws IllegalStateException if the settings are invalid
     */
    public AnomalyDetector(DetectionConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();
        this.checks = CheckFactory.createAll(config);
    }

    public AnomalyDetector(DetectionConfig config) {
        this(config, Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public DetectionResult detect(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        return detect(snapshot, ServiceGraph.from(snapshot.getTopology()));
    }

    /**
     * Evaluate every service of {@code snapshot}.
     *
     * @param snapshot the snapshot to evaluate
     * @param graph    graph used to key anomalies by node id
     * @return anomalies grouped by priority plus a summary
     */
    public DetectionResult detect(Snapshot snapshot, ServiceGraph graph) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Objects.requireNonNull(graph, "ServiceGraph must not be null");

        List<ServiceSnapshot> services = snapshot.getServices();
        Instant cutoff = snapshot.getTimestamp() != null
                ? snapshot.getTimestamp().minus(Duration.ofMinutes(config.getTimeWindow()))
                : null;
        LOG.info("Detecting anomalies across {} service(s), algorithms={}", services.size(),
                config.getAlgorithms());

        Stream<ServiceSnapshot> stream = config.isParallel() ? services.parallelStream() : services.stream();
        List<Anomaly> anomalies = stream
                .map(service -> evaluateService(service, graph, cutoff))
                .flatMap(List::stream)
                .toList();

        AnomalyBuckets buckets = AnomalyBuckets.of(anomalies);
        Set<String> affected = new LinkedHashSet<>();
        anomalies.forEach(anomaly -> affected.add(anomaly.getService()));
        MetricsSummary summary = new MetricsSummary(services.size(), affected.size(), anomalies.size());

        LOG.info("Detection finished: {} anomalies (high={}, medium={}, low={}) on {} service(s)",
                anomalies.size(), buckets.getHighPriority().size(), buckets.getMediumPriority().size(),
                buckets.getLowPriority().size(), affected.size());
        return new DetectionResult(buckets, clock.instant(), summary);
    }

    // ---------------------------------------------------------------
    // Per-service evaluation
    // ---------------------------------------------------------------

    private List<Anomaly> evaluateService(ServiceSnapshot service, ServiceGraph graph, Instant cutoff) {
        String serviceId = resolveServiceId(service, graph);
        List<Anomaly> found = new ArrayList<>();

        for (MetricSeries series : service.getMetrics().values()) {
            Optional<MetricKind> kind = config.kindOf(series.getName());
            if (kind.isEmpty()) {
                LOG.trace("Service '{}': metric '{}' has no configured kind, skipping", serviceId, series.getName());
                continue;
            }
            found.addAll(evaluateSeries(serviceId, series, kind.get(), cutoff));
        }

        List<TraceRecord> traces = tracesWithin(service.getTraces(), cutoff);
        if (traces.isEmpty()) {
            if (!service.getTraces().isEmpty()) {
                LOG.debug("Service '{}': all {} traces fall outside the time window", serviceId,
                        service.getTraces().size());
            }
        } else {
            found.addAll(evaluateSeries(serviceId, traceDurations(traces), MetricKind.LATENCY, null));
            found.addAll(evaluateSeries(serviceId, traceErrorRate(traces), MetricKind.ERROR_RATE, null));
        }
        return found;
    }

    /** Traces started at or after {@code cutoff}; undated traces are kept. */
    static List<TraceRecord> tracesWithin(List<TraceRecord> traces, Instant cutoff) {
        if (cutoff == null) {
            return traces;
        }
        return traces.stream()
                .filter(trace -> trace.getStart() == null || !trace.getStart().isBefore(cutoff))
                .toList();
    }

    private String resolveServiceId(ServiceSnapshot service, ServiceGraph graph) {
        Optional<String> byId = graph.resolve(service.getId());
        if (byId.isPresent()) {
            return byId.get();
        }
        Optional<String> byName = graph.resolve(service.getName());
        if (byName.isPresent()) {
            return byName.get();
        }
        if (!graph.isEmpty()) {
            LOG.warn("Service '{}' is not part of the topology; evaluating it anyway", service.getId());
        }
        return service.getId();
    }

    List<Anomaly> evaluateSeries(String serviceId, MetricSeries raw, MetricKind kind, Instant cutoff) {
        MetricSeries series = withinWindow(raw, cutoff);
        if (series.isEmpty()) {
            LOG.trace("Service '{}': metric '{}' has no samples in the window", serviceId, series.getName());
            return List.of();
        }
        Optional<String> problem = SeriesWindow.malformedReason(series, kind);
        if (problem.isPresent()) {
            LOG.warn("Service '{}': skipping malformed metric '{}': {}", serviceId, series.getName(), problem.get());
            return List.of();
        }

        SeriesWindow window = SeriesWindow.of(series, kind, config.getRecentSamples());
        Map<AnomalyKind, List<CheckResult>> byKind = new LinkedHashMap<>();
        for (MetricCheck check : checks) {
            check.evaluate(window).ifPresent(result -> byKind
                    .computeIfAbsent(result.getKind(), k -> new ArrayList<>())
                    .add(result));
        }

        List<Anomaly> anomalies = new ArrayList<>(byKind.size());
        byKind.forEach((anomalyKind, results) -> anomalies.add(toAnomaly(serviceId, window, anomalyKind, results)));
        return anomalies;
    }

    private static MetricSeries withinWindow(MetricSeries series, Instant cutoff) {
        if (cutoff == null) {
            return series;
        }
        List<Sample> kept = series.getSamples().stream()
                .filter(sample -> sample.getTimestamp() == null || !sample.getTimestamp().isBefore(cutoff))
                .toList();
        return kept.size() == series.size() ? series : new MetricSeries(series.getName(), kept);
    }

    // ---------------------------------------------------------------
    // Anomaly construction
    // ---------------------------------------------------------------

    static Priority priorityOf(List<CheckResult> results) {
        boolean absolute = results.stream().anyMatch(CheckResult::isAbsolute);
        boolean statistical = results.stream().anyMatch(result -> !result.isAbsolute());
        if (absolute && statistical) {
            return Priority.HIGH;
        }
        boolean strong = results.stream().anyMatch(result -> !result.isMarginal());
        return strong ? Priority.MEDIUM : Priority.LOW;
    }

    private static Anomaly toAnomaly(String serviceId, SeriesWindow window, AnomalyKind kind,
            List<CheckResult> results) {
        Double threshold = null;
        Double zScore = null;
        double deviation = 0;
        for (CheckResult result : results) {
            if (threshold == null) {
                threshold = result.getThreshold();
            }
            if (zScore == null) {
                zScore = result.getZScore();
            }
            deviation = Math.max(deviation, result.getDeviation());
        }
        // the z-score wins as the reported magnitude
        if (zScore != null) {
            deviation = zScore;
        }

        return Anomaly.builder()
                .service(serviceId)
                .metric(window.getMetric())
                .kind(kind)
                .priority(priorityOf(results))
                .observedValue(window.current())
                .threshold(threshold)
                .deviation(deviation)
                .zScore(zScore)
                .observedAt(window.observedAt())
                .description(describe(serviceId, window, kind, threshold, zScore))
                .build();
    }

    private static String describe(String serviceId, SeriesWindow window, AnomalyKind kind,
            Double threshold, Double zScore) {
        StringBuilder sb = new StringBuilder();
        sb.append(switch (kind) {
            case LATENCY_SPIKE -> "Latency spike";
            case ERROR_RATE_SPIKE -> "Error rate spike";
            case THROUGHPUT_DROP -> "Throughput drop";
            case SLA_DROP -> "SLA drop";
            case THROUGHPUT_INSTABILITY -> "Unstable throughput";
        });
        sb.append(" on ").append(serviceId)
                .append(String.format(Locale.ROOT, ": %s=%.2f", window.getMetric(), window.current()));
        if (threshold != null) {
            String label = kind == AnomalyKind.THROUGHPUT_INSTABILITY ? "variability bound" : "threshold";
            sb.append(String.format(Locale.ROOT, ", %s %.2f", label, threshold));
        }
        if (zScore != null) {
            sb.append(String.format(Locale.ROOT, ", z=%.2f vs baseline mean %.2f", zScore, window.baselineMean()));
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------
    // Trace-derived series
    // ---------------------------------------------------------------

    static MetricSeries traceDurations(List<TraceRecord> traces) {
        List<Sample> samples = traces.stream()
                .sorted(Comparator.comparing(TraceRecord::getStart,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(trace -> new Sample(trace.getStart(), trace.getDuration()))
                .toList();
        return new MetricSeries(TRACE_DURATION, samples);
    }

    static MetricSeries traceErrorRate(List<TraceRecord> traces) {
        long errors = traces.stream().filter(TraceRecord::isError).count();
        double rate = errors * 100.0 / traces.size();
        Instant latest = traces.stream()
                .map(TraceRecord::getStart)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        return new MetricSeries(TRACE_ERROR_RATE, List.of(new Sample(latest, rate)));
    }

    public DetectionConfig getConfig() {
        return config;
    }
}
