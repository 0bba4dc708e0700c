package com.rcasentinel.core.pipeline;

import com.rcasentinel.core.analysis.RootCauseAnalyzer;
import com.rcasentinel.core.config.RcaConfig;
import com.rcasentinel.core.detection.AnomalyDetector;
import com.rcasentinel.core.graph.ServiceGraph;
import com.rcasentinel.core.model.AnalysisReport;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.Anomaly;
import com.rcasentinel.core.model.AnomalyBuckets;
import com.rcasentinel.core.model.DetectionResult;
import com.rcasentinel.core.model.ReportStatus;
import com.rcasentinel.core.model.RootCauseCandidate;
import com.rcasentinel.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One detection and analysis pass:
 * snapshot → graph → anomalies → ranked root causes → optional narratives →
 * sink.
 *
 * <p>
 * The core computation never depends on a collaborator succeeding. Source,
 * annotator and sink failures are logged and recorded as report diagnostics.
 * </p>
 *
 * @since 1.0.0
 */
public class RcaPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(RcaPipeline.class);

    private final RcaConfig config;
    private final AnomalyDetector detector;
    private final RootCauseAnalyzer analyzer;
    private final NarrativeAnnotator annotator;

    /**
     * @param config    validated here; fails fast before any pass runs
     * @param annotator optional narrative annotator, may be {@code null}
     * @param clock     source of output timestamps
     * @throws IllegalStateException if the configuration is invalid
     */
    public RcaPipeline(RcaConfig config, NarrativeAnnotator annotator, Clock clock) {
        this.config = Objects.requireNonNull(config, "RcaConfig must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();
        this.detector = new AnomalyDetector(config.getAnomalyDetection(), clock);
        this.analyzer = new RootCauseAnalyzer(config.getRootCauseAnalysis(), clock);
        this.annotator = annotator;
    }

    public RcaPipeline(RcaConfig config) {
        this(config, null, Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Fetch a snapshot, analyse it and publish the report.
     *
     * @return the report handed to the sink, including any collaborator
     *         diagnostics
     */
    public AnalysisReport run(SnapshotSource source, ResultSink sink) {
        Objects.requireNonNull(source, "SnapshotSource must not be null");
        Objects.requireNonNull(sink, "ResultSink must not be null");

        AnalysisReport report;
        try {
            Snapshot snapshot = source.fetch();
            report = snapshot == null
                    ? AnalysisReport.noData("snapshot source returned no snapshot")
                    : analyze(snapshot);
        } catch (IOException | RuntimeException e) {
            LOG.error("Snapshot source failed", e);
            report = AnalysisReport.noData("snapshot source failed: " + e.getMessage());
        }

        try {
            sink.publish(report);
        } catch (IOException | RuntimeException e) {
            LOG.error("Result sink failed", e);
            report = withDiagnostic(report, "result sink failed: " + e.getMessage());
        }
        return report;
    }

    /**
     * Analyse one snapshot without touching a source or sink.
     *
     * @param snapshot the snapshot
     * @return the report; never {@code null}
     */
    public AnalysisReport analyze(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");

        ServiceGraph graph = ServiceGraph.from(snapshot.getTopology());
        DetectionResult detection = detector.detect(snapshot, graph);
        AnalysisResult analysis = analyzer.analyze(graph, detection);

        ReportStatus status;
        if (graph.isEmpty()) {
            status = ReportStatus.NO_DATA;
        } else if (detection.getAnomalies().isEmpty()) {
            status = ReportStatus.HEALTHY;
        } else {
            status = ReportStatus.FINDINGS;
        }

        List<String> diagnostics = new ArrayList<>();
        Map<String, String> narratives = narratives(status, detection, analysis, diagnostics);
        AnalysisReport report = new AnalysisReport(status, detection, analysis, narratives, diagnostics);
        logSummary(report);
        return report;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Map<String, String> narratives(ReportStatus status, DetectionResult detection,
            AnalysisResult analysis, List<String> diagnostics) {
        if (!config.getPipeline().isNarrativeEnabled() || annotator == null) {
            LOG.debug("Narrative generation disabled");
            return Map.of();
        }
        if (status != ReportStatus.FINDINGS) {
            LOG.debug("Skipping narratives for status {}", status);
            return Map.of();
        }
        try {
            Map<String, String> narratives = annotator.annotate(detection, analysis);
            return narratives != null ? narratives : Map.of();
        } catch (IOException | RuntimeException e) {
            LOG.error("Narrative annotator failed", e);
            diagnostics.add("narrative generation failed: " + e.getMessage());
            return Map.of();
        }
    }

    private static AnalysisReport withDiagnostic(AnalysisReport report, String diagnostic) {
        List<String> diagnostics = new ArrayList<>(report.getDiagnostics());
        diagnostics.add(diagnostic);
        return new AnalysisReport(report.getStatus(), report.getDetection(), report.getAnalysis(),
                report.getNarratives(), diagnostics);
    }

    private void logSummary(AnalysisReport report) {
        int topN = config.getPipeline().getSummaryTopN();
        AnomalyBuckets buckets = report.getDetection().getAnomalies();
        LOG.info("Pass finished with status {}: anomalies high={}, medium={}, low={}; root causes={}",
                report.getStatus(), buckets.getHighPriority().size(), buckets.getMediumPriority().size(),
                buckets.getLowPriority().size(), report.getAnalysis().getRootCauses().size());

        List<Anomaly> high = buckets.getHighPriority();
        for (int i = 0; i < Math.min(topN, high.size()); i++) {
            LOG.info("  high #{}: {} {} ({})", i + 1, high.get(i).getService(), high.get(i).getKind().label(),
                    high.get(i).getMetric());
        }
        if (high.size() > topN) {
            LOG.info("  ... {} more high-priority anomalies", high.size() - topN);
        }

        List<RootCauseCandidate> causes = report.getAnalysis().getRootCauses();
        for (int i = 0; i < Math.min(topN, causes.size()); i++) {
            LOG.info("  root cause #{}: {} (score={}, confidence={})", i + 1, causes.get(i).getRootService(),
                    twoDecimals(causes.get(i).getRootCauseScore()), twoDecimals(causes.get(i).getConfidence()));
        }
    }

    static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public RcaConfig getConfig() {
        return config;
    }
}
