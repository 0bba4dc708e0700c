package com.rcasentinel.flink;

import com.rcasentinel.core.config.RcaConfig;
import com.rcasentinel.core.model.AnalysisReport;
import com.rcasentinel.core.model.Snapshot;
import com.rcasentinel.core.pipeline.NarrativeAnnotator;
import com.rcasentinel.core.pipeline.RcaPipeline;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Flink {@link ProcessFunction} that runs one full detection and root-cause
 * pass per incoming {@link Snapshot} and emits the resulting
 * {@link AnalysisReport}.
 *
 * <p>
 * Every snapshot is self-contained, so the function keeps no Flink state.
 * The {@link RcaPipeline} and the optional narrative annotator are built in
 * {@link #open(Configuration)}; only the serializable configuration travels
 * with the job graph.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <p>
 * A snapshot whose analysis throws is logged, counted and dropped; the
 * stream keeps running.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisProcessFunction extends ProcessFunction<Snapshot, AnalysisReport> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisProcessFunction.class);

    private final RcaConfig rcaConfig;
    private final JobConfig jobConfig;

    private transient RcaPipeline pipeline;
    private transient RcaMetrics metrics;

    /**
     * @param rcaConfig detection and analysis settings; validated here
     * @param jobConfig job settings carrying the narrative endpoint
     * @throws IllegalStateException if {@code rcaConfig} is invalid
     */
    public AnalysisProcessFunction(RcaConfig rcaConfig, JobConfig jobConfig) {
        this.rcaConfig = Objects.requireNonNull(rcaConfig, "RcaConfig must not be null");
        this.jobConfig = Objects.requireNonNull(jobConfig, "JobConfig must not be null");
        rcaConfig.validate();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        NarrativeAnnotator annotator = HttpNarrativeAnnotator.fromConfig(jobConfig).orElse(null);
        pipeline = new RcaPipeline(rcaConfig, annotator, Clock.systemUTC());
        metrics = new RcaMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AnalysisProcessFunction opened (narratives {})",
                annotator != null ? "via " + jobConfig.getNarrativeEndpoint() : "disabled");
    }

    @Override
    public void close() {
        LOG.info("AnalysisProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(Snapshot snapshot,
            ProcessFunction<Snapshot, AnalysisReport>.Context ctx,
            Collector<AnalysisReport> out) {
        long startNanos = System.nanoTime();

        AnalysisReport report;
        try {
            report = pipeline.analyze(snapshot);
        } catch (RuntimeException e) {
            LOG.error("Analysis of snapshot taken at {} failed, dropping it", snapshot.getTimestamp(), e);
            metrics.incrementSnapshotsFailed();
            return;
        }

        out.collect(report);
        metrics.incrementSnapshotsProcessed();
        if (report.getDetection() != null) {
            metrics.addAnomaliesDetected(report.getDetection().getAnomalies().size());
        }
        if (report.getAnalysis() != null) {
            metrics.addRootCausesIdentified(report.getAnalysis().getRootCauses().size());
        }
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
