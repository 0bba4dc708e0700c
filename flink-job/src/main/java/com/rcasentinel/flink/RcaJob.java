package com.rcasentinel.flink;

import com.rcasentinel.core.config.ConfigLoader;
import com.rcasentinel.core.config.RcaConfig;
import com.rcasentinel.core.model.AnalysisReport;
import com.rcasentinel.core.model.Snapshot;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.core.execution.JobClient;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the RCA Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (snapshot topic)
 *     → Parse JSON → Snapshot
 *     → AnalysisProcessFunction (detection, root-cause ranking, narratives)
 *     → Serialize AnalysisReport → JSON
 *     → Kafka (report topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring is resolved from environment variables via {@link JobConfig};
 * detection and analysis settings come from the YAML file loaded by
 * {@link ConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing tracks the Kafka offsets, so every snapshot is
 * analysed once across restarts.
 * </p>
 *
 * @since 1.0.0
 */
public final class RcaJob {

    private static final Logger LOG = LoggerFactory.getLogger(RcaJob.class);

    static final String JOB_NAME = "RCA Sentinel - Root Cause Analysis";

    private RcaJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting RCA Sentinel with config: {}", config);

        // 2. Load and validate detection / analysis settings
        RcaConfig rcaConfig = loadRcaConfig(config);
        LOG.info("Loaded RCA config: {}", rcaConfig);

        // 3. Start health server (for K8s probes) with shutdown hook
        AtomicBoolean submitted = new AtomicBoolean(false);
        HealthServer healthServer = new HealthServer(submitted::get);
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        // 4. Set up Flink execution environment
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        // the model types are immutable, so chained operators may share them
        env.getConfig().enableObjectReuse();
        configureCheckpointing(env, config);

        // 5. Build pipeline
        buildPipeline(env, config, rcaConfig);

        // 6. Execute
        JobClient client = env.executeAsync(JOB_NAME);
        submitted.set(true);
        LOG.info("Submitted job {}", client.getJobID());
        client.getJobExecutionResult().get();
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    /**
     * Build the full Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config, RcaConfig rcaConfig) {
        KafkaSource<Snapshot> kafkaSource = KafkaSource.<Snapshot>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaSnapshotTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new SnapshotDeserializationSchema())
                .build();

        // snapshots carry their own timestamps; no event-time windows
        DataStream<Snapshot> snapshots = env.fromSource(
                kafkaSource,
                WatermarkStrategy.noWatermarks(),
                "kafka-snapshot-source");

        DataStream<AnalysisReport> reports = snapshots
                .filter(Objects::nonNull) // drop deserialization failures
                .name("drop-malformed-snapshots")
                .process(new AnalysisProcessFunction(rcaConfig, config))
                .name("root-cause-analysis");

        KafkaSink<AnalysisReport> kafkaSink = KafkaSink.<AnalysisReport>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setKafkaProducerConfig(config.kafkaProducerProperties())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaReportTopic())
                                .setValueSerializationSchema(new ReportSerializationSchema())
                                .build())
                .build();

        reports.sinkTo(kafkaSink).name("kafka-report-sink");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static RcaConfig loadRcaConfig(JobConfig config) {
        String path = config.getRcaConfigPath();
        if (path != null && !path.isBlank()) {
            return ConfigLoader.fromFile(path);
        }
        return ConfigLoader.load();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
