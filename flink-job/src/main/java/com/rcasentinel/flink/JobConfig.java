package com.rcasentinel.flink;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the RCA Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configured entirely through Deployment env vars or
 * {@code docker -e} flags. Detection and analysis settings live in the YAML
 * file named by {@code RCA_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaSnapshotTopic;
    private final String kafkaReportTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Analysis
    // ---------------------------------------------------------------
    private final String rcaConfigPath;

    // ---------------------------------------------------------------
    // Narratives
    // ---------------------------------------------------------------
    private final String narrativeEndpoint;
    private final String narrativeModel;
    private final String narrativeApiKey;
    private final int narrativeTimeoutSeconds;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaSnapshotTopic = b.kafkaSnapshotTopic;
        this.kafkaReportTopic = b.kafkaReportTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.rcaConfigPath = b.rcaConfigPath;
        this.narrativeEndpoint = b.narrativeEndpoint;
        this.narrativeModel = b.narrativeModel;
        this.narrativeApiKey = b.narrativeApiKey;
        this.narrativeTimeoutSeconds = b.narrativeTimeoutSeconds;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromVariables(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from an explicit variable map; missing or
     * blank entries take their defaults.
     */
    static JobConfig fromVariables(Map<String, String> vars) {
        Objects.requireNonNull(vars, "Variables must not be null");
        try {
            return new Builder()
                    .kafkaBootstrapServers(env(vars, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaSnapshotTopic(env(vars, "KAFKA_SNAPSHOT_TOPIC", "rca-snapshots"))
                    .kafkaReportTopic(env(vars, "KAFKA_REPORT_TOPIC", "rca-reports"))
                    .kafkaGroupId(env(vars, "KAFKA_GROUP_ID", "rca-sentinel"))
                    .parallelism(Integer.parseInt(env(vars, "FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env(vars, "FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .rcaConfigPath(env(vars, "RCA_CONFIG_PATH", ""))
                    .narrativeEndpoint(env(vars, "NARRATIVE_ENDPOINT", ""))
                    .narrativeModel(env(vars, "NARRATIVE_MODEL", "qwen2.5:7b"))
                    .narrativeApiKey(env(vars, "NARRATIVE_API_KEY", ""))
                    .narrativeTimeoutSeconds(Integer.parseInt(env(vars, "NARRATIVE_TIMEOUT_SECONDS", "600")))
                    .healthPort(Integer.parseInt(env(vars, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    /**
     * @return {@code true} when a narrative endpoint is configured
     */
    public boolean isNarrativeEnabled() {
        return !narrativeEndpoint.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaSnapshotTopic() {
        return kafkaSnapshotTopic;
    }

    public String getKafkaReportTopic() {
        return kafkaReportTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getRcaConfigPath() {
        return rcaConfigPath;
    }

    public String getNarrativeEndpoint() {
        return narrativeEndpoint;
    }

    public String getNarrativeModel() {
        return narrativeModel;
    }

    public String getNarrativeApiKey() {
        return narrativeApiKey;
    }

    public int getNarrativeTimeoutSeconds() {
        return narrativeTimeoutSeconds;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, narrative
     * timeout &gt; 0, port in [1, 65535], non-blank topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaSnapshotTopic = "rca-snapshots";
        private String kafkaReportTopic = "rca-reports";
        private String kafkaGroupId = "rca-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String rcaConfigPath = "";
        private String narrativeEndpoint = "";
        private String narrativeModel = "qwen2.5:7b";
        private String narrativeApiKey = "";
        private int narrativeTimeoutSeconds = 600;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaSnapshotTopic(String v) {
            this.kafkaSnapshotTopic = v;
            return this;
        }

        public Builder kafkaReportTopic(String v) {
            this.kafkaReportTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder rcaConfigPath(String v) {
            this.rcaConfigPath = v;
            return this;
        }

        public Builder narrativeEndpoint(String v) {
            this.narrativeEndpoint = v;
            return this;
        }

        public Builder narrativeModel(String v) {
            this.narrativeModel = v;
            return this;
        }

        public Builder narrativeApiKey(String v) {
            this.narrativeApiKey = v;
            return this;
        }

        public Builder narrativeTimeoutSeconds(int v) {
            this.narrativeTimeoutSeconds = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaSnapshotTopic, "kafkaSnapshotTopic");
            requireNonBlank(kafkaReportTopic, "kafkaReportTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            if (rcaConfigPath == null) {
                rcaConfigPath = "";
            }
            if (narrativeEndpoint == null) {
                narrativeEndpoint = "";
            }
            if (narrativeApiKey == null) {
                narrativeApiKey = "";
            }
            if (!narrativeEndpoint.isBlank()) {
                requireNonBlank(narrativeModel, "narrativeModel");
            }

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (narrativeTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "narrativeTimeoutSeconds must be >= 1, got: " + narrativeTimeoutSeconds);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> vars, String name, String defaultValue) {
        String value = vars.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        // the API key is never printed
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaSnapshotTopic='" + kafkaSnapshotTopic + '\'' +
                ", kafkaReportTopic='" + kafkaReportTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", rcaConfigPath='" + rcaConfigPath + '\'' +
                ", narrativeEndpoint='" + narrativeEndpoint + '\'' +
                ", narrativeModel='" + narrativeModel + '\'' +
                ", narrativeTimeoutSeconds=" + narrativeTimeoutSeconds +
                ", healthPort=" + healthPort +
                '}';
    }
}
