package com.correlationsentinel.flink;

import com.correlationsentinel.core.config.EngineConfig;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration of the correlation Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job is
 * configured entirely through Kubernetes Deployment env vars or Docker
 * {@code -e} flags. Engine tuning (suppression interval, window bounds,
 * scoring) is read by {@link EngineConfig#fromEnvironment()}.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>localhost:9092</td></tr>
 * <tr><td>{@code KAFKA_INPUT_TOPIC}</td><td>normalized-events</td></tr>
 * <tr><td>{@code KAFKA_ALERT_TOPIC}</td><td>alerts</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>correlation-sentinel</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>1</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL_MS}</td><td>60000</td></tr>
 * <tr><td>{@code RULES_CONFIG_PATH}</td><td>classpath {@code rules.yml}</td></tr>
 * <tr><td>{@code SIGMA_RULES_PATH}</td><td>none</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>8080</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------
    private final String rulesConfigPath;
    private final String sigmaRulesPath;

    private final int healthPort;
    private final EngineConfig engine;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.rulesConfigPath = b.rulesConfigPath;
        this.sigmaRulesPath = b.sigmaRulesPath;
        this.healthPort = b.healthPort;
        this.engine = b.engine;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "normalized-events"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "correlation-sentinel"))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .rulesConfigPath(env("RULES_CONFIG_PATH", ""))
                    .sigmaRulesPath(env("SIGMA_RULES_PATH", ""))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .engine(EngineConfig.fromEnvironment())
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
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

    /** Blank means the classpath {@code rules.yml}. */
    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    /** Optional Sigma rule file; blank when none. */
    public String getSigmaRulesPath() {
        return sigmaRulesPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public EngineConfig getEngine() {
        return engine;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}; {@link #build()} rejects blank
     * topics, non-positive parallelism or checkpoint interval and ports
     * outside [1, 65535].
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "normalized-events";
        private String kafkaAlertTopic = "alerts";
        private String kafkaGroupId = "correlation-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String rulesConfigPath = "";
        private String sigmaRulesPath = "";
        private int healthPort = 8080;
        private EngineConfig engine = EngineConfig.defaults();

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
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

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder sigmaRulesPath(String v) {
            this.sigmaRulesPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder engine(EngineConfig v) {
            this.engine = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(engine, "engine config required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
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

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", healthPort=" + healthPort +
                ", engine=" + engine +
                '}';
    }
}
