package com.correlationsentinel.flink;

import com.correlationsentinel.core.config.EngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults")
    void shouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("normalized-events");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("correlation-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getRulesConfigPath()).isEmpty();
        assertThat(config.getEngine()).isNotNull();
    }

    @Test
    @DisplayName("Should keep overridden values")
    void shouldKeepOverrides() {
        JobConfig config = new JobConfig.Builder()
                .kafkaInputTopic("events")
                .parallelism(4)
                .checkpointIntervalMs(10_000)
                .engine(new EngineConfig.Builder().workerThreads(2).build())
                .build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("events");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(10_000);
        assertThat(config.getEngine().getWorkerThreads()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject blank topics and group id")
    void shouldRejectBlankNames() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaInputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic");
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaAlertTopic(null).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaAlertTopic");
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaGroupId("").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range numbers")
    void shouldRejectOutOfRangeNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }
}
