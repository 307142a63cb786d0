package com.correlationsentinel.core.config;

import com.correlationsentinel.core.scoring.ScoringConfig;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration of the correlation engine.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, or
 * set programmatically through the {@link Builder}, which validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@code CORRELATION_WORKER_THREADS}</td><td>worker lanes (default: CPU count)</td></tr>
 * <tr><td>{@code CORRELATION_LANE_QUEUE_CAPACITY}</td><td>1024</td></tr>
 * <tr><td>{@code CORRELATION_INGRESS_QUEUE_CAPACITY}</td><td>10000</td></tr>
 * <tr><td>{@code CORRELATION_WINDOW_SHARDS}</td><td>64</td></tr>
 * <tr><td>{@code CORRELATION_MAX_WINDOWS_PER_RULE}</td><td>10000</td></tr>
 * <tr><td>{@code CORRELATION_SWEEP_INTERVAL_MS}</td><td>2000</td></tr>
 * <tr><td>{@code CORRELATION_SUPPRESSION_INTERVAL_MS}</td><td>300000</td></tr>
 * <tr><td>{@code CORRELATION_IDEMPOTENCY_RETENTION_MS}</td><td>3600000</td></tr>
 * <tr><td>{@code CORRELATION_DELIVERY_MAX_ATTEMPTS}</td><td>3</td></tr>
 * <tr><td>{@code CORRELATION_DELIVERY_INITIAL_BACKOFF_MS}</td><td>200</td></tr>
 * <tr><td>{@code CORRELATION_DELIVERY_BACKOFF_MULTIPLIER}</td><td>2.0</td></tr>
 * <tr><td>{@code CORRELATION_EMITTER_THREADS}</td><td>2</td></tr>
 * <tr><td>{@code CORRELATION_EMITTER_QUEUE_CAPACITY}</td><td>1000</td></tr>
 * <tr><td>{@code CORRELATION_SHUTDOWN_TIMEOUT_MS}</td><td>30000</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Workers & queues
    // ---------------------------------------------------------------
    private final int workerThreads;
    private final int laneQueueCapacity;
    private final int ingressQueueCapacity;

    // ---------------------------------------------------------------
    // Windows
    // ---------------------------------------------------------------
    private final int windowShards;
    private final int maxWindowsPerRule;
    private final long sweepIntervalMs;

    // ---------------------------------------------------------------
    // Deduplication & idempotency
    // ---------------------------------------------------------------
    private final long suppressionIntervalMs;
    private final long idempotencyRetentionMs;

    // ---------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------
    private final int deliveryMaxAttempts;
    private final long deliveryInitialBackoffMs;
    private final double deliveryBackoffMultiplier;
    private final int emitterThreads;
    private final int emitterQueueCapacity;

    private final long shutdownTimeoutMs;
    private final ScoringConfig scoring;

    private EngineConfig(Builder b) {
        this.workerThreads = b.workerThreads;
        this.laneQueueCapacity = b.laneQueueCapacity;
        this.ingressQueueCapacity = b.ingressQueueCapacity;
        this.windowShards = b.windowShards;
        this.maxWindowsPerRule = b.maxWindowsPerRule;
        this.sweepIntervalMs = b.sweepIntervalMs;
        this.suppressionIntervalMs = b.suppressionIntervalMs;
        this.idempotencyRetentionMs = b.idempotencyRetentionMs;
        this.deliveryMaxAttempts = b.deliveryMaxAttempts;
        this.deliveryInitialBackoffMs = b.deliveryInitialBackoffMs;
        this.deliveryBackoffMultiplier = b.deliveryBackoffMultiplier;
        this.emitterThreads = b.emitterThreads;
        this.emitterQueueCapacity = b.emitterQueueCapacity;
        this.shutdownTimeoutMs = b.shutdownTimeoutMs;
        this.scoring = b.scoring;
    }

    /**
     * @return configuration with every default applied
     */
    public static EngineConfig defaults() {
        return new Builder().build();
    }

    /**
     * Build an {@link EngineConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static EngineConfig fromEnvironment() {
        try {
            return new Builder()
                    .workerThreads(parseIntEnv("CORRELATION_WORKER_THREADS",
                            String.valueOf(Runtime.getRuntime().availableProcessors())))
                    .laneQueueCapacity(parseIntEnv("CORRELATION_LANE_QUEUE_CAPACITY", "1024"))
                    .ingressQueueCapacity(parseIntEnv("CORRELATION_INGRESS_QUEUE_CAPACITY", "10000"))
                    .windowShards(parseIntEnv("CORRELATION_WINDOW_SHARDS", "64"))
                    .maxWindowsPerRule(parseIntEnv("CORRELATION_MAX_WINDOWS_PER_RULE", "10000"))
                    .sweepIntervalMs(parseLongEnv("CORRELATION_SWEEP_INTERVAL_MS", "2000"))
                    .suppressionIntervalMs(parseLongEnv("CORRELATION_SUPPRESSION_INTERVAL_MS", "300000"))
                    .idempotencyRetentionMs(parseLongEnv("CORRELATION_IDEMPOTENCY_RETENTION_MS", "3600000"))
                    .deliveryMaxAttempts(parseIntEnv("CORRELATION_DELIVERY_MAX_ATTEMPTS", "3"))
                    .deliveryInitialBackoffMs(parseLongEnv("CORRELATION_DELIVERY_INITIAL_BACKOFF_MS", "200"))
                    .deliveryBackoffMultiplier(Double.parseDouble(
                            env("CORRELATION_DELIVERY_BACKOFF_MULTIPLIER", "2.0")))
                    .emitterThreads(parseIntEnv("CORRELATION_EMITTER_THREADS", "2"))
                    .emitterQueueCapacity(parseIntEnv("CORRELATION_EMITTER_QUEUE_CAPACITY", "1000"))
                    .shutdownTimeoutMs(parseLongEnv("CORRELATION_SHUTDOWN_TIMEOUT_MS", "30000"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getLaneQueueCapacity() {
        return laneQueueCapacity;
    }

    public int getIngressQueueCapacity() {
        return ingressQueueCapacity;
    }

    public int getWindowShards() {
        return windowShards;
    }

    public int getMaxWindowsPerRule() {
        return maxWindowsPerRule;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public Duration getSuppressionInterval() {
        return Duration.ofMillis(suppressionIntervalMs);
    }

    public long getSuppressionIntervalMs() {
        return suppressionIntervalMs;
    }

    public long getIdempotencyRetentionMs() {
        return idempotencyRetentionMs;
    }

    public int getDeliveryMaxAttempts() {
        return deliveryMaxAttempts;
    }

    public long getDeliveryInitialBackoffMs() {
        return deliveryInitialBackoffMs;
    }

    public double getDeliveryBackoffMultiplier() {
        return deliveryBackoffMultiplier;
    }

    public int getEmitterThreads() {
        return emitterThreads;
    }

    public int getEmitterQueueCapacity() {
        return emitterQueueCapacity;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineConfig}.
     *
     * <p>
     * {@link #build()} rejects non-positive sizes, intervals and attempt
     * counts, and a backoff multiplier below 1.
     * </p>
     */
    public static class Builder {
        private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
        private int laneQueueCapacity = 1024;
        private int ingressQueueCapacity = 10_000;
        private int windowShards = 64;
        private int maxWindowsPerRule = 10_000;
        private long sweepIntervalMs = 2_000;
        private long suppressionIntervalMs = 300_000;
        private long idempotencyRetentionMs = 3_600_000;
        private int deliveryMaxAttempts = 3;
        private long deliveryInitialBackoffMs = 200;
        private double deliveryBackoffMultiplier = 2.0;
        private int emitterThreads = 2;
        private int emitterQueueCapacity = 1_000;
        private long shutdownTimeoutMs = 30_000;
        private ScoringConfig scoring = ScoringConfig.defaults();

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder laneQueueCapacity(int v) {
            this.laneQueueCapacity = v;
            return this;
        }

        public Builder ingressQueueCapacity(int v) {
            this.ingressQueueCapacity = v;
            return this;
        }

        public Builder windowShards(int v) {
            this.windowShards = v;
            return this;
        }

        public Builder maxWindowsPerRule(int v) {
            this.maxWindowsPerRule = v;
            return this;
        }

        public Builder sweepIntervalMs(long v) {
            this.sweepIntervalMs = v;
            return this;
        }

        public Builder suppressionIntervalMs(long v) {
            this.suppressionIntervalMs = v;
            return this;
        }

        public Builder idempotencyRetentionMs(long v) {
            this.idempotencyRetentionMs = v;
            return this;
        }

        public Builder deliveryMaxAttempts(int v) {
            this.deliveryMaxAttempts = v;
            return this;
        }

        public Builder deliveryInitialBackoffMs(long v) {
            this.deliveryInitialBackoffMs = v;
            return this;
        }

        public Builder deliveryBackoffMultiplier(double v) {
            this.deliveryBackoffMultiplier = v;
            return this;
        }

        public Builder emitterThreads(int v) {
            this.emitterThreads = v;
            return this;
        }

        public Builder emitterQueueCapacity(int v) {
            this.emitterQueueCapacity = v;
            return this;
        }

        public Builder shutdownTimeoutMs(long v) {
            this.shutdownTimeoutMs = v;
            return this;
        }

        public Builder scoring(ScoringConfig v) {
            this.scoring = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link EngineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public EngineConfig build() {
            Objects.requireNonNull(scoring, "scoring config required");
            requirePositive(workerThreads, "workerThreads");
            requirePositive(laneQueueCapacity, "laneQueueCapacity");
            requirePositive(ingressQueueCapacity, "ingressQueueCapacity");
            requirePositive(windowShards, "windowShards");
            requirePositive(maxWindowsPerRule, "maxWindowsPerRule");
            requirePositive(sweepIntervalMs, "sweepIntervalMs");
            requirePositive(suppressionIntervalMs, "suppressionIntervalMs");
            requirePositive(idempotencyRetentionMs, "idempotencyRetentionMs");
            requirePositive(deliveryMaxAttempts, "deliveryMaxAttempts");
            requirePositive(emitterThreads, "emitterThreads");
            requirePositive(emitterQueueCapacity, "emitterQueueCapacity");
            requirePositive(shutdownTimeoutMs, "shutdownTimeoutMs");
            requirePositive(deliveryInitialBackoffMs, "deliveryInitialBackoffMs");
            if (deliveryBackoffMultiplier < 1.0) {
                throw new IllegalArgumentException(
                        "deliveryBackoffMultiplier must be >= 1.0, got: " + deliveryBackoffMultiplier);
            }
            return new EngineConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "workerThreads=" + workerThreads +
                ", laneQueueCapacity=" + laneQueueCapacity +
                ", ingressQueueCapacity=" + ingressQueueCapacity +
                ", windowShards=" + windowShards +
                ", maxWindowsPerRule=" + maxWindowsPerRule +
                ", sweepIntervalMs=" + sweepIntervalMs +
                ", suppressionIntervalMs=" + suppressionIntervalMs +
                ", deliveryMaxAttempts=" + deliveryMaxAttempts +
                ", emitterThreads=" + emitterThreads +
                '}';
    }
}
