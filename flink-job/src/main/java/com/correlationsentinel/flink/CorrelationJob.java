package com.correlationsentinel.flink;

import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.config.RulesConfig;
import com.correlationsentinel.core.config.RulesLoader;
import com.correlationsentinel.core.config.SigmaRuleParser;
import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.Event;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the correlation Flink job.
 *
 * <pre>
 *   Kafka (normalized events, JSON)
 *     → Event
 *     → key by organizationId
 *     → CorrelationProcessFunction (evaluate → assemble → score)
 *     → Alert → JSON
 *     → Kafka (alerts)
 * </pre>
 *
 * <p>
 * Rules come from {@code RULES_CONFIG_PATH} (or the classpath
 * {@code rules.yml}) plus an optional Sigma file from
 * {@code SIGMA_RULES_PATH}. Invalid rules fail the job at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationJob {

        private static final Logger LOG = LoggerFactory.getLogger(CorrelationJob.class);

        private CorrelationJob() {
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Correlation Sentinel with config: {}", config);

                List<RuleDefinition> rules = loadRules(config);
                if (rules.isEmpty()) {
                        throw new IllegalStateException(
                                        "No correlation rules defined. Provide rules via "
                                                        + RulesLoader.ENV_RULES_PATH
                                                        + " or a classpath rules.yml file.");
                }
                LOG.info("Loaded {} rule(s)", rules.size());

                HealthServer healthServer = new HealthServer();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, rules);
                healthServer.markReady(rules.size());

                env.execute("Correlation Sentinel – Real-time Correlation");
        }

        /**
         * Build the Kafka → correlation → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        List<RuleDefinition> rules) {
                KafkaSource<Event> source = KafkaSource.<Event>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.committedOffsets(OffsetResetStrategy.EARLIEST))
                                .setValueOnlyDeserializer(new EventDeserializationSchema())
                                .build();

                // windows follow event timestamps inside the pipeline; no Flink event-time operators
                DataStream<Event> events = env.fromSource(source, WatermarkStrategy.noWatermarks(),
                                "kafka-events-source");

                DataStream<Alert> alerts = events
                                .filter(Objects::nonNull)
                                .name("drop-malformed")
                                .keyBy(CorrelationProcessFunction::keyOf)
                                .process(new CorrelationProcessFunction(rules, config.getEngine()))
                                .name("correlation");

                KafkaSink<Alert> sink = KafkaSink.<Alert>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAlertTopic())
                                                                .setValueSerializationSchema(
                                                                                new AlertSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(sink).name("kafka-alerts-sink");
        }

        /**
         * Native rules plus the optional Sigma rule, validated together.
         */
        static List<RuleDefinition> loadRules(JobConfig config) {
                String rulesPath = config.getRulesConfigPath();
                RulesConfig rulesConfig = rulesPath != null && !rulesPath.isBlank()
                                ? RulesLoader.fromFile(rulesPath)
                                : RulesLoader.load();

                String sigmaPath = config.getSigmaRulesPath();
                if (sigmaPath != null && !sigmaPath.isBlank()) {
                        List<RuleDefinition> combined = new ArrayList<>(rulesConfig.getRules());
                        combined.add(SigmaRuleParser.fromFile(sigmaPath));
                        rulesConfig = new RulesConfig();
                        rulesConfig.setRules(combined);
                        rulesConfig.validate();
                }
                return rulesConfig.getRules();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.AT_LEAST_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
        }
}
