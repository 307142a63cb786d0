package com.correlationsentinel.flink;

import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.model.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CorrelationJob} rule loading and {@link CorrelationProcessFunction} keying.
 */
class CorrelationJobTest {

    @Test
    @DisplayName("Should load native rules from the configured file")
    void shouldLoadRulesFromFile() throws URISyntaxException {
        JobConfig config = new JobConfig.Builder().rulesConfigPath(resource("job-rules.yml")).build();

        List<RuleDefinition> rules = CorrelationJob.loadRules(config);

        assertThat(rules).extracting(RuleDefinition::getId).containsExactly("failed-logins");
    }

    @Test
    @DisplayName("Should append the Sigma rule to the native rules")
    void shouldAppendSigmaRule() throws URISyntaxException {
        JobConfig config = new JobConfig.Builder()
                .rulesConfigPath(resource("job-rules.yml"))
                .sigmaRulesPath(resource("job-sigma.yml"))
                .build();

        List<RuleDefinition> rules = CorrelationJob.loadRules(config);

        assertThat(rules).extracting(RuleDefinition::getId)
                .containsExactly("failed-logins", "encoded-powershell-sigma");
    }

    @Test
    @DisplayName("A Sigma rule clashing with a native rule id should fail validation")
    void shouldRejectDuplicateIdsAcrossSources() throws URISyntaxException {
        JobConfig config = new JobConfig.Builder()
                .rulesConfigPath(resource("job-rules.yml"))
                .sigmaRulesPath(resource("duplicate-sigma.yml"))
                .build();

        assertThatThrownBy(() -> CorrelationJob.loadRules(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate rule id 'failed-logins'");
    }

    @Test
    @DisplayName("Events should be keyed by organization, global events by a shared key")
    void shouldKeyByOrganization() {
        Event owned = Event.builder().organizationId("org-1").build();
        Event global = Event.builder().build();

        assertThat(CorrelationProcessFunction.keyOf(owned)).isEqualTo("org-1");
        assertThat(CorrelationProcessFunction.keyOf(global)).isEqualTo(CorrelationProcessFunction.GLOBAL_KEY);
    }

    @Test
    @DisplayName("The process function should require at least one rule")
    void shouldRequireRules() {
        assertThatThrownBy(() -> new CorrelationProcessFunction(List.of(), EngineConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static String resource(String name) throws URISyntaxException {
        return Paths.get(CorrelationJobTest.class.getClassLoader().getResource(name).toURI()).toString();
    }
}
