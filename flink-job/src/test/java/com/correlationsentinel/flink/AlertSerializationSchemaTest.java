package com.correlationsentinel.flink;

import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertSerializationSchema}.
 */
class AlertSerializationSchemaTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should publish the alert with its match and ISO-8601 timestamps")
    void shouldSerializeAlert() throws IOException {
        byte[] bytes = new AlertSerializationSchema().serialize(alert());

        JsonNode json = new ObjectMapper().readTree(bytes);
        assertThat(json.get("id").asText()).isEqualTo("a-1");
        assertThat(json.get("ruleId").asText()).isEqualTo("failed-logins");
        assertThat(json.get("severity").asText()).isEqualTo("HIGH");
        assertThat(json.get("status").asText()).isEqualTo("NEW");
        assertThat(json.get("confidence").asInt()).isEqualTo(64);
        assertThat(json.get("createdAt").asText()).isEqualTo("2024-05-01T10:00:30Z");
        assertThat(json.get("match").get("eventRefs")).hasSize(2);
        assertThat(json.get("match").get("correlationKey").get(0).asText()).isEqualTo("alice");
        assertThat(json.get("affectedAssets").get(0).asText()).isEqualTo("user:alice");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Alert alert() {
        Match match = Match.builder()
                .id("m-1")
                .ruleId("failed-logins")
                .windowId("w-1")
                .organizationId("org-1")
                .correlationKey(List.of("alice"))
                .timestamp(T0.plusSeconds(10))
                .eventRefs(List.of(
                        new EventRef("e1", T0, "auth_failure", Map.of("user", "alice"), Map.of("user", "alice")),
                        new EventRef("e2", T0.plusSeconds(10), "auth_failure", Map.of("user", "alice"),
                                Map.of("user", "alice"))))
                .threshold(2)
                .rawConfidence(0.7)
                .build();
        return Alert.builder()
                .id("a-1")
                .match(match)
                .ruleName("Failed Logins")
                .organizationId("org-1")
                .severity(Severity.HIGH)
                .confidence(64)
                .dedupeKey("k")
                .title("Authentication Alert: Failed Logins")
                .affectedAssets(List.of("user:alice"))
                .createdAt(T0.plusSeconds(30))
                .build();
    }
}
