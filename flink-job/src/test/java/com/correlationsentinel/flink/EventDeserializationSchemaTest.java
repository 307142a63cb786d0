package com.correlationsentinel.flink;

import com.correlationsentinel.core.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventDeserializationSchema}.
 */
class EventDeserializationSchemaTest {

    private EventDeserializationSchema schema;

    @BeforeEach
    void setUp() {
        schema = new EventDeserializationSchema();
    }

    @Test
    @DisplayName("Should map well-known fields and keep everything else as attributes")
    void shouldDeserializeEvent() throws IOException {
        String json = "{\"id\":\"e-1\",\"timestamp\":\"2024-05-01T10:00:00Z\",\"organizationId\":\"org-1\","
                + "\"sourceIdentifier\":\"auth_failure\",\"user\":\"alice\",\"bytes\":2048,"
                + "\"threat_intel\":{\"matched\":true}}";

        Event event = schema.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(event.getId()).isEqualTo("e-1");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(event.getOrganizationId()).isEqualTo("org-1");
        assertThat(event.getSourceIdentifier()).isEqualTo("auth_failure");
        assertThat(event.getStringField("user")).contains("alice");
        assertThat(event.getNumericField("bytes")).contains(2048.0);
        assertThat(event.getField("threat_intel.matched")).contains(true);
    }

    @Test
    @DisplayName("Missing id and timestamp should be left for normalization")
    void shouldAllowMissingIdAndTimestamp() throws IOException {
        Event event = schema.deserialize("{\"user\":\"bob\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(event.getId()).isNull();
        assertThat(event.getTimestamp()).isNull();
    }

    @Test
    @DisplayName("Malformed and empty records should be skipped")
    void shouldSkipMalformedRecords() throws IOException {
        assertThat(schema.deserialize("{not json".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
        assertThat(schema.isEndOfStream(null)).isFalse();
    }
}
