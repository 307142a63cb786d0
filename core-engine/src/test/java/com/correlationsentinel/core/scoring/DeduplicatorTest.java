package com.correlationsentinel.core.scoring;

import com.correlationsentinel.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Deduplicator}.
 */
class DeduplicatorTest {

    private static final Duration FIVE_MINUTES = Duration.ofMinutes(5);

    private MutableClock clock;
    private Deduplicator deduplicator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        deduplicator = new Deduplicator(clock);
    }

    @Test
    @DisplayName("First offer should emit, repeats within the interval should be suppressed")
    void shouldSuppressWithinInterval() {
        assertThat(deduplicator.state("k")).isEqualTo(DedupeState.NONE);

        assertThat(deduplicator.offer("k", FIVE_MINUTES)).isTrue();
        clock.advance(Duration.ofMinutes(2));
        assertThat(deduplicator.offer("k", FIVE_MINUTES)).isFalse();
        assertThat(deduplicator.offer("k", FIVE_MINUTES)).isFalse();

        assertThat(deduplicator.state("k")).isEqualTo(DedupeState.ACTIVE);
        assertThat(deduplicator.suppressedCount("k")).isEqualTo(2);
    }

    @Test
    @DisplayName("Suppressed matches should not extend the interval")
    void shouldAnchorIntervalAtEmission() {
        deduplicator.offer("k", FIVE_MINUTES);
        clock.advance(Duration.ofMinutes(4));
        deduplicator.offer("k", FIVE_MINUTES);

        clock.advance(Duration.ofMinutes(1));

        assertThat(deduplicator.state("k")).isEqualTo(DedupeState.EXPIRED);
        assertThat(deduplicator.offer("k", FIVE_MINUTES)).isTrue();
        assertThat(deduplicator.suppressedCount("k")).isZero();
    }

    @Test
    @DisplayName("Different keys should not suppress each other")
    void shouldIsolateKeys() {
        assertThat(deduplicator.offer("a", FIVE_MINUTES)).isTrue();
        assertThat(deduplicator.offer("b", FIVE_MINUTES)).isTrue();
        assertThat(deduplicator.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Resolving an alert should release its key early")
    void shouldReleaseOnResolve() {
        deduplicator.offer("k", FIVE_MINUTES);

        assertThat(deduplicator.markResolved("k")).isTrue();
        assertThat(deduplicator.markResolved("unknown")).isFalse();
        assertThat(deduplicator.state("k")).isEqualTo(DedupeState.EXPIRED);
        assertThat(deduplicator.offer("k", FIVE_MINUTES)).isTrue();
    }

    @Test
    @DisplayName("Purge should forget only keys that no longer suppress")
    void shouldPurgeExpired() {
        deduplicator.offer("old", Duration.ofMinutes(1));
        deduplicator.offer("fresh", FIVE_MINUTES);
        clock.advance(Duration.ofMinutes(2));

        assertThat(deduplicator.purgeExpired()).isEqualTo(1);
        assertThat(deduplicator.state("old")).isEqualTo(DedupeState.NONE);
        assertThat(deduplicator.state("fresh")).isEqualTo(DedupeState.ACTIVE);
    }
}
