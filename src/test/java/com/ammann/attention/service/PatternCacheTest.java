/* (C)2026 */
package com.ammann.attention.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class PatternCacheTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Test
    void emptyStoreIsStale() {
        PatternCache cache = new PatternCache(Duration.ofHours(1), Optional::empty);

        assertThat(cache.isStale(NOW)).isTrue();
        assertThat(cache.lastComputedAt()).isEmpty();
    }

    @Test
    void storeIsConsultedOnlyOnce() {
        AtomicInteger lookups = new AtomicInteger();
        PatternCache cache =
                new PatternCache(
                        Duration.ofHours(1),
                        () -> {
                            lookups.incrementAndGet();
                            return Optional.of(NOW.minus(Duration.ofMinutes(30)));
                        });

        assertThat(cache.isStale(NOW)).isFalse();
        assertThat(cache.isStale(NOW.plus(Duration.ofMinutes(31)))).isTrue();
        assertThat(lookups).hasValue(1);
    }

    @Test
    void exactlyMaxAgeIsStillFresh() {
        PatternCache cache = new PatternCache(Duration.ofHours(1), Optional::empty);
        cache.markComputed(NOW);

        assertThat(cache.isStale(NOW.plus(Duration.ofHours(1)))).isFalse();
        assertThat(cache.isStale(NOW.plus(Duration.ofHours(1)).plusMillis(1))).isTrue();
        assertThat(cache.lastComputedAt()).contains(NOW);
    }
}
