/* (C)2026 */
package com.ammann.attention.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Freshness of the stored pattern table.
 *
 * <p>The first check seeds the timestamp from the store, later checks only use the in-memory
 * value updated by {@link #markComputed(Instant)}.
 */
public final class PatternCache {

    private final Duration maxAge;
    private final Supplier<Optional<Instant>> storedComputedAt;

    private volatile Instant lastComputedAt;
    private volatile boolean seeded;

    public PatternCache(Duration maxAge, Supplier<Optional<Instant>> storedComputedAt) {
        this.maxAge = maxAge;
        this.storedComputedAt = storedComputedAt;
    }

    /**
     * @return true if patterns were never computed or are older than the maximum age
     */
    public boolean isStale(Instant now) {
        if (!seeded) {
            lastComputedAt = storedComputedAt.get().orElse(null);
            seeded = true;
        }
        Instant computedAt = lastComputedAt;
        return computedAt == null || Duration.between(computedAt, now).compareTo(maxAge) > 0;
    }

    public void markComputed(Instant computedAt) {
        this.lastComputedAt = computedAt;
        this.seeded = true;
    }

    public Optional<Instant> lastComputedAt() {
        return Optional.ofNullable(lastComputedAt);
    }
}
