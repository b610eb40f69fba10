/* (C)2026 */
package com.ammann.attention.model;

import com.ammann.attention.enumeration.ActivityCategory;

/**
 * Validated, millisecond-based view of an {@link ActivityInterval}.
 *
 * @param startMs       interval start in epoch milliseconds
 * @param endMs         effective interval end in epoch milliseconds (inferred for open intervals)
 * @param domain        browser domain, may be {@code null}
 * @param appName       application name, may be {@code null}
 * @param category      tracker category, may be {@code null} for uncategorised time
 * @param activeSeconds non-negative active seconds recorded for the whole interval
 * @param idleSeconds   non-negative idle seconds recorded for the whole interval
 */
public record ActivitySpan(
        long startMs,
        long endMs,
        String domain,
        String appName,
        ActivityCategory category,
        double activeSeconds,
        double idleSeconds) {

    public static final String REJECT_MISSING_START = "missing-start";
    public static final String REJECT_NON_FINITE_SECONDS = "non-finite-seconds";
    public static final String REJECT_END_BEFORE_START = "end-before-start";

    /**
     * Validates a stored interval.
     *
     * <p>Negative second counts are clamped to zero. Rows without a start, with non-finite
     * second counts, or whose end precedes their start are rejected.
     *
     * @param interval stored interval
     * @return the span or a rejection reason
     */
    public static ParseResult<ActivitySpan> parse(ActivityInterval interval) {
        if (interval == null || interval.startedAt == null) {
            return ParseResult.rejected(REJECT_MISSING_START);
        }
        if (!Double.isFinite(interval.secondsActive) || !Double.isFinite(interval.idleSeconds)) {
            return ParseResult.rejected(REJECT_NON_FINITE_SECONDS);
        }

        double active = Math.max(0.0, interval.secondsActive);
        double idle = Math.max(0.0, interval.idleSeconds);
        long startMs = interval.startedAt.toEpochMilli();
        long endMs =
                interval.endedAt != null
                        ? interval.endedAt.toEpochMilli()
                        : startMs + Math.round((active + idle) * 1000.0);

        if (endMs < startMs) {
            return ParseResult.rejected(REJECT_END_BEFORE_START);
        }

        return ParseResult.ok(
                new ActivitySpan(
                        startMs,
                        endMs,
                        interval.domain,
                        interval.appName,
                        interval.category,
                        active,
                        idle));
    }

    public long durationMs() {
        return endMs - startMs;
    }

    public double totalSeconds() {
        return activeSeconds + idleSeconds;
    }

    /**
     * Label used for domain rankings and transition keys: the domain, else the app name.
     */
    public String contextLabel() {
        return domain != null ? domain : appName;
    }
}
