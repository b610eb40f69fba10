/* (C)2026 */
package com.ammann.attention.enumeration;

import java.time.Duration;
import java.util.Locale;

/**
 * Bucket width and bucket count of a trend report.
 */
public enum TrendGranularity {
    /** 24 one-hour buckets ending now */
    HOUR(Duration.ofHours(1), 24),
    /** 30 logical-day buckets, the last one being today */
    DAY(Duration.ofDays(1), 30),
    /** 12 seven-day buckets ending now */
    WEEK(Duration.ofDays(7), 12);

    private final Duration bucketWidth;
    private final int bucketCount;

    TrendGranularity(Duration bucketWidth, int bucketCount) {
        this.bucketWidth = bucketWidth;
        this.bucketCount = bucketCount;
    }

    public long bucketWidthMs() {
        return bucketWidth.toMillis();
    }

    public int bucketCount() {
        return bucketCount;
    }

    /**
     * Parses a query parameter value ({@code hour}, {@code day}, {@code week}).
     *
     * @throws IllegalArgumentException if the value is not a known granularity
     */
    public static TrendGranularity fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
