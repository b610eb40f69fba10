/* (C)2026 */
package com.ammann.attention.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Direction of productive time between the older and the more recent half of a window.
 */
public enum FocusTrend {
    IMPROVING,
    DECLINING,
    STABLE;

    /** Recent productive time must exceed the older half by this factor to count as improving. */
    static final double IMPROVING_FACTOR = 1.1;

    /** Recent productive time below this fraction of the older half counts as declining. */
    static final double DECLINING_FACTOR = 0.9;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FocusTrend compare(double olderProductiveSeconds, double recentProductiveSeconds) {
        if (recentProductiveSeconds > olderProductiveSeconds * IMPROVING_FACTOR) {
            return IMPROVING;
        }
        if (recentProductiveSeconds < olderProductiveSeconds * DECLINING_FACTOR) {
            return DECLINING;
        }
        return STABLE;
    }
}
