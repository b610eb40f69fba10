/* (C)2026 */
package com.ammann.attention.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Engagement classification derived from a domain's fixation score (0-100).
 *
 * <p>Levels are ordered from the highest threshold down; {@link #fromFixationScore(int)}
 * returns the first level whose threshold the score reaches.
 */
public enum EngagementLevel {
    INTENSE(80),
    HIGH(60),
    MODERATE(40),
    PASSIVE(20),
    LOW(0);

    private final int minimumScore;

    EngagementLevel(int minimumScore) {
        this.minimumScore = minimumScore;
    }

    public int minimumScore() {
        return minimumScore;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EngagementLevel fromFixationScore(int fixationScore) {
        for (EngagementLevel level : values()) {
            if (fixationScore >= level.minimumScore) {
                return level;
            }
        }
        return LOW;
    }
}
