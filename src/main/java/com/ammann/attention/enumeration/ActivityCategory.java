/* (C)2026 */
package com.ammann.attention.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Classification assigned to a tracked activity by the activity tracker.
 *
 * <p>Persisted and serialized using the lower-case wire value ({@code "productive"},
 * {@code "frivolity"}, ...). Declaration order is the tie-break order for dominant-category
 * selection.
 */
public enum ActivityCategory {
    /** Work the user has marked as valuable */
    PRODUCTIVE,
    /** Neither helpful nor harmful; also the fallback for uncategorised or suppressed time */
    NEUTRAL,
    /** Entertainment and other distractions */
    FRIVOLITY,
    /** Activities that actively sap attention (doomscrolling, feeds) */
    DRAINING,
    /** Time spent under an emergency unlock */
    EMERGENCY;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a wire value case-insensitively.
     *
     * @param value lower-case category name, may be {@code null}
     * @return the category, or {@code null} when the value is blank or unknown
     */
    @JsonCreator
    public static ActivityCategory fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ActivityCategory category : values()) {
            if (category.name().equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return null;
    }

    /**
     * Returns whether time in this category counts as a distraction for risk-hour analysis.
     */
    public boolean isDistraction() {
        return this == FRIVOLITY || this == DRAINING;
    }
}
