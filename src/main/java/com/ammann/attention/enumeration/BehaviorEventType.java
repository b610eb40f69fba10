/* (C)2026 */
package com.ammann.attention.enumeration;

import java.util.Locale;

/**
 * Event types emitted by the browser extension's behaviour stream.
 *
 * <p>Only {@link #SCROLL}, {@link #CLICK} and {@link #KEYSTROKE} feed the engagement score;
 * the remaining types are stored for later analysis.
 */
public enum BehaviorEventType {
    SCROLL("scroll"),
    CLICK("click"),
    KEYSTROKE("keystroke"),
    FOCUS("focus"),
    BLUR("blur"),
    IDLE_START("idle_start"),
    IDLE_END("idle_end"),
    VISIBILITY("visibility");

    private final String wireValue;

    BehaviorEventType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * @return the matching type, or {@code null} for unknown or blank values
     */
    public static BehaviorEventType fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BehaviorEventType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
