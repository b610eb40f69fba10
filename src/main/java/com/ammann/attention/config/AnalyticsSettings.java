/* (C)2026 */
package com.ammann.attention.config;

import java.time.ZoneId;
import java.util.List;

/**
 * User settings consumed by the analytics engine.
 */
public interface AnalyticsSettings {

    /** Maximum number of privacy keywords honoured. */
    int MAX_EXCLUDED_KEYWORDS = 50;

    /**
     * @return lower-cased privacy keywords; a domain or app name containing one is suppressed
     */
    List<String> excludedKeywords();

    /**
     * @return hour (0-23) at which a logical day starts
     */
    int dayStartHour();

    ZoneId zone();
}
