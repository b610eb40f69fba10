/* (C)2026 */
package com.ammann.attention.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * REST path constants shared by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Report, pattern and engagement endpoints
     */
    public static final class Analytics {
        private Analytics() {}

        public static final String BASE = "/analytics";
        public static final String OVERVIEW = BASE + "/overview";
        public static final String TIME_OF_DAY = BASE + "/time-of-day";
        public static final String TRENDS = BASE + "/trends";
        public static final String ENGAGEMENT = BASE + "/engagement";
        public static final String PATTERNS = BASE + "/patterns";
        public static final String BEHAVIOR_EVENTS = BASE + "/behavior-events";
        public static final String EPISODES = BASE + "/episodes";
    }

    /**
     * Hourly activity rollup endpoints
     */
    public static final class Rollups {
        private Rollups() {}

        public static final String BASE = "/rollups";
        public static final String GENERATE = BASE + "/generate";
        public static final String SINCE = BASE + "/since";
        public static final String SUMMARY = BASE + "/summary";
    }

    /**
     * Reading and writing progress endpoints
     */
    public static final class Streams {
        private Streams() {}

        public static final String BASE = "/streams";
        public static final String WRITING_PROGRESS = BASE + "/writing/progress";
        public static final String READING_PROGRESS = BASE + "/reading/progress";
    }
}
