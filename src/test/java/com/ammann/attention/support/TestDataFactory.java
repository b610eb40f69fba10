/* (C)2026 */
package com.ammann.attention.support;

import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.model.ActivityInterval;
import com.ammann.attention.model.BehaviorEvent;
import com.ammann.attention.model.PomodoroSession;
import java.time.Instant;

public final class TestDataFactory {

    private TestDataFactory() {}

    /**
     * Closed interval whose active seconds equal its wall-clock duration.
     */
    public static ActivityInterval interval(
            String start, String end, String domain, ActivityCategory category) {
        Instant startedAt = Instant.parse(start);
        Instant endedAt = Instant.parse(end);
        double seconds = (endedAt.toEpochMilli() - startedAt.toEpochMilli()) / 1000.0;
        return new ActivityInterval(startedAt, endedAt, domain, null, category, seconds, 0.0);
    }

    public static ActivityInterval interval(
            Instant startedAt,
            Instant endedAt,
            String domain,
            ActivityCategory category,
            double activeSeconds,
            double idleSeconds) {
        return new ActivityInterval(
                startedAt, endedAt, domain, null, category, activeSeconds, idleSeconds);
    }

    public static ActivityInterval appInterval(
            String start, String end, String appName, ActivityCategory category) {
        ActivityInterval interval = interval(start, end, null, category);
        interval.appName = appName;
        return interval;
    }

    public static PomodoroSession pomodoro(String start, String end, long plannedSeconds) {
        return new PomodoroSession(
                Instant.parse(start), end != null ? Instant.parse(end) : null, plannedSeconds);
    }

    public static BehaviorEvent event(
            String timestamp, String domain, String type, Long valueInt, Double valueFloat) {
        BehaviorEvent event = new BehaviorEvent();
        event.occurredAt = Instant.parse(timestamp);
        event.domain = domain;
        event.eventType = type;
        event.valueInt = valueInt;
        event.valueFloat = valueFloat;
        return event;
    }
}
