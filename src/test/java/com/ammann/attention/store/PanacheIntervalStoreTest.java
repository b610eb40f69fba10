/* (C)2026 */
package com.ammann.attention.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.attention.dto.ActivityRollupDTO;
import com.ammann.attention.dto.ReadingProgressDTO;
import com.ammann.attention.dto.WritingProgressDTO;
import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.model.ActivityInterval;
import com.ammann.attention.model.ActivityRollup;
import com.ammann.attention.model.BehaviorEvent;
import com.ammann.attention.model.BehavioralPattern;
import com.ammann.attention.model.PomodoroSession;
import com.ammann.attention.model.ReadingDailyRollup;
import com.ammann.attention.model.ReadingHourlyRollup;
import com.ammann.attention.model.WritingDailyRollup;
import com.ammann.attention.model.WritingHourlyRollup;
import com.ammann.attention.support.TestDataFactory;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PanacheIntervalStoreTest {

    private static final Instant DAY_START = Instant.parse("2026-03-02T00:00:00Z");
    private static final Instant DAY_END = Instant.parse("2026-03-03T00:00:00Z");

    @Inject IntervalStore store;

    private static void clearTables() {
        ActivityInterval.deleteAll();
        PomodoroSession.deleteAll();
        BehaviorEvent.deleteAll();
        ActivityRollup.deleteAll();
        BehavioralPattern.deleteAll();
        ReadingHourlyRollup.deleteAll();
        ReadingDailyRollup.deleteAll();
        WritingHourlyRollup.deleteAll();
        WritingDailyRollup.deleteAll();
    }

    @Test
    @TestTransaction
    void overlapQueryIncludesOpenAndStraddlingIntervals() {
        clearTables();
        ActivityInterval.persist(
                TestDataFactory.interval(
                        "2026-03-01T23:30:00Z", "2026-03-02T00:30:00Z", "a.com",
                        ActivityCategory.NEUTRAL),
                TestDataFactory.interval(
                        "2026-03-02T12:00:00Z", "2026-03-02T12:30:00Z", "b.com",
                        ActivityCategory.PRODUCTIVE),
                TestDataFactory.interval(
                        "2026-03-01T10:00:00Z", "2026-03-01T11:00:00Z", "old.com",
                        ActivityCategory.PRODUCTIVE),
                new ActivityInterval(
                        Instant.parse("2026-03-02T22:00:00Z"), null, "open.com", null,
                        ActivityCategory.FRIVOLITY, 0, 0));

        List<ActivityInterval> overlapping = store.findIntervalsOverlapping(DAY_START, DAY_END);

        assertThat(overlapping)
                .extracting(i -> i.domain)
                .containsExactly("a.com", "b.com", "open.com");
        assertThat(store.findIntervalsOverlappingForDomain("b.com", DAY_START, DAY_END)).hasSize(1);
        assertThat(store.findIntervalsStartedBetween(DAY_START, DAY_END))
                .extracting(i -> i.domain)
                .containsExactly("b.com", "open.com");
        assertThat(store.countIntervals()).isEqualTo(4);
    }

    @Test
    @TestTransaction
    void upsertOverwritesExistingHour() {
        clearTables();
        Instant hour = Instant.parse("2026-03-02T09:00:00Z");
        store.upsertActivityRollups(
                List.of(new ActivityRollupDTO("mac", hour, 100, 0, 0, 0, Instant.parse("2026-03-02T10:00:00Z"))));
        store.upsertActivityRollups(
                List.of(new ActivityRollupDTO("mac", hour, 300, 60, 0, 5, Instant.parse("2026-03-02T11:00:00Z"))));

        assertThat(ActivityRollup.count()).isEqualTo(1);
        ActivityRollup row = ActivityRollup.findByKey("mac", hour);
        assertThat(row.productive).isEqualTo(300);
        assertThat(row.neutral).isEqualTo(60);
        assertThat(store.findRollupsUpdatedSince("mac", Instant.parse("2026-03-02T10:30:00Z")))
                .hasSize(1);
        assertThat(store.findRollupsFromHour(null, hour)).hasSize(1);
        assertThat(store.findRollupsFromHour("other", hour)).isEmpty();
    }

    @Test
    @TestTransaction
    void streamProgressAccumulates() {
        clearTables();
        Instant hour = Instant.parse("2026-03-02T14:00:00Z");
        LocalDate day = LocalDate.of(2026, 3, 2);
        store.accumulateWriting(hour, day, new WritingProgressDTO(null, 60, 50, 100, 10, 2, 8), hour);
        store.accumulateWriting(hour, day, new WritingProgressDTO(null, 30, 30, 50, 5, 0, 5), hour);
        store.accumulateReading(hour, day, new ReadingProgressDTO(null, 120, 100), hour);

        assertThat(store.findWritingHourly(hour, hour))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.activeSeconds).isEqualTo(90.0);
                    assertThat(r.keystrokes).isEqualTo(150);
                    assertThat(r.netWords).isEqualTo(13);
                });
        assertThat(store.sumWritingDailySeconds(day, day)).isEqualTo(90.0);
        assertThat(store.sumReadingDailySeconds(day, day)).isEqualTo(120.0);
        assertThat(store.findReadingHourly(hour, hour)).hasSize(1);
    }

    @Test
    @TestTransaction
    void behaviorEventsAreFilteredByDomainAndTime() {
        clearTables();
        store.insertBehaviorEvents(
                List.of(
                        TestDataFactory.event("2026-03-02T09:00:00Z", "a.com", "click", 1L, null),
                        TestDataFactory.event("2026-03-02T09:05:00Z", "b.com", "click", 1L, null),
                        TestDataFactory.event("2026-03-04T09:00:00Z", "a.com", "click", 1L, null)));

        assertThat(store.findBehaviorEvents("a.com", DAY_START, DAY_END)).hasSize(1);
        assertThat(store.findBehaviorEventsBetween(DAY_START, DAY_END))
                .extracting(e -> e.domain)
                .containsExactly("a.com", "b.com");
    }

    @Test
    @TestTransaction
    void patternsAreReplacedAsAWhole() {
        clearTables();
        assertThat(store.latestPatternComputedAt()).isEmpty();

        store.replacePatterns(List.of(pattern(3, "2026-03-02T08:00:00Z"), pattern(7, "2026-03-02T08:00:00Z")));
        store.replacePatterns(List.of(pattern(2, "2026-03-02T09:00:00Z"), pattern(5, "2026-03-02T09:00:00Z")));

        assertThat(store.findTopPatterns(10)).extracting(p -> p.frequency).containsExactly(5, 2);
        assertThat(store.findTopPatterns(1)).hasSize(1);
        assertThat(store.latestPatternComputedAt()).contains(Instant.parse("2026-03-02T09:00:00Z"));
    }

    @Test
    @TestTransaction
    void pomodorosOverlapIncludesRunningSessions() {
        clearTables();
        PomodoroSession.persist(
                TestDataFactory.pomodoro("2026-03-02T09:00:00Z", "2026-03-02T09:25:00Z", 1500),
                TestDataFactory.pomodoro("2026-03-02T23:50:00Z", null, 1500),
                TestDataFactory.pomodoro("2026-02-20T09:00:00Z", "2026-02-20T09:25:00Z", 1500));

        assertThat(store.findPomodorosOverlapping(DAY_START, DAY_END)).hasSize(2);
    }

    private static BehavioralPattern pattern(int frequency, String computedAt) {
        BehavioralPattern pattern = new BehavioralPattern();
        pattern.computedAt = Instant.parse(computedAt);
        pattern.fromCategory = ActivityCategory.PRODUCTIVE;
        pattern.toCategory = ActivityCategory.FRIVOLITY;
        pattern.frequency = frequency;
        pattern.correlationStrength = frequency / 10.0;
        return pattern;
    }
}
