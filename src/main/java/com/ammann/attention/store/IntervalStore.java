/* (C)2026 */
package com.ammann.attention.store;

import com.ammann.attention.dto.ActivityRollupDTO;
import com.ammann.attention.dto.ReadingProgressDTO;
import com.ammann.attention.dto.WritingProgressDTO;
import com.ammann.attention.model.ActivityInterval;
import com.ammann.attention.model.ActivityRollup;
import com.ammann.attention.model.BehaviorEvent;
import com.ammann.attention.model.BehavioralPattern;
import com.ammann.attention.model.PomodoroSession;
import com.ammann.attention.model.ReadingHourlyRollup;
import com.ammann.attention.model.WritingHourlyRollup;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read and write access to every table the analytics engine touches.
 *
 * <p>Range queries on intervals are inclusive on both ends ({@code startedAt <= end} and
 * {@code endedAt >= start}); callers clip the results to their half-open window. Write
 * operations are atomic: either every row of a batch is stored or none is.
 */
public interface IntervalStore {

    /**
     * Intervals whose span touches {@code [start, end]}, open intervals included, ordered by
     * start.
     */
    List<ActivityInterval> findIntervalsOverlapping(Instant start, Instant end);

    List<ActivityInterval> findIntervalsOverlappingForDomain(
            String domain, Instant start, Instant end);

    /**
     * Intervals with {@code start <= startedAt < end}.
     */
    List<ActivityInterval> findIntervalsStartedBetween(Instant start, Instant end);

    List<PomodoroSession> findPomodorosOverlapping(Instant start, Instant end);

    /** Hourly reading rollups with {@code start <= hourStart <= end}. */
    List<ReadingHourlyRollup> findReadingHourly(Instant start, Instant end);

    /** Hourly writing rollups with {@code start <= hourStart <= end}. */
    List<WritingHourlyRollup> findWritingHourly(Instant start, Instant end);

    /** Active reading seconds over the inclusive logical-day range. */
    double sumReadingDailySeconds(LocalDate fromDay, LocalDate toDay);

    /** Active writing seconds over the inclusive logical-day range. */
    double sumWritingDailySeconds(LocalDate fromDay, LocalDate toDay);

    void accumulateWriting(
            Instant hourStart, LocalDate day, WritingProgressDTO delta, Instant updatedAt);

    void accumulateReading(
            Instant hourStart, LocalDate day, ReadingProgressDTO delta, Instant updatedAt);

    List<BehaviorEvent> findBehaviorEvents(String domain, Instant start, Instant end);

    /** Events of every domain with {@code start <= occurredAt <= end}, ordered by time. */
    List<BehaviorEvent> findBehaviorEventsBetween(Instant start, Instant end);

    void insertBehaviorEvents(List<BehaviorEvent> events);

    /**
     * Overwrites the row of every {@code (deviceId, hourStart)} key, creating missing ones.
     */
    void upsertActivityRollups(List<ActivityRollupDTO> rollups);

    List<ActivityRollup> findRollupsUpdatedSince(String deviceId, Instant updatedAfter);

    /**
     * @param deviceId device filter, {@code null} for every device
     */
    List<ActivityRollup> findRollupsFromHour(String deviceId, Instant fromHour);

    Optional<Instant> latestPatternComputedAt();

    /**
     * Clears the pattern table and inserts the given patterns in one transaction.
     */
    void replacePatterns(List<BehavioralPattern> patterns);

    List<BehavioralPattern> findTopPatterns(int limit);

    long countIntervals();
}
