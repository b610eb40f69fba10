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
import com.ammann.attention.model.ReadingDailyRollup;
import com.ammann.attention.model.ReadingHourlyRollup;
import com.ammann.attention.model.WritingDailyRollup;
import com.ammann.attention.model.WritingHourlyRollup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * {@link IntervalStore} over the Hibernate ORM Panache entities.
 */
@ApplicationScoped
public class PanacheIntervalStore implements IntervalStore {

    private static final Logger LOG = Logger.getLogger(PanacheIntervalStore.class);

    @Override
    public List<ActivityInterval> findIntervalsOverlapping(Instant start, Instant end) {
        return ActivityInterval.findOverlapping(start, end);
    }

    @Override
    public List<ActivityInterval> findIntervalsOverlappingForDomain(
            String domain, Instant start, Instant end) {
        return ActivityInterval.findOverlappingForDomain(domain, start, end);
    }

    @Override
    public List<ActivityInterval> findIntervalsStartedBetween(Instant start, Instant end) {
        return ActivityInterval.findStartedBetween(start, end);
    }

    @Override
    public List<PomodoroSession> findPomodorosOverlapping(Instant start, Instant end) {
        return PomodoroSession.findOverlapping(start, end);
    }

    @Override
    public List<ReadingHourlyRollup> findReadingHourly(Instant start, Instant end) {
        return ReadingHourlyRollup.findInRange(start, end);
    }

    @Override
    public List<WritingHourlyRollup> findWritingHourly(Instant start, Instant end) {
        return WritingHourlyRollup.findInRange(start, end);
    }

    @Override
    public double sumReadingDailySeconds(LocalDate fromDay, LocalDate toDay) {
        return ReadingDailyRollup.sumActiveSeconds(fromDay, toDay);
    }

    @Override
    public double sumWritingDailySeconds(LocalDate fromDay, LocalDate toDay) {
        return WritingDailyRollup.sumActiveSeconds(fromDay, toDay);
    }

    @Override
    @Transactional
    public void accumulateWriting(
            Instant hourStart, LocalDate day, WritingProgressDTO delta, Instant updatedAt) {
        WritingHourlyRollup hourly = WritingHourlyRollup.findByHour(hourStart);
        if (hourly == null) {
            hourly = new WritingHourlyRollup();
            hourly.hourStart = hourStart;
        }
        hourly.accumulate(delta, updatedAt);
        hourly.persist();

        WritingDailyRollup daily = WritingDailyRollup.findByDay(day);
        if (daily == null) {
            daily = new WritingDailyRollup();
            daily.day = day;
        }
        daily.accumulate(delta, updatedAt);
        daily.persist();
    }

    @Override
    @Transactional
    public void accumulateReading(
            Instant hourStart, LocalDate day, ReadingProgressDTO delta, Instant updatedAt) {
        ReadingHourlyRollup hourly = ReadingHourlyRollup.findByHour(hourStart);
        if (hourly == null) {
            hourly = new ReadingHourlyRollup();
            hourly.hourStart = hourStart;
        }
        hourly.accumulate(delta.activeSeconds(), delta.focusedSeconds(), updatedAt);
        hourly.persist();

        ReadingDailyRollup daily = ReadingDailyRollup.findByDay(day);
        if (daily == null) {
            daily = new ReadingDailyRollup();
            daily.day = day;
        }
        daily.accumulate(delta.activeSeconds(), delta.focusedSeconds(), updatedAt);
        daily.persist();
    }

    @Override
    public List<BehaviorEvent> findBehaviorEvents(String domain, Instant start, Instant end) {
        return BehaviorEvent.findForDomain(domain, start, end);
    }

    @Override
    public List<BehaviorEvent> findBehaviorEventsBetween(Instant start, Instant end) {
        return BehaviorEvent.findBetween(start, end);
    }

    @Override
    @Transactional
    public void insertBehaviorEvents(List<BehaviorEvent> events) {
        BehaviorEvent.persist(events);
    }

    @Override
    @Transactional
    public void upsertActivityRollups(List<ActivityRollupDTO> rollups) {
        int created = 0;
        for (ActivityRollupDTO dto : rollups) {
            ActivityRollup row = ActivityRollup.findByKey(dto.deviceId(), dto.hourStart());
            if (row == null) {
                row = new ActivityRollup();
                row.deviceId = dto.deviceId();
                row.hourStart = dto.hourStart();
                created++;
            }
            row.overwriteFrom(dto);
            row.persist();
        }
        LOG.debugf("Upserted %d activity rollups (%d new)", rollups.size(), created);
    }

    @Override
    public List<ActivityRollup> findRollupsUpdatedSince(String deviceId, Instant updatedAfter) {
        return ActivityRollup.findUpdatedSince(deviceId, updatedAfter);
    }

    @Override
    public List<ActivityRollup> findRollupsFromHour(String deviceId, Instant fromHour) {
        return ActivityRollup.findFromHour(deviceId, fromHour);
    }

    @Override
    public Optional<Instant> latestPatternComputedAt() {
        return Optional.ofNullable(BehavioralPattern.latestComputedAt());
    }

    @Override
    @Transactional
    public void replacePatterns(List<BehavioralPattern> patterns) {
        long removed = BehavioralPattern.deleteAll();
        BehavioralPattern.persist(patterns);
        LOG.debugf("Replaced %d behavioral patterns with %d", removed, patterns.size());
    }

    @Override
    public List<BehavioralPattern> findTopPatterns(int limit) {
        return BehavioralPattern.findTopByFrequency(limit);
    }

    @Override
    public long countIntervals() {
        return ActivityInterval.count();
    }
}
