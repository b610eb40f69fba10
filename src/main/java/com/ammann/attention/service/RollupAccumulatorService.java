/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.dto.ActivityRollupDTO;
import com.ammann.attention.dto.ActivitySummaryDTO;
import com.ammann.attention.dto.ActivitySummaryDTO.TimelineSlotDTO;
import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.exception.ValidationException;
import com.ammann.attention.model.ActivityRollup;
import com.ammann.attention.model.ActivitySpan;
import com.ammann.attention.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Turns raw activity intervals into per-device hourly category totals and manages the stored
 * rollups used for device sync.
 *
 * <p>Rollups are bucketed by the hour in which an interval <em>starts</em>; intervals are not
 * split across hours here. Only productive and frivolity keep their own bucket, every other
 * category (and suppressed or uncategorised time) is counted as neutral.
 */
@ApplicationScoped
public class RollupAccumulatorService {

    private static final Logger LOG = Logger.getLogger(RollupAccumulatorService.class);

    public static final int MIN_WINDOW_HOURS = 1;
    public static final int MAX_WINDOW_HOURS = 168;

    private final IntervalStore store;
    private final IntervalParser parser;
    private final PrivacyFilter privacyFilter;
    private final Clock clock;

    @Inject
    public RollupAccumulatorService(
            IntervalStore store, IntervalParser parser, PrivacyFilter privacyFilter, Clock clock) {
        this.store = store;
        this.parser = parser;
        this.privacyFilter = privacyFilter;
        this.clock = clock;
    }

    /**
     * Builds one rollup per hour touched by intervals starting in {@code [startIso, endIso)}.
     *
     * @return rollups ordered by hour
     * @throws ValidationException if the device id is blank or a timestamp is malformed
     */
    public List<ActivityRollupDTO> generateLocalRollups(
            String deviceId, String startIso, String endIso) {
        if (deviceId == null || deviceId.isBlank()) {
            throw ValidationException.missingParameter("deviceId");
        }
        Instant start = parseInstant("start", startIso);
        Instant end = parseInstant("end", endIso);
        if (!end.isAfter(start)) {
            throw ValidationException.invalidParameter("end", endIso, "a timestamp after start");
        }

        List<ActivitySpan> spans =
                parser.parseAll(store.findIntervalsStartedBetween(start, end)).spans();

        Map<Long, long[]> buckets = new TreeMap<>();
        for (ActivitySpan span : spans) {
            long[] totals =
                    buckets.computeIfAbsent(
                            WindowClipper.floorToHour(span.startMs()), hour -> new long[4]);
            totals[bucketIndex(span)] += Math.round(span.activeSeconds());
            totals[3] += Math.round(span.idleSeconds());
        }

        Instant now = clock.instant();
        List<ActivityRollupDTO> rollups = new ArrayList<>(buckets.size());
        buckets.forEach(
                (hour, totals) ->
                        rollups.add(
                                new ActivityRollupDTO(
                                        deviceId.trim(),
                                        Instant.ofEpochMilli(hour),
                                        totals[0],
                                        totals[1],
                                        totals[2],
                                        totals[3],
                                        now)));
        LOG.debugf(
                "Generated %d rollups for device %s from %d intervals in [%s, %s)",
                rollups.size(), deviceId, spans.size(), start, end);
        return rollups;
    }

    private int bucketIndex(ActivitySpan span) {
        if (privacyFilter.isSuppressed(span.domain(), span.appName())) {
            return 1;
        }
        if (span.category() == ActivityCategory.PRODUCTIVE) {
            return 0;
        }
        if (span.category() == ActivityCategory.FRIVOLITY) {
            return 2;
        }
        return 1;
    }

    /**
     * Stores the rollups, replacing any existing row with the same device and hour.
     *
     * @return number of rollups written
     */
    public int upsertRollups(List<ActivityRollupDTO> rollups) {
        if (rollups == null || rollups.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        List<ActivityRollupDTO> normalized = new ArrayList<>(rollups.size());
        for (int i = 0; i < rollups.size(); i++) {
            ActivityRollupDTO rollup = rollups.get(i);
            if (rollup == null || rollup.deviceId() == null || rollup.deviceId().isBlank()) {
                throw ValidationException.missingParameter("rollups[" + i + "].deviceId");
            }
            if (rollup.hourStart() == null) {
                throw ValidationException.missingParameter("rollups[" + i + "].hourStart");
            }
            if (rollup.productive() < 0
                    || rollup.neutral() < 0
                    || rollup.frivolity() < 0
                    || rollup.idle() < 0) {
                throw ValidationException.invalidParameter(
                        "rollups[" + i + "]", rollup, "non-negative second totals");
            }
            Instant hourStart =
                    Instant.ofEpochMilli(
                            WindowClipper.floorToHour(rollup.hourStart().toEpochMilli()));
            normalized.add(
                    new ActivityRollupDTO(
                            rollup.deviceId().trim(),
                            hourStart,
                            rollup.productive(),
                            rollup.neutral(),
                            rollup.frivolity(),
                            rollup.idle(),
                            rollup.updatedAt() != null ? rollup.updatedAt() : now));
        }
        store.upsertActivityRollups(normalized);
        LOG.infof("Upserted %d activity rollups", normalized.size());
        return normalized.size();
    }

    /**
     * Rollups of a device whose {@code updatedAt} is at or after the given timestamp.
     */
    public List<ActivityRollupDTO> listSince(String deviceId, String updatedAfterIso) {
        if (deviceId == null || deviceId.isBlank()) {
            throw ValidationException.missingParameter("deviceId");
        }
        Instant updatedAfter = parseInstant("updatedAfter", updatedAfterIso);
        return store.findRollupsUpdatedSince(deviceId.trim(), updatedAfter).stream()
                .map(ActivityRollup::toDTO)
                .toList();
    }

    /**
     * Totals of stored rollups over the trailing {@code windowHours} hours (current hour
     * included), for one device or for all devices when {@code deviceId} is {@code null}.
     */
    public ActivitySummaryDTO getSummary(String deviceId, int windowHours) {
        int hours = Math.max(MIN_WINDOW_HOURS, Math.min(MAX_WINDOW_HOURS, windowHours));
        String device = deviceId == null || deviceId.isBlank() ? null : deviceId.trim();
        long currentHour = WindowClipper.floorToHour(clock.millis());
        long sinceMs = currentHour - (hours - 1) * WindowClipper.HOUR_MS;

        List<ActivityRollup> rows = store.findRollupsFromHour(device, Instant.ofEpochMilli(sinceMs));

        long[][] slots = new long[hours][4];
        long productive = 0;
        long neutral = 0;
        long frivolity = 0;
        long idle = 0;
        int sampleCount = 0;
        for (ActivityRollup row : rows) {
            int index =
                    (int) ((row.hourStart.toEpochMilli() - sinceMs) / WindowClipper.HOUR_MS);
            if (index < 0 || index >= hours) {
                continue;
            }
            slots[index][0] += row.productive;
            slots[index][1] += row.neutral;
            slots[index][2] += row.frivolity;
            slots[index][3] += row.idle;
            productive += row.productive;
            neutral += row.neutral;
            frivolity += row.frivolity;
            idle += row.idle;
            sampleCount++;
        }

        List<TimelineSlotDTO> timeline = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            long[] slot = slots[i];
            CategoryTotals totals = new CategoryTotals();
            totals.add(ActivityCategory.PRODUCTIVE, slot[0], slot[3]);
            totals.addActive(ActivityCategory.NEUTRAL, slot[1]);
            totals.addActive(ActivityCategory.FRIVOLITY, slot[2]);
            timeline.add(
                    new TimelineSlotDTO(
                            Instant.ofEpochMilli(sinceMs + i * WindowClipper.HOUR_MS),
                            slot[0],
                            slot[1],
                            slot[2],
                            slot[3],
                            totals.dominantCategory()));
        }

        return new ActivitySummaryDTO(
                device,
                hours,
                Instant.ofEpochMilli(sinceMs),
                productive,
                neutral,
                frivolity,
                idle,
                productive + neutral + frivolity,
                sampleCount,
                timeline);
    }

    static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter(name);
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidParameter(name, value, "an ISO-8601 instant");
        }
    }
}
