/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.config.AnalyticsSettings;
import com.ammann.attention.dto.AnalyticsOverviewDTO;
import com.ammann.attention.dto.TimeOfDayStatsDTO;
import com.ammann.attention.dto.TimeWindowDTO;
import com.ammann.attention.dto.TrendPointDTO;
import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.enumeration.FocusTrend;
import com.ammann.attention.enumeration.TrendGranularity;
import com.ammann.attention.exception.ValidationException;
import com.ammann.attention.model.ActivitySpan;
import com.ammann.attention.model.PomodoroSession;
import com.ammann.attention.model.ReadingHourlyRollup;
import com.ammann.attention.model.WritingHourlyRollup;
import com.ammann.attention.service.IntervalParser.ParsedIntervals;
import com.ammann.attention.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * On-demand reports over the activity intervals of a trailing window: overview, time-of-day
 * profile and trend series.
 *
 * <p>Every report follows the same pipeline. Intervals overlapping the window are validated,
 * clipped to the window, recategorised as neutral when the privacy filter suppresses them and
 * folded into buckets. Reading and writing rollups count as productive time; focus sessions
 * are reported separately as deep work.
 */
@ApplicationScoped
public class AttentionReportService {

    private static final Logger LOG = Logger.getLogger(AttentionReportService.class);

    public static final int MIN_DAYS = 1;
    public static final int MAX_DAYS = 365;

    public static final int DEFAULT_PEAK_HOUR = 9;
    public static final int DEFAULT_RISK_HOUR = 15;
    static final int NEUTRAL_SCORE = 50;

    private static final long DAY_MS = Duration.ofDays(1).toMillis();

    // Columns of the trend accumulation matrix
    private static final int PRODUCTIVE = 0;
    private static final int NEUTRAL = 1;
    private static final int FRIVOLITY = 2;
    private static final int EMERGENCY = 3;
    private static final int IDLE = 4;
    private static final int DEEP_WORK = 5;
    private static final int TREND_COLUMNS = 6;

    private final IntervalStore store;
    private final IntervalParser parser;
    private final PrivacyFilter privacyFilter;
    private final InsightGenerator insightGenerator;
    private final AnalyticsSettings settings;
    private final Clock clock;

    @Inject
    public AttentionReportService(
            IntervalStore store,
            IntervalParser parser,
            PrivacyFilter privacyFilter,
            InsightGenerator insightGenerator,
            AnalyticsSettings settings,
            Clock clock) {
        this.store = store;
        this.parser = parser;
        this.privacyFilter = privacyFilter;
        this.insightGenerator = insightGenerator;
        this.settings = settings;
        this.clock = clock;
    }

    public static int clampDays(int days) {
        return Math.max(MIN_DAYS, Math.min(MAX_DAYS, days));
    }

    /**
     * Category totals, productivity score, peak and risk hours, focus trend, deep work and
     * insights for the last {@code days} days.
     */
    public AnalyticsOverviewDTO getOverview(int days) {
        DayClock dayClock = DayClock.of(settings);
        TimeWindowDTO window = trailingWindow(days);
        long rangeStart = window.startMs();
        long rangeEnd = window.endMs();

        ParsedIntervals parsed =
                parser.parseAll(store.findIntervalsOverlapping(window.start(), window.end()));
        List<ActivitySpan> spans = new ArrayList<>(parsed.spans());
        spans.sort(Comparator.comparingLong(ActivitySpan::startMs));

        CategoryTotals totals = new CategoryTotals();
        double[] hourlyProductive = new double[WindowClipper.HOURS_PER_DAY];
        double[] hourlyDistraction = new double[WindowClipper.HOURS_PER_DAY];
        Map<String, Double> domainSeconds = new HashMap<>();
        int sessions = 0;

        for (ActivitySpan span : spans) {
            Optional<ClippedContribution> clipped = WindowClipper.clip(span, rangeStart, rangeEnd);
            if (clipped.isEmpty()) {
                continue;
            }
            ClippedContribution clip = clipped.get();
            boolean suppressed = privacyFilter.isSuppressed(span.domain(), span.appName());
            ActivityCategory category = suppressed ? ActivityCategory.NEUTRAL : span.category();

            sessions++;
            totals.add(category, clip.activeSeconds(), clip.idleSeconds());

            boolean distraction = category != null && category.isDistraction();
            if (category == ActivityCategory.PRODUCTIVE || distraction) {
                for (BucketAllocation allocation : WindowClipper.distributeAcrossHours(clip)) {
                    int hour = dayClock.hourOfDay(allocation.bucketStartMs());
                    if (category == ActivityCategory.PRODUCTIVE) {
                        hourlyProductive[hour] += allocation.activeSeconds();
                    } else {
                        hourlyDistraction[hour] += allocation.activeSeconds();
                    }
                }
            }
            String label = span.contextLabel();
            if (!suppressed && label != null) {
                domainSeconds.merge(label, clip.activeSeconds(), Double::sum);
            }
        }

        FocusTrend focusTrend = focusTrend(spans);

        // Daily rollups cover the last D logical days, today included
        LocalDate toDay = dayClock.logicalDay(window.end());
        LocalDate fromDay = toDay.minusDays(clampDays(days) - 1L);
        double readingSeconds = store.sumReadingDailySeconds(fromDay, toDay);
        double writingSeconds = store.sumWritingDailySeconds(fromDay, toDay);
        Instant hourlyFrom = Instant.ofEpochMilli(WindowClipper.floorToHour(rangeStart));
        if (readingSeconds > 0) {
            totals.addActive(ActivityCategory.PRODUCTIVE, readingSeconds);
            for (ReadingHourlyRollup rollup : store.findReadingHourly(hourlyFrom, window.end())) {
                hourlyProductive[dayClock.hourOfDay(rollup.hourStart.toEpochMilli())] +=
                        rollup.activeSeconds;
            }
        }
        if (writingSeconds > 0) {
            totals.addActive(ActivityCategory.PRODUCTIVE, writingSeconds);
            for (WritingHourlyRollup rollup : store.findWritingHourly(hourlyFrom, window.end())) {
                hourlyProductive[dayClock.hourOfDay(rollup.hourStart.toEpochMilli())] +=
                        rollup.activeSeconds;
            }
        }

        long deepWorkSeconds = 0;
        for (PomodoroSession session : store.findPomodorosOverlapping(window.start(), window.end())) {
            deepWorkSeconds +=
                    Math.round(sessionOverlapMs(session, rangeStart, rangeEnd, rangeEnd) / 1000.0);
        }

        double active = totals.active();
        int productivityScore =
                active > 0 ? (int) Math.round(totals.productive() / active * 100.0) : NEUTRAL_SCORE;
        int peakHour = argmax(hourlyProductive, DEFAULT_PEAK_HOUR);
        int riskHour = argmax(hourlyDistraction, DEFAULT_RISK_HOUR);

        List<String> insights =
                insightGenerator.generate(
                        new InsightGenerator.Facts(
                                peakHour,
                                riskHour,
                                totals.productive(),
                                totals.distraction(),
                                active,
                                totals.idle(),
                                focusTrend,
                                Math.max(0.0, readingSeconds),
                                Math.max(0.0, writingSeconds)));

        LOG.debugf(
                "Overview for %d days: %d sessions, %d rejected, productivity=%d",
                days, sessions, parsed.rejected(), productivityScore);

        return new AnalyticsOverviewDTO(
                window,
                Math.round(active / 3600.0 * 10.0) / 10.0,
                productivityScore,
                focusTrend,
                peakHour,
                riskHour,
                topDomain(domainSeconds),
                totals.toDTO(),
                deepWorkSeconds,
                sessions,
                sessions > 0 ? Math.round(active / sessions) : 0L,
                parsed.rejected(),
                insights);
    }

    /**
     * Compares the productive active seconds of the chronologically older half of the spans
     * (the larger half for odd counts) with the recent half.
     */
    FocusTrend focusTrend(List<ActivitySpan> chronological) {
        int olderCount = (chronological.size() + 1) / 2;
        double older = 0;
        double recent = 0;
        for (int i = 0; i < chronological.size(); i++) {
            ActivitySpan span = chronological.get(i);
            if (span.category() != ActivityCategory.PRODUCTIVE
                    || privacyFilter.isSuppressed(span.domain(), span.appName())) {
                continue;
            }
            if (i < olderCount) {
                older += span.activeSeconds();
            } else {
                recent += span.activeSeconds();
            }
        }
        return FocusTrend.compare(older, recent);
    }

    /**
     * 24 buckets ordered by logical hour, starting at the configured day-start hour.
     */
    public List<TimeOfDayStatsDTO> getTimeOfDayAnalysis(int days) {
        DayClock dayClock = DayClock.of(settings);
        int dayStart = dayClock.dayStartHour();
        TimeWindowDTO window = trailingWindow(days);

        CategoryTotals[] buckets = new CategoryTotals[WindowClipper.HOURS_PER_DAY];
        List<Map<String, Double>> domains = new ArrayList<>(WindowClipper.HOURS_PER_DAY);
        int[] sampleCounts = new int[WindowClipper.HOURS_PER_DAY];
        for (int i = 0; i < WindowClipper.HOURS_PER_DAY; i++) {
            buckets[i] = new CategoryTotals();
            domains.add(new HashMap<>());
        }

        ParsedIntervals parsed =
                parser.parseAll(store.findIntervalsOverlapping(window.start(), window.end()));
        for (ActivitySpan span : parsed.spans()) {
            Optional<ClippedContribution> clipped =
                    WindowClipper.clip(span, window.startMs(), window.endMs());
            if (clipped.isEmpty()) {
                continue;
            }
            boolean suppressed = privacyFilter.isSuppressed(span.domain(), span.appName());
            ActivityCategory category = suppressed ? ActivityCategory.NEUTRAL : span.category();
            String label = suppressed ? null : span.contextLabel();
            for (BucketAllocation allocation : WindowClipper.distributeAcrossHours(clipped.get())) {
                int index = dayClock.shiftedHour(allocation.bucketStartMs());
                buckets[index].add(category, allocation.activeSeconds(), allocation.idleSeconds());
                sampleCounts[index]++;
                if (label != null) {
                    domains.get(index).merge(label, allocation.activeSeconds(), Double::sum);
                }
            }
        }

        Instant hourlyFrom = Instant.ofEpochMilli(WindowClipper.floorToHour(window.startMs()));
        for (ReadingHourlyRollup rollup : store.findReadingHourly(hourlyFrom, window.end())) {
            buckets[dayClock.shiftedHour(rollup.hourStart.toEpochMilli())]
                    .addActive(ActivityCategory.PRODUCTIVE, rollup.activeSeconds);
        }
        for (WritingHourlyRollup rollup : store.findWritingHourly(hourlyFrom, window.end())) {
            buckets[dayClock.shiftedHour(rollup.hourStart.toEpochMilli())]
                    .addActive(ActivityCategory.PRODUCTIVE, rollup.activeSeconds);
        }

        List<TimeOfDayStatsDTO> result = new ArrayList<>(WindowClipper.HOURS_PER_DAY);
        for (int index = 0; index < WindowClipper.HOURS_PER_DAY; index++) {
            CategoryTotals bucket = buckets[index];
            result.add(
                    new TimeOfDayStatsDTO(
                            WindowClipper.unshift(index, dayStart),
                            bucket.toDTO(),
                            sampleCounts[index],
                            bucket.dominantCategory(),
                            topDomain(domains.get(index)),
                            bucket.engagementPercent()));
        }
        LOG.debugf(
                "Time-of-day analysis for %d days: %d spans, %d rejected",
                days, parsed.spans().size(), parsed.rejected());
        return result;
    }

    /**
     * Trend series for a granularity given as query parameter ({@code hour}, {@code day},
     * {@code week}; blank means day).
     *
     * @throws ValidationException for an unknown granularity
     */
    public List<TrendPointDTO> getTrends(String granularity) {
        TrendGranularity parsed;
        try {
            parsed = TrendGranularity.fromParameter(granularity);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter(
                    "granularity", granularity, "one of hour, day, week");
        }
        return getTrends(parsed);
    }

    /**
     * Fixed-width bucket series. Hourly and weekly grids end now; the daily grid covers the
     * current logical day and the 29 before it.
     */
    public List<TrendPointDTO> getTrends(TrendGranularity granularity) {
        long now = clock.millis();
        long width = granularity.bucketWidthMs();
        int count = granularity.bucketCount();
        long origin;
        if (granularity == TrendGranularity.DAY) {
            DayClock dayClock = DayClock.of(settings);
            LocalDate firstDay = dayClock.logicalDay(clock.instant()).minusDays(count - 1L);
            origin = dayClock.logicalDayStart(firstDay).toEpochMilli();
        } else {
            origin = now - width * count;
        }
        long gridEnd = origin + width * count;
        Instant from = Instant.ofEpochMilli(origin);
        Instant to = Instant.ofEpochMilli(gridEnd);

        double[][] series = new double[count][TREND_COLUMNS];

        ParsedIntervals parsed = parser.parseAll(store.findIntervalsOverlapping(from, to));
        for (ActivitySpan span : parsed.spans()) {
            Optional<ClippedContribution> clipped = WindowClipper.clip(span, origin, gridEnd);
            if (clipped.isEmpty()) {
                continue;
            }
            ActivityCategory category =
                    privacyFilter.isSuppressed(span.domain(), span.appName())
                            ? ActivityCategory.NEUTRAL
                            : span.category();
            int column = trendColumn(category);
            for (BucketAllocation allocation :
                    WindowClipper.distributeAcrossBuckets(clipped.get(), origin, width, count)) {
                series[allocation.bucketIndex()][column] += allocation.activeSeconds();
                series[allocation.bucketIndex()][IDLE] += allocation.idleSeconds();
            }
        }

        Instant hourlyFrom = Instant.ofEpochMilli(WindowClipper.floorToHour(origin));
        for (ReadingHourlyRollup rollup : store.findReadingHourly(hourlyFrom, to)) {
            addToBucket(series, rollup.hourStart, origin, width, count, rollup.activeSeconds);
        }
        for (WritingHourlyRollup rollup : store.findWritingHourly(hourlyFrom, to)) {
            addToBucket(series, rollup.hourStart, origin, width, count, rollup.activeSeconds);
        }

        for (PomodoroSession session : store.findPomodorosOverlapping(from, to)) {
            for (int i = 0; i < count; i++) {
                long bucketStart = origin + i * width;
                series[i][DEEP_WORK] +=
                        sessionOverlapMs(session, bucketStart, bucketStart + width, now) / 1000.0;
            }
        }

        List<TrendPointDTO> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double[] bucket = series[i];
            double active =
                    bucket[PRODUCTIVE] + bucket[NEUTRAL] + bucket[FRIVOLITY] + bucket[EMERGENCY];
            double tracked = active + bucket[IDLE];
            long bucketStart = origin + i * width;
            points.add(
                    new TrendPointDTO(
                            Instant.ofEpochMilli(bucketStart),
                            Instant.ofEpochMilli(bucketStart + width),
                            Math.round(bucket[PRODUCTIVE]),
                            Math.round(bucket[NEUTRAL]),
                            Math.round(bucket[FRIVOLITY]),
                            Math.round(bucket[EMERGENCY]),
                            Math.round(bucket[IDLE]),
                            Math.round(bucket[DEEP_WORK]),
                            tracked > 0 ? (int) Math.round(active / tracked * 100.0) : 0,
                            active > 0
                                    ? (int) Math.round(bucket[PRODUCTIVE] / active * 100.0)
                                    : NEUTRAL_SCORE));
        }
        LOG.debugf(
                "Trends (%s): %d buckets from %s, %d rejected intervals",
                granularity, count, from, parsed.rejected());
        return points;
    }

    // Draining time shares the frivolity column; emergency keeps its own
    private static int trendColumn(ActivityCategory category) {
        if (category == null) {
            return NEUTRAL;
        }
        return switch (category) {
            case PRODUCTIVE -> PRODUCTIVE;
            case EMERGENCY -> EMERGENCY;
            case FRIVOLITY, DRAINING -> FRIVOLITY;
            case NEUTRAL -> NEUTRAL;
        };
    }

    private static void addToBucket(
            double[][] series, Instant hourStart, long origin, long width, int count, double seconds) {
        long offset = hourStart.toEpochMilli() - origin;
        if (offset < 0) {
            return;
        }
        long index = offset / width;
        if (index < count) {
            series[(int) index][PRODUCTIVE] += seconds;
        }
    }

    /**
     * Overlap of a focus session with {@code [rangeStart, rangeEnd)}. A session ends at its
     * planned end, its actual end or {@code now}, whichever comes first.
     */
    static long sessionOverlapMs(PomodoroSession session, long rangeStart, long rangeEnd, long now) {
        if (session.startedAt == null) {
            return 0L;
        }
        long start = session.startedAt.toEpochMilli();
        long plannedEnd = start + Math.max(0L, session.plannedDurationSeconds) * 1000L;
        long actualEnd = session.endedAt != null ? session.endedAt.toEpochMilli() : now;
        long end = Math.min(plannedEnd, Math.min(actualEnd, rangeEnd));
        return WindowClipper.overlap(start, end, rangeStart, rangeEnd);
    }

    /**
     * Index of the largest positive value, lowest index on ties; the fallback when all are zero.
     */
    static int argmax(double[] values, int fallback) {
        int best = -1;
        for (int i = 0; i < values.length; i++) {
            if (values[i] > 0 && (best < 0 || values[i] > values[best])) {
                best = i;
            }
        }
        return best < 0 ? fallback : best;
    }

    /**
     * Domain with the most seconds, lexicographically smallest on ties, {@code null} if none.
     */
    static String topDomain(Map<String, Double> domainSeconds) {
        String best = null;
        double bestSeconds = 0;
        for (Map.Entry<String, Double> entry : domainSeconds.entrySet()) {
            double seconds = entry.getValue();
            if (seconds <= 0) {
                continue;
            }
            if (best == null
                    || seconds > bestSeconds
                    || (seconds == bestSeconds && entry.getKey().compareTo(best) < 0)) {
                best = entry.getKey();
                bestSeconds = seconds;
            }
        }
        return best;
    }

    private TimeWindowDTO trailingWindow(int days) {
        Instant end = clock.instant();
        return TimeWindowDTO.create(end.minusMillis(clampDays(days) * DAY_MS), end);
    }
}
