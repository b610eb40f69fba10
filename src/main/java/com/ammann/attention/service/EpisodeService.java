/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.dto.BehaviorEpisodeDTO;
import com.ammann.attention.dto.BehaviorEpisodesDTO;
import com.ammann.attention.dto.ContextSecondsDTO;
import com.ammann.attention.dto.EpisodeEventCountsDTO;
import com.ammann.attention.dto.EpisodeQueryDTO;
import com.ammann.attention.dto.EpisodeRatesDTO;
import com.ammann.attention.dto.EpisodeSummaryDTO;
import com.ammann.attention.dto.EpisodeTimelineBinDTO;
import com.ammann.attention.dto.TimeWindowDTO;
import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.enumeration.BehaviorEventType;
import com.ammann.attention.model.ActivitySpan;
import com.ammann.attention.model.BehaviorEvent;
import com.ammann.attention.service.IntervalParser.ParsedIntervals;
import com.ammann.attention.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Cuts the activity of a time range into behaviour episodes: runs of activity in which no two
 * consecutive slices are separated by more than a gap threshold.
 *
 * <p>Each episode carries category totals, its top domains and applications, the behaviour
 * events that fall inside it and a fixed-width timeline. Suppressed activity counts as neutral
 * time and never contributes a domain or application name.
 */
@ApplicationScoped
public class EpisodeService {

    private static final Logger LOG = Logger.getLogger(EpisodeService.class);

    public static final int DEFAULT_HOURS = 24;
    public static final int MAX_HOURS = 24 * 14;
    public static final int DEFAULT_GAP_MINUTES = 8;
    public static final int MAX_GAP_MINUTES = 120;
    public static final int DEFAULT_BIN_SECONDS = 30;
    public static final int MIN_BIN_SECONDS = 5;
    public static final int MAX_BIN_SECONDS = 300;
    public static final int DEFAULT_MAX_EPISODES = 100;
    public static final int MAX_EPISODES = 500;

    static final int EPISODE_TOP_CONTEXTS = 8;
    static final int SUMMARY_TOP_CONTEXTS = 12;
    static final String UNKNOWN_CONTEXT = "unknown";

    private final IntervalStore store;
    private final IntervalParser parser;
    private final PrivacyFilter privacyFilter;
    private final Clock clock;

    @Inject
    public EpisodeService(
            IntervalStore store, IntervalParser parser, PrivacyFilter privacyFilter, Clock clock) {
        this.store = store;
        this.parser = parser;
        this.privacyFilter = privacyFilter;
        this.clock = clock;
    }

    /**
     * Episodes of {@code [start, end]}. A missing end means now; a missing start means
     * {@code hours} before the end. Reversed bounds are swapped. Only the most recent
     * {@code maxEpisodes} episodes are returned.
     *
     * @throws com.ammann.attention.exception.ValidationException for a malformed timestamp
     */
    public BehaviorEpisodesDTO getEpisodes(
            String startIso,
            String endIso,
            int hours,
            int gapMinutes,
            int binSeconds,
            int maxEpisodes) {
        int safeHours = clamp(hours, 1, MAX_HOURS);
        int safeGapMinutes = clamp(gapMinutes, 1, MAX_GAP_MINUTES);
        int safeBinSeconds = clamp(binSeconds, MIN_BIN_SECONDS, MAX_BIN_SECONDS);
        int safeMaxEpisodes = clamp(maxEpisodes, 1, MAX_EPISODES);

        Instant now = clock.instant();
        Instant rangeEnd =
                isBlank(endIso) ? now : RollupAccumulatorService.parseInstant("end", endIso);
        Instant rangeStart =
                isBlank(startIso)
                        ? rangeEnd.minus(Duration.ofHours(safeHours))
                        : RollupAccumulatorService.parseInstant("start", startIso);
        if (rangeStart.isAfter(rangeEnd)) {
            Instant swap = rangeStart;
            rangeStart = rangeEnd;
            rangeEnd = swap;
        }
        long startMs = rangeStart.toEpochMilli();
        long endMs = rangeEnd.toEpochMilli();

        ParsedIntervals parsed =
                parser.parseAll(store.findIntervalsOverlapping(rangeStart, rangeEnd));
        List<Slice> slices = new ArrayList<>();
        for (ActivitySpan span : parsed.spans()) {
            Optional<ClippedContribution> clipped = WindowClipper.clip(span, startMs, endMs);
            clipped.ifPresent(clip -> slices.add(toSlice(span, clip)));
        }
        slices.sort(
                Comparator.comparingLong((Slice s) -> s.clip().overlapStartMs())
                        .thenComparingLong(s -> s.clip().overlapEndMs()));

        List<Episode> segmented = segment(slices, safeGapMinutes * 60_000L);
        int dropped = Math.max(0, segmented.size() - safeMaxEpisodes);
        List<Episode> kept = segmented.subList(dropped, segmented.size());
        List<BehaviorEvent> events = store.findBehaviorEventsBetween(rangeStart, rangeEnd);

        List<BehaviorEpisodeDTO> episodes = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            episodes.add(describe(kept.get(i), i, events, safeBinSeconds * 1000L));
        }

        LOG.debugf(
                "Episodes %s..%s: %d slices, %d events, %d episodes (%d dropped), %d rejected",
                rangeStart,
                rangeEnd,
                slices.size(),
                events.size(),
                episodes.size(),
                dropped,
                parsed.rejected());

        return new BehaviorEpisodesDTO(
                now,
                TimeWindowDTO.create(rangeStart, rangeEnd),
                new EpisodeQueryDTO(
                        rangeStart,
                        rangeEnd,
                        safeHours,
                        safeGapMinutes,
                        safeBinSeconds,
                        safeMaxEpisodes),
                summarize(episodes),
                episodes);
    }

    private Slice toSlice(ActivitySpan span, ClippedContribution clip) {
        boolean suppressed = privacyFilter.isSuppressed(span.domain(), span.appName());
        if (suppressed) {
            return new Slice(clip, ActivityCategory.NEUTRAL, null, null);
        }
        String label = span.contextLabel();
        return new Slice(
                clip,
                span.category(),
                label != null ? label : UNKNOWN_CONTEXT,
                span.appName());
    }

    /**
     * Groups chronologically sorted slices. A slice starting more than {@code gapMs} after the
     * latest end seen so far opens a new episode.
     */
    static List<Episode> segment(List<Slice> slices, long gapMs) {
        List<Episode> episodes = new ArrayList<>();
        Episode current = null;
        for (Slice slice : slices) {
            if (current == null || slice.clip().overlapStartMs() - current.endMs > gapMs) {
                current = new Episode(slice.clip().overlapStartMs(), slice.clip().overlapEndMs());
                episodes.add(current);
            } else {
                current.endMs = Math.max(current.endMs, slice.clip().overlapEndMs());
            }
            current.slices.add(slice);
        }
        return episodes;
    }

    private BehaviorEpisodeDTO describe(
            Episode episode, int index, List<BehaviorEvent> events, long binMs) {
        long durationSeconds = Math.max(1L, Math.round((episode.endMs - episode.startMs) / 1000.0));

        CategoryTotals totals = new CategoryTotals();
        Map<String, Double> domainSeconds = new HashMap<>();
        Map<String, Double> appSeconds = new HashMap<>();
        double activeSeconds = 0;
        double idleSeconds = 0;
        int domainSwitches = 0;
        String previousLabel = null;
        for (Slice slice : episode.slices) {
            double active = slice.clip().activeSeconds();
            activeSeconds += active;
            idleSeconds += slice.clip().idleSeconds();
            totals.add(slice.category(), active, slice.clip().idleSeconds());
            if (slice.label() != null) {
                domainSeconds.merge(slice.label(), active, Double::sum);
                if (previousLabel != null && !previousLabel.equals(slice.label())) {
                    domainSwitches++;
                }
                previousLabel = slice.label();
            }
            if (slice.appName() != null) {
                appSeconds.merge(slice.appName(), active, Double::sum);
            }
        }

        List<BehaviorEvent> episodeEvents = new ArrayList<>();
        EventTally tally = new EventTally();
        for (BehaviorEvent event : events) {
            long ts = event.occurredAt.toEpochMilli();
            if (ts >= episode.startMs && ts <= episode.endMs) {
                episodeEvents.add(event);
                tally.add(event);
            }
        }

        double durationMinutes = Math.max(1.0 / 60.0, durationSeconds / 60.0);
        long actions =
                tally.get(BehaviorEventType.SCROLL)
                        + tally.get(BehaviorEventType.CLICK)
                        + tally.get(BehaviorEventType.KEYSTROKE);
        EpisodeRatesDTO rates =
                new EpisodeRatesDTO(
                        perMinute(actions, durationMinutes),
                        perMinute(tally.get(BehaviorEventType.SCROLL), durationMinutes),
                        perMinute(tally.get(BehaviorEventType.CLICK), durationMinutes),
                        perMinute(tally.get(BehaviorEventType.KEYSTROKE), durationMinutes),
                        perMinute(
                                tally.get(BehaviorEventType.FOCUS)
                                        + tally.get(BehaviorEventType.BLUR),
                                durationMinutes));

        return new BehaviorEpisodeDTO(
                "ep-" + episode.startMs + "-" + (index + 1),
                Instant.ofEpochMilli(episode.startMs),
                Instant.ofEpochMilli(episode.endMs),
                durationSeconds,
                Math.round(activeSeconds),
                Math.round(idleSeconds),
                totals.toDTO(),
                totals.dominantCategory(),
                rank(domainSeconds, EPISODE_TOP_CONTEXTS),
                rank(appSeconds, EPISODE_TOP_CONTEXTS),
                domainSwitches,
                tally.toDTO(),
                rates,
                timeline(episode, episodeEvents, binMs));
    }

    /**
     * Bins of {@code binMs} from the episode start; the last bin ends at the episode end. Slice
     * seconds are spread in proportion to the overlap with each bin.
     */
    static List<EpisodeTimelineBinDTO> timeline(
            Episode episode, List<BehaviorEvent> episodeEvents, long binMs) {
        List<EpisodeTimelineBinDTO> bins = new ArrayList<>();
        for (long binStart = episode.startMs; binStart < episode.endMs; binStart += binMs) {
            long binEnd = Math.min(episode.endMs, binStart + binMs);
            CategoryTotals totals = new CategoryTotals();
            Map<String, Double> labelSeconds = new HashMap<>();
            for (Slice slice : episode.slices) {
                ClippedContribution clip = slice.clip();
                long part =
                        WindowClipper.overlap(
                                clip.overlapStartMs(), clip.overlapEndMs(), binStart, binEnd);
                if (part <= 0) {
                    continue;
                }
                double fraction = (double) part / Math.max(1L, clip.durationMs());
                double active = clip.activeSeconds() * fraction;
                totals.add(slice.category(), active, clip.idleSeconds() * fraction);
                if (slice.label() != null) {
                    labelSeconds.merge(slice.label(), active, Double::sum);
                }
            }
            EventTally tally = new EventTally();
            for (BehaviorEvent event : episodeEvents) {
                long ts = event.occurredAt.toEpochMilli();
                if (ts >= binStart && ts < binEnd) {
                    tally.add(event);
                }
            }
            bins.add(
                    new EpisodeTimelineBinDTO(
                            Instant.ofEpochMilli(binStart),
                            Instant.ofEpochMilli(binEnd),
                            Math.round(totals.active()),
                            Math.round(totals.idle()),
                            totals.toDTO(),
                            tally.toDTO(),
                            AttentionReportService.topDomain(labelSeconds)));
        }
        return bins;
    }

    static EpisodeSummaryDTO summarize(List<BehaviorEpisodeDTO> episodes) {
        long duration = 0;
        long active = 0;
        long idle = 0;
        Map<String, Double> domainTotals = new HashMap<>();
        for (BehaviorEpisodeDTO episode : episodes) {
            duration += episode.durationSeconds();
            active += episode.activeSeconds();
            idle += episode.idleSeconds();
            for (ContextSecondsDTO domain : episode.topDomains()) {
                domainTotals.merge(domain.name(), (double) domain.activeSeconds(), Double::sum);
            }
        }
        return new EpisodeSummaryDTO(
                episodes.size(), duration, active, idle, rank(domainTotals, SUMMARY_TOP_CONTEXTS));
    }

    /**
     * Entries by descending seconds, name ascending on ties, at most {@code limit}.
     */
    static List<ContextSecondsDTO> rank(Map<String, Double> seconds, int limit) {
        return seconds.entrySet().stream()
                .sorted(
                        Map.Entry.<String, Double>comparingByValue()
                                .reversed()
                                .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(entry -> new ContextSecondsDTO(entry.getKey(), Math.round(entry.getValue())))
                .toList();
    }

    static double perMinute(long count, double minutes) {
        return Math.round(count / minutes * 10.0) / 10.0;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Clipped activity with its effective category. {@code label} and {@code appName} are
     * {@code null} for suppressed activity.
     */
    record Slice(
            ClippedContribution clip, ActivityCategory category, String label, String appName) {}

    static final class Episode {
        final long startMs;
        long endMs;
        final List<Slice> slices = new ArrayList<>();

        Episode(long startMs, long endMs) {
            this.startMs = startMs;
            this.endMs = endMs;
        }
    }

    /**
     * Per-type event counter. An event counts {@code valueInt} times when it carries a repeat
     * count, once otherwise; unknown types are ignored.
     */
    static final class EventTally {
        private final long[] counts = new long[BehaviorEventType.values().length];

        void add(BehaviorEvent event) {
            BehaviorEventType type = BehaviorEventType.fromWireValue(event.eventType);
            if (type == null) {
                return;
            }
            counts[type.ordinal()] += event.valueInt != null ? Math.max(1L, event.valueInt) : 1L;
        }

        long get(BehaviorEventType type) {
            return counts[type.ordinal()];
        }

        EpisodeEventCountsDTO toDTO() {
            return new EpisodeEventCountsDTO(
                    get(BehaviorEventType.SCROLL),
                    get(BehaviorEventType.CLICK),
                    get(BehaviorEventType.KEYSTROKE),
                    get(BehaviorEventType.FOCUS),
                    get(BehaviorEventType.BLUR),
                    get(BehaviorEventType.IDLE_START),
                    get(BehaviorEventType.IDLE_END),
                    get(BehaviorEventType.VISIBILITY));
        }
    }
}
