/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.config.AnalyticsSettings;
import com.ammann.attention.dto.BehavioralPatternDTO;
import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.model.ActivitySpan;
import com.ammann.attention.model.BehavioralPattern;
import com.ammann.attention.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Mines "what follows what" transitions between consecutive activities and keeps the pattern
 * table fresh.
 *
 * <p>The table is recomputed synchronously on read once it is older than
 * {@code attention.patterns.max-age}. Concurrent stale reads may both recompute; each
 * recompute replaces the table in a single transaction.
 */
@ApplicationScoped
public class TransitionMinerService {

    private static final Logger LOG = Logger.getLogger(TransitionMinerService.class);

    /** Transition count at which the correlation strength reaches 1. */
    public static final int SATURATION_COUNT = 10;

    private final IntervalStore store;
    private final IntervalParser parser;
    private final PrivacyFilter privacyFilter;
    private final AnalyticsSettings settings;
    private final Clock clock;
    private final PatternCache patternCache;
    private final int patternLimit;

    @Inject
    public TransitionMinerService(
            IntervalStore store,
            IntervalParser parser,
            PrivacyFilter privacyFilter,
            AnalyticsSettings settings,
            Clock clock,
            @ConfigProperty(name = "attention.patterns.max-age", defaultValue = "PT1H")
                    Duration maxAge,
            @ConfigProperty(name = "attention.patterns.limit", defaultValue = "50")
                    int patternLimit) {
        this.store = store;
        this.parser = parser;
        this.privacyFilter = privacyFilter;
        this.settings = settings;
        this.clock = clock;
        this.patternLimit = patternLimit;
        this.patternCache = new PatternCache(maxAge, store::latestPatternComputedAt);
    }

    /**
     * Saturating weight of a transition count: {@code min(1, count / SATURATION_COUNT)}, 0 for
     * non-positive counts.
     */
    public static double correlationStrength(int count) {
        if (count <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) count / SATURATION_COUNT);
    }

    private record ContextKey(
            ActivityCategory fromCategory,
            String fromDomain,
            ActivityCategory toCategory,
            String toDomain) {}

    private static final class TransitionStats {
        int count;
        double totalDurationBefore;
        final int[] hourHistogram = new int[WindowClipper.HOURS_PER_DAY];
    }

    /**
     * Rebuilds the pattern table from the intervals of the last {@code days} days.
     *
     * @return the new patterns, most frequent first
     */
    public List<BehavioralPatternDTO> computeTransitionPatterns(int days) {
        DayClock dayClock = DayClock.of(settings);
        Instant now = clock.instant();
        Instant start = now.minus(Duration.ofDays(AttentionReportService.clampDays(days)));

        List<ActivitySpan> spans =
                new ArrayList<>(parser.parseAll(store.findIntervalsOverlapping(start, now)).spans());
        spans.sort(Comparator.comparingLong(ActivitySpan::startMs));

        Map<ContextKey, TransitionStats> transitions = new LinkedHashMap<>();
        for (int i = 1; i < spans.size(); i++) {
            ActivitySpan previous = spans.get(i - 1);
            ActivitySpan current = spans.get(i);
            boolean previousSuppressed =
                    privacyFilter.isSuppressed(previous.domain(), previous.appName());
            boolean currentSuppressed =
                    privacyFilter.isSuppressed(current.domain(), current.appName());

            ContextKey key =
                    new ContextKey(
                            previousSuppressed ? ActivityCategory.NEUTRAL : previous.category(),
                            previousSuppressed ? null : previous.contextLabel(),
                            currentSuppressed ? ActivityCategory.NEUTRAL : current.category(),
                            currentSuppressed ? null : current.contextLabel());
            TransitionStats stats = transitions.computeIfAbsent(key, k -> new TransitionStats());
            stats.count++;
            stats.totalDurationBefore += previous.activeSeconds();
            stats.hourHistogram[dayClock.hourOfDay(current.startMs())]++;
        }

        List<BehavioralPattern> patterns = new ArrayList<>(transitions.size());
        transitions.forEach(
                (key, stats) -> {
                    BehavioralPattern pattern = new BehavioralPattern();
                    pattern.computedAt = now;
                    pattern.fromCategory = key.fromCategory();
                    pattern.fromDomain = key.fromDomain();
                    pattern.toCategory = key.toCategory();
                    pattern.toDomain = key.toDomain();
                    pattern.frequency = stats.count;
                    pattern.avgDurationBeforeSeconds = stats.totalDurationBefore / stats.count;
                    pattern.correlationStrength = correlationStrength(stats.count);
                    pattern.dominantHourOfDay = dominantHour(stats.hourHistogram);
                    patterns.add(pattern);
                });
        patterns.sort(Comparator.comparingInt((BehavioralPattern p) -> p.frequency).reversed());

        store.replacePatterns(patterns);
        patternCache.markComputed(now);
        LOG.infof(
                "Computed %d behavioral patterns from %d intervals over %d days",
                patterns.size(), spans.size(), AttentionReportService.clampDays(days));

        return patterns.stream().map(BehavioralPattern::toDTO).toList();
    }

    /**
     * Most frequent stored patterns, recomputing the table first when it is stale.
     */
    public List<BehavioralPatternDTO> getBehavioralPatterns(int days) {
        Instant now = clock.instant();
        if (patternCache.isStale(now)) {
            LOG.debugf(
                    "Pattern table stale (last computed %s), recomputing",
                    patternCache.lastComputedAt().orElse(null));
            computeTransitionPatterns(days);
        }
        return store.findTopPatterns(patternLimit).stream()
                .map(BehavioralPattern::toDTO)
                .toList();
    }

    static int dominantHour(int[] histogram) {
        int best = 0;
        for (int hour = 1; hour < histogram.length; hour++) {
            if (histogram[hour] > histogram[best]) {
                best = hour;
            }
        }
        return best;
    }
}
