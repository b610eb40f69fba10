/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.dto.BehaviorEventDTO;
import com.ammann.attention.dto.EngagementMetricsDTO;
import com.ammann.attention.dto.IngestResultDTO;
import com.ammann.attention.dto.TimeWindowDTO;
import com.ammann.attention.enumeration.BehaviorEventType;
import com.ammann.attention.enumeration.EngagementLevel;
import com.ammann.attention.exception.ValidationException;
import com.ammann.attention.model.ActivitySpan;
import com.ammann.attention.model.BehaviorEvent;
import com.ammann.attention.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Scores how engaged the user is with a single domain from clipped interval time and the
 * behaviour-event stream, and ingests that stream.
 */
@ApplicationScoped
public class EngagementScorerService {

    private static final Logger LOG = Logger.getLogger(EngagementScorerService.class);

    public static final int CLICK_WEIGHT = 5;
    public static final int KEYSTROKE_WEIGHT = 2;
    /** Scroll velocity (px/s) at which scrolling cancels out all interaction. */
    public static final double VELOCITY_SCALE = 1000.0;
    public static final int MAX_FIXATION_SCORE = 100;

    private final IntervalStore store;
    private final IntervalParser parser;
    private final Clock clock;

    @Inject
    public EngagementScorerService(IntervalStore store, IntervalParser parser, Clock clock) {
        this.store = store;
        this.parser = parser;
        this.clock = clock;
    }

    /**
     * Engagement of one domain over the last {@code days} days.
     *
     * @throws ValidationException if the domain is blank
     */
    public EngagementMetricsDTO getEngagementMetrics(String domain, int days) {
        if (domain == null || domain.isBlank()) {
            throw ValidationException.missingParameter("domain");
        }
        String target = domain.trim();
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(AttentionReportService.clampDays(days)));
        long startMs = start.toEpochMilli();
        long endMs = end.toEpochMilli();

        int sessionCount = 0;
        double activeSeconds = 0;
        List<ActivitySpan> spans =
                parser.parseAll(store.findIntervalsOverlappingForDomain(target, start, end))
                        .spans();
        for (ActivitySpan span : spans) {
            Optional<ClippedContribution> clipped = WindowClipper.clip(span, startMs, endMs);
            if (clipped.isPresent()) {
                sessionCount++;
                activeSeconds += clipped.get().activeSeconds();
            }
        }
        long totalSeconds = Math.round(activeSeconds);

        double scrollDepthSum = 0;
        int scrollDepthSamples = 0;
        double scrollVelocitySum = 0;
        int scrollVelocitySamples = 0;
        long clicks = 0;
        long keystrokes = 0;
        for (BehaviorEvent event : store.findBehaviorEvents(target, start, end)) {
            BehaviorEventType type = BehaviorEventType.fromWireValue(event.eventType);
            if (type == null) {
                continue;
            }
            switch (type) {
                case SCROLL -> {
                    if (event.valueInt != null) {
                        scrollDepthSum += event.valueInt;
                        scrollDepthSamples++;
                    }
                    if (event.valueFloat != null && Double.isFinite(event.valueFloat)) {
                        scrollVelocitySum += event.valueFloat;
                        scrollVelocitySamples++;
                    }
                }
                case CLICK -> clicks += event.valueInt != null ? event.valueInt : 1;
                case KEYSTROKE -> keystrokes += event.valueInt != null ? event.valueInt : 1;
                default -> {
                    // stored for later analysis, not scored
                }
            }
        }

        long avgScrollDepth =
                scrollDepthSamples > 0 ? Math.round(scrollDepthSum / scrollDepthSamples) : 0;
        long avgScrollVelocity =
                scrollVelocitySamples > 0
                        ? Math.round(scrollVelocitySum / scrollVelocitySamples)
                        : 0;
        double minutes = Math.max(1.0, totalSeconds / 60.0);
        double clicksPerMinute = roundToTenth(clicks / minutes);
        double keystrokesPerMinute = roundToTenth(keystrokes / minutes);

        int fixationScore =
                fixationScore(clicksPerMinute, keystrokesPerMinute, avgScrollVelocity);
        EngagementLevel level = EngagementLevel.fromFixationScore(fixationScore);

        LOG.debugf(
                "Engagement for %s over %d days: sessions=%d seconds=%d fixation=%d",
                target, AttentionReportService.clampDays(days), sessionCount, totalSeconds,
                fixationScore);

        return new EngagementMetricsDTO(
                target,
                TimeWindowDTO.create(start, end),
                sessionCount,
                totalSeconds,
                avgScrollDepth,
                avgScrollVelocity,
                clicksPerMinute,
                keystrokesPerMinute,
                fixationScore,
                level);
    }

    /**
     * Interaction intensity damped by scroll velocity, within 0-100.
     */
    public static int fixationScore(
            double clicksPerMinute, double keystrokesPerMinute, double scrollVelocity) {
        double interaction = clicksPerMinute * CLICK_WEIGHT + keystrokesPerMinute * KEYSTROKE_WEIGHT;
        long raw = Math.round(interaction * (1.0 - scrollVelocity / VELOCITY_SCALE));
        return (int) Math.max(0L, Math.min(MAX_FIXATION_SCORE, raw));
    }

    /**
     * Stores a batch of behaviour events in one transaction. Events with a malformed timestamp,
     * a missing domain or an unknown type are skipped and reported.
     *
     * @throws ValidationException if the batch is empty
     */
    public IngestResultDTO ingestBehaviorEvents(List<BehaviorEventDTO> events) {
        if (events == null || events.isEmpty()) {
            throw new ValidationException("Behavior event batch must not be empty");
        }
        List<BehaviorEvent> accepted = new ArrayList<>(events.size());
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            BehaviorEventDTO dto = events.get(i);
            String error = validate(dto);
            if (error != null) {
                errors.add(i + ": " + error);
                continue;
            }
            BehaviorEvent event = new BehaviorEvent();
            event.occurredAt = Instant.parse(dto.timestamp().trim());
            event.sessionId = dto.sessionId();
            event.domain = dto.domain().trim();
            event.eventType = BehaviorEventType.fromWireValue(dto.type()).wireValue();
            event.valueInt = dto.valueInt();
            event.valueFloat = dto.valueFloat();
            event.metadata = dto.metadata();
            accepted.add(event);
        }
        if (!accepted.isEmpty()) {
            store.insertBehaviorEvents(accepted);
        }
        if (!errors.isEmpty()) {
            LOG.warnf(
                    "Skipped %d of %d behavior events: %s", errors.size(), events.size(), errors);
        }
        LOG.debugf("Stored %d behavior events", accepted.size());
        return new IngestResultDTO(events.size(), accepted.size(), errors.size(), errors);
    }

    private static String validate(BehaviorEventDTO dto) {
        if (dto == null) {
            return "event is null";
        }
        if (dto.timestamp() == null || dto.timestamp().isBlank()) {
            return "missing timestamp";
        }
        try {
            Instant.parse(dto.timestamp().trim());
        } catch (DateTimeParseException e) {
            return "malformed timestamp '" + dto.timestamp() + "'";
        }
        if (dto.domain() == null || dto.domain().isBlank()) {
            return "missing domain";
        }
        if (dto.type() == null || dto.type().isBlank()) {
            return "missing type";
        }
        if (BehaviorEventType.fromWireValue(dto.type()) == null) {
            return "unknown type '" + dto.type() + "'";
        }
        return null;
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
