/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.config.AnalyticsSettings;
import com.ammann.attention.dto.ReadingProgressDTO;
import com.ammann.attention.dto.WritingProgressDTO;
import com.ammann.attention.exception.ValidationException;
import com.ammann.attention.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import org.jboss.logging.Logger;

/**
 * Adds reading and writing progress deltas to their hourly and logical-day rollups.
 */
@ApplicationScoped
public class AuxiliaryRollupService {

    private static final Logger LOG = Logger.getLogger(AuxiliaryRollupService.class);

    private final IntervalStore store;
    private final AnalyticsSettings settings;
    private final Clock clock;

    @Inject
    public AuxiliaryRollupService(IntervalStore store, AnalyticsSettings settings, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * @throws ValidationException if a time or keystroke delta is negative or not finite
     */
    public void recordWritingProgress(WritingProgressDTO delta) {
        if (delta == null) {
            throw new ValidationException("Writing progress must not be empty");
        }
        requireNonNegative("activeSeconds", delta.activeSeconds());
        requireNonNegative("focusedSeconds", delta.focusedSeconds());
        if (delta.keystrokes() < 0) {
            throw ValidationException.invalidParameter(
                    "keystrokes", delta.keystrokes(), "a non-negative count");
        }
        Instant now = clock.instant();
        Instant occurredAt = delta.occurredAt() != null ? delta.occurredAt() : now;
        Instant hourStart = hourOf(occurredAt);
        LocalDate day = DayClock.of(settings).logicalDay(occurredAt);

        store.accumulateWriting(hourStart, day, delta, now);
        LOG.debugf(
                "Writing progress at %s (day %s): +%.1fs active, %+d words",
                hourStart, day, delta.activeSeconds(), delta.netWords());
    }

    /**
     * @throws ValidationException if a time delta is negative or not finite
     */
    public void recordReadingProgress(ReadingProgressDTO delta) {
        if (delta == null) {
            throw new ValidationException("Reading progress must not be empty");
        }
        requireNonNegative("activeSeconds", delta.activeSeconds());
        requireNonNegative("focusedSeconds", delta.focusedSeconds());
        Instant now = clock.instant();
        Instant occurredAt = delta.occurredAt() != null ? delta.occurredAt() : now;
        Instant hourStart = hourOf(occurredAt);
        LocalDate day = DayClock.of(settings).logicalDay(occurredAt);

        store.accumulateReading(hourStart, day, delta, now);
        LOG.debugf(
                "Reading progress at %s (day %s): +%.1fs active",
                hourStart, day, delta.activeSeconds());
    }

    private static Instant hourOf(Instant instant) {
        return Instant.ofEpochMilli(WindowClipper.floorToHour(instant.toEpochMilli()));
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw ValidationException.invalidParameter(name, value, "a finite non-negative number");
        }
    }
}
