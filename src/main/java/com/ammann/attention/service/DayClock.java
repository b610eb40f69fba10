/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.config.AnalyticsSettings;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Converts instants to clock hours and logical days in a zone where each day starts at a
 * configurable hour instead of midnight.
 */
public final class DayClock {

    private final ZoneId zone;
    private final int dayStartHour;

    public DayClock(ZoneId zone, int dayStartHour) {
        if (dayStartHour < 0 || dayStartHour > 23) {
            throw new IllegalArgumentException("dayStartHour must be within 0-23: " + dayStartHour);
        }
        this.zone = zone;
        this.dayStartHour = dayStartHour;
    }

    public static DayClock of(AnalyticsSettings settings) {
        return new DayClock(settings.zone(), settings.dayStartHour());
    }

    public ZoneId zone() {
        return zone;
    }

    public int dayStartHour() {
        return dayStartHour;
    }

    public int hourOfDay(long epochMs) {
        return Instant.ofEpochMilli(epochMs).atZone(zone).getHour();
    }

    /**
     * Position of the instant's hour within its logical day (0 is the day-start hour).
     */
    public int shiftedHour(long epochMs) {
        return WindowClipper.shift(hourOfDay(epochMs), dayStartHour);
    }

    /**
     * Logical day the instant belongs to; times before the day-start hour count towards the
     * previous calendar day.
     */
    public LocalDate logicalDay(Instant instant) {
        return instant.atZone(zone).minusHours(dayStartHour).toLocalDate();
    }

    public Instant logicalDayStart(LocalDate day) {
        return ZonedDateTime.of(day.atTime(dayStartHour, 0), zone).toInstant();
    }
}
