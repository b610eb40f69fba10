/* (C)2026 */
package com.ammann.attention.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class DayClockTest {

    @Test
    void timesBeforeDayStartBelongToPreviousDay() {
        DayClock clock = new DayClock(ZoneOffset.UTC, 4);

        assertThat(clock.logicalDay(Instant.parse("2026-03-02T03:59:59Z")))
                .isEqualTo(LocalDate.of(2026, 3, 1));
        assertThat(clock.logicalDay(Instant.parse("2026-03-02T04:00:00Z")))
                .isEqualTo(LocalDate.of(2026, 3, 2));
        assertThat(clock.logicalDayStart(LocalDate.of(2026, 3, 2)))
                .isEqualTo(Instant.parse("2026-03-02T04:00:00Z"));
    }

    @Test
    void hoursAreReportedInConfiguredZone() {
        DayClock clock = new DayClock(ZoneId.of("Europe/Zurich"), 4);
        long ms = Instant.parse("2026-01-15T08:30:00Z").toEpochMilli();

        assertThat(clock.hourOfDay(ms)).isEqualTo(9);
        assertThat(clock.shiftedHour(ms)).isEqualTo(5);
    }

    @Test
    void rejectsDayStartOutsideDay() {
        assertThatThrownBy(() -> new DayClock(ZoneOffset.UTC, 24))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
