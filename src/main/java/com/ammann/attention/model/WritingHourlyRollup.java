/* (C)2026 */
package com.ammann.attention.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * Hourly writing totals, accumulated from writing progress deltas.
 */
@Entity
@Table(name = "writing_hourly_rollups")
public class WritingHourlyRollup extends WritingCounters {

    @Column(name = "hour_start", nullable = false, unique = true)
    @NotNull
    public Instant hourStart;

    public static WritingHourlyRollup findByHour(Instant hourStart) {
        return find("hourStart", hourStart).firstResult();
    }

    public static List<WritingHourlyRollup> findInRange(Instant start, Instant end) {
        return find("hourStart >= ?1 AND hourStart <= ?2 ORDER BY hourStart", start, end).list();
    }
}
