/* (C)2026 */
package com.ammann.attention.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * Hourly reading totals reported by the reading subsystem.
 */
@Entity
@Table(name = "reading_hourly_rollups")
public class ReadingHourlyRollup extends StreamRollup {

    @Column(name = "hour_start", nullable = false, unique = true)
    @NotNull
    public Instant hourStart;

    public static ReadingHourlyRollup findByHour(Instant hourStart) {
        return find("hourStart", hourStart).firstResult();
    }

    public static List<ReadingHourlyRollup> findInRange(Instant start, Instant end) {
        return find("hourStart >= ?1 AND hourStart <= ?2 ORDER BY hourStart", start, end).list();
    }
}
