/* (C)2026 */
package com.ammann.attention.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/**
 * Daily writing totals keyed by logical day.
 */
@Entity
@Table(name = "writing_daily_rollups")
public class WritingDailyRollup extends WritingCounters {

    @Column(name = "day_key", nullable = false, unique = true)
    @NotNull
    public LocalDate day;

    public static WritingDailyRollup findByDay(LocalDate day) {
        return find("day", day).firstResult();
    }

    public static double sumActiveSeconds(LocalDate fromDay, LocalDate toDay) {
        Double sum =
                getEntityManager()
                        .createQuery(
                                "SELECT SUM(w.activeSeconds) FROM WritingDailyRollup w"
                                        + " WHERE w.day >= :fromDay AND w.day <= :toDay",
                                Double.class)
                        .setParameter("fromDay", fromDay)
                        .setParameter("toDay", toDay)
                        .getSingleResult();
        return sum == null ? 0.0 : sum;
    }
}
