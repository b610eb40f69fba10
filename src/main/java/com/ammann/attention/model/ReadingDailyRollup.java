/* (C)2026 */
package com.ammann.attention.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/**
 * Daily reading totals keyed by logical day (a day starts at the configured day-start hour).
 */
@Entity
@Table(name = "reading_daily_rollups")
public class ReadingDailyRollup extends StreamRollup {

    @Column(name = "day_key", nullable = false, unique = true)
    @NotNull
    public LocalDate day;

    public static ReadingDailyRollup findByDay(LocalDate day) {
        return find("day", day).firstResult();
    }

    /**
     * Sum of active reading seconds for the inclusive day range.
     */
    public static double sumActiveSeconds(LocalDate fromDay, LocalDate toDay) {
        Double sum =
                getEntityManager()
                        .createQuery(
                                "SELECT SUM(r.activeSeconds) FROM ReadingDailyRollup r"
                                        + " WHERE r.day >= :fromDay AND r.day <= :toDay",
                                Double.class)
                        .setParameter("fromDay", fromDay)
                        .setParameter("toDay", toDay)
                        .getSingleResult();
        return sum == null ? 0.0 : sum;
    }
}
