/* (C)2026 */
package com.ammann.attention.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * Focus session recorded by the pomodoro subsystem.
 *
 * <p>Only used as a deep-work overlay: the effective session span is
 * {@code [startedAt, min(startedAt + plannedDurationSeconds, endedAt or now)]}.
 */
@Entity
@Table(
        name = "pomodoro_sessions",
        indexes = @Index(name = "idx_pomodoro_started_at", columnList = "started_at"))
public class PomodoroSession extends PanacheEntity {

    @Column(name = "started_at", nullable = false)
    @NotNull
    public Instant startedAt;

    @Column(name = "ended_at")
    public Instant endedAt;

    @Column(name = "planned_duration_seconds", nullable = false)
    @Min(value = 0, message = "Planned duration must be non-negative")
    public long plannedDurationSeconds;

    public PomodoroSession() {}

    public PomodoroSession(Instant startedAt, Instant endedAt, long plannedDurationSeconds) {
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.plannedDurationSeconds = plannedDurationSeconds;
    }

    public static List<PomodoroSession> findOverlapping(Instant start, Instant end) {
        return find(
                        "(endedAt IS NULL OR endedAt >= ?1) AND startedAt <= ?2 ORDER BY startedAt",
                        start,
                        end)
                .list();
    }
}
