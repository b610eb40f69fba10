/* (C)2026 */
package com.ammann.attention.model;

import com.ammann.attention.enumeration.ActivityCategory;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * One continuous foreground activity recorded by the activity tracker.
 *
 * <p>Rows are written by the tracker and are read-only for the analytics engine. An interval
 * whose {@link #endedAt} is {@code null} is still open; its effective end is
 * {@code startedAt + secondsActive + idleSeconds}.
 */
@Entity
@Table(
        name = ActivityInterval.TABLE_NAME,
        indexes = {
            @Index(name = "idx_activity_started_at", columnList = "started_at"),
            @Index(name = "idx_activity_ended_at", columnList = "ended_at"),
            @Index(name = "idx_activity_domain", columnList = "domain")
        })
public class ActivityInterval extends PanacheEntity {

    public static final String TABLE_NAME = "activity_intervals";

    @Column(name = "started_at", nullable = false)
    @NotNull
    public Instant startedAt;

    /**
     * End of the interval; {@code null} while the tracker still considers it open.
     */
    @Column(name = "ended_at")
    public Instant endedAt;

    /**
     * Browser domain for URL activities.
     */
    @Column(length = 255)
    public String domain;

    /**
     * Desktop application name for app activities.
     */
    @Column(name = "app_name", length = 255)
    public String appName;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    public ActivityCategory category;

    @Column(name = "seconds_active", nullable = false)
    @Min(value = 0, message = "Active seconds must be non-negative")
    public double secondsActive;

    @Column(name = "idle_seconds", nullable = false)
    @Min(value = 0, message = "Idle seconds must be non-negative")
    public double idleSeconds;

    public ActivityInterval() {}

    public ActivityInterval(
            Instant startedAt,
            Instant endedAt,
            String domain,
            String appName,
            ActivityCategory category,
            double secondsActive,
            double idleSeconds) {
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.domain = domain;
        this.appName = appName;
        this.category = category;
        this.secondsActive = secondsActive;
        this.idleSeconds = idleSeconds;
    }

    /**
     * Intervals that may overlap {@code [start, end]}, oldest first.
     *
     * <p>Open intervals are always included because their effective end is only known after
     * parsing; the window clipper discards the ones that do not actually intersect.
     */
    public static List<ActivityInterval> findOverlapping(Instant start, Instant end) {
        return find(
                        "startedAt <= ?2 AND (endedAt IS NULL OR endedAt >= ?1) ORDER BY startedAt,"
                                + " id",
                        start,
                        end)
                .list();
    }

    /**
     * Domain-filtered variant of {@link #findOverlapping(Instant, Instant)}.
     */
    public static List<ActivityInterval> findOverlappingForDomain(
            String domain, Instant start, Instant end) {
        return find(
                        "domain = ?1 AND startedAt <= ?3 AND (endedAt IS NULL OR endedAt >= ?2)"
                                + " ORDER BY startedAt, id",
                        domain,
                        start,
                        end)
                .list();
    }

    /**
     * Intervals whose start lies in {@code [start, end)}; used for local rollup generation.
     */
    public static List<ActivityInterval> findStartedBetween(Instant start, Instant end) {
        return find("startedAt >= ?1 AND startedAt < ?2 ORDER BY startedAt, id", start, end)
                .list();
    }

    /**
     * Label used for domain rankings: the domain, else the app name.
     */
    public String contextLabel() {
        return domain != null ? domain : appName;
    }

    @Override
    public String toString() {
        return String.format(
                "ActivityInterval{id=%d, startedAt=%s, endedAt=%s, context=%s, category=%s,"
                        + " active=%.1fs, idle=%.1fs}",
                id, startedAt, endedAt, contextLabel(), category, secondsActive, idleSeconds);
    }
}
