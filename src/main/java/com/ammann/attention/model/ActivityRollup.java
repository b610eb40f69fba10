/* (C)2026 */
package com.ammann.attention.model;

import com.ammann.attention.dto.ActivityRollupDTO;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * Per-device, per-hour category totals derived from raw activity intervals.
 *
 * <p>The natural key is {@code (device_id, hour_start)}. Rows are overwritten on upsert since
 * every rollup is recomputed from its full source intervals.
 */
@Entity
@Table(
        name = ActivityRollup.TABLE_NAME,
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_activity_rollup_device_hour",
                        columnNames = {"device_id", "hour_start"}),
        indexes = {
            @Index(name = "idx_activity_rollup_hour", columnList = "hour_start"),
            @Index(name = "idx_activity_rollup_updated", columnList = "updated_at")
        })
public class ActivityRollup extends PanacheEntity {

    public static final String TABLE_NAME = "activity_rollups";

    @Column(name = "device_id", nullable = false, length = 128)
    @NotNull
    public String deviceId;

    @Column(name = "hour_start", nullable = false)
    @NotNull
    public Instant hourStart;

    @Column(nullable = false)
    public long productive;

    @Column(nullable = false)
    public long neutral;

    @Column(nullable = false)
    public long frivolity;

    @Column(nullable = false)
    public long idle;

    @Column(name = "updated_at", nullable = false)
    @NotNull
    public Instant updatedAt;

    public static ActivityRollup findByKey(String deviceId, Instant hourStart) {
        return find("deviceId = ?1 AND hourStart = ?2", deviceId, hourStart).firstResult();
    }

    public static List<ActivityRollup> findUpdatedSince(String deviceId, Instant updatedAfter) {
        return find(
                        "deviceId = ?1 AND updatedAt >= ?2 ORDER BY hourStart",
                        deviceId,
                        updatedAfter)
                .list();
    }

    public static List<ActivityRollup> findFromHour(String deviceId, Instant fromHour) {
        if (deviceId == null) {
            return find("hourStart >= ?1 ORDER BY hourStart", fromHour).list();
        }
        return find("deviceId = ?1 AND hourStart >= ?2 ORDER BY hourStart", deviceId, fromHour)
                .list();
    }

    /**
     * Copies the totals of a rollup DTO onto this row (last write wins).
     */
    public void overwriteFrom(ActivityRollupDTO dto) {
        this.productive = dto.productive();
        this.neutral = dto.neutral();
        this.frivolity = dto.frivolity();
        this.idle = dto.idle();
        this.updatedAt = dto.updatedAt();
    }

    public ActivityRollupDTO toDTO() {
        return new ActivityRollupDTO(
                deviceId, hourStart, productive, neutral, frivolity, idle, updatedAt);
    }

    @Override
    public String toString() {
        return String.format(
                "ActivityRollup{device=%s, hourStart=%s, productive=%d, neutral=%d,"
                        + " frivolity=%d, idle=%d}",
                deviceId, hourStart, productive, neutral, frivolity, idle);
    }
}
