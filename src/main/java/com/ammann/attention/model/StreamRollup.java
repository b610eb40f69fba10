/* (C)2026 */
package com.ammann.attention.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import java.time.Instant;

/**
 * Common columns of the reading and writing rollup tables.
 *
 * <p>Stream rollups are accumulated additively: each progress event carries a delta, never a
 * snapshot, so {@link #accumulate(double, double, Instant)} adds rather than overwrites.
 */
@MappedSuperclass
public abstract class StreamRollup extends PanacheEntity {

    @Column(name = "active_seconds", nullable = false)
    public double activeSeconds;

    @Column(name = "focused_seconds", nullable = false)
    public double focusedSeconds;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public void accumulate(double deltaActiveSeconds, double deltaFocusedSeconds, Instant at) {
        this.activeSeconds += deltaActiveSeconds;
        this.focusedSeconds += deltaFocusedSeconds;
        this.updatedAt = at;
    }
}
