/* (C)2026 */
package com.ammann.attention.model;

import com.ammann.attention.dto.BehavioralPatternDTO;
import com.ammann.attention.dto.BehavioralPatternDTO.ContextDTO;
import com.ammann.attention.enumeration.ActivityCategory;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * Mined "what follows what" transition between two consecutive activity contexts.
 *
 * <p>The table is a cache: it is cleared and refilled as a whole on every recompute, never
 * updated row by row.
 */
@Entity
@Table(
        name = "behavioral_patterns",
        indexes = {
            @Index(name = "idx_pattern_computed_at", columnList = "computed_at"),
            @Index(name = "idx_pattern_frequency", columnList = "transition_count")
        })
public class BehavioralPattern extends PanacheEntity {

    @Column(name = "computed_at", nullable = false)
    @NotNull
    public Instant computedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_category", length = 20)
    public ActivityCategory fromCategory;

    @Column(name = "from_domain", length = 255)
    public String fromDomain;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_category", length = 20)
    public ActivityCategory toCategory;

    @Column(name = "to_domain", length = 255)
    public String toDomain;

    @Column(name = "transition_count", nullable = false)
    @Min(1)
    public int frequency;

    @Column(name = "avg_duration_before", nullable = false)
    public double avgDurationBeforeSeconds;

    @Column(name = "correlation_strength", nullable = false)
    public double correlationStrength;

    @Column(name = "dominant_hour", nullable = false)
    @Min(0)
    @Max(23)
    public int dominantHourOfDay;

    public static List<BehavioralPattern> findTopByFrequency(int limit) {
        return find("ORDER BY frequency DESC, id").page(0, limit).list();
    }

    public static Instant latestComputedAt() {
        return getEntityManager()
                .createQuery("SELECT MAX(p.computedAt) FROM BehavioralPattern p", Instant.class)
                .getSingleResult();
    }

    public BehavioralPatternDTO toDTO() {
        return new BehavioralPatternDTO(
                id,
                new ContextDTO(fromCategory, fromDomain),
                new ContextDTO(toCategory, toDomain),
                frequency,
                avgDurationBeforeSeconds,
                correlationStrength,
                dominantHourOfDay,
                computedAt);
    }
}
