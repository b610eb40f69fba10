/* (C)2026 */
package com.ammann.attention.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;

/**
 * Raw interaction event (scroll, click, keystroke, ...) emitted by the browser extension.
 *
 * <p>Append-only. {@link #valueInt} carries scroll depth or a repeat count,
 * {@link #valueFloat} carries scroll velocity.
 */
@Entity
@Table(
        name = "behavior_events",
        indexes = {
            @Index(name = "idx_behavior_occurred_at", columnList = "occurred_at"),
            @Index(name = "idx_behavior_domain", columnList = "domain")
        })
public class BehaviorEvent extends PanacheEntity {

    @Column(name = "occurred_at", nullable = false)
    @NotNull
    public Instant occurredAt;

    @Column(name = "session_id")
    public Long sessionId;

    @Column(nullable = false, length = 255)
    @NotNull
    public String domain;

    @Column(name = "event_type", nullable = false, length = 32)
    @NotNull
    public String eventType;

    @Column(name = "value_int")
    public Long valueInt;

    @Column(name = "value_float")
    public Double valueFloat;

    /**
     * Free-form JSON supplied by the extension (page title, url, ...).
     */
    @Column(length = 4000)
    public String metadata;

    public static List<BehaviorEvent> findForDomain(String domain, Instant start, Instant end) {
        return find(
                        "domain = ?1 AND occurredAt >= ?2 AND occurredAt <= ?3 ORDER BY occurredAt",
                        domain,
                        start,
                        end)
                .list();
    }

    public static List<BehaviorEvent> findBetween(Instant start, Instant end) {
        return find("occurredAt >= ?1 AND occurredAt <= ?2 ORDER BY occurredAt", start, end)
                .list();
    }
}
