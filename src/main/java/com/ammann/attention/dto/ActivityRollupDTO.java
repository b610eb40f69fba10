/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Per-device, per-hour category totals in whole seconds.
 *
 * @param deviceId   device that produced the underlying intervals
 * @param hourStart  start of the UTC hour bucket
 * @param productive productive active seconds
 * @param neutral    neutral active seconds (includes uncategorised and suppressed time)
 * @param frivolity  frivolity active seconds
 * @param idle       idle seconds
 * @param updatedAt  time the rollup was generated
 */
@Schema(description = "Hourly activity rollup for one device")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityRollupDTO(
        @Schema(description = "Device identifier", example = "macbook-7f3a") String deviceId,
        @Schema(description = "Start of the hour bucket (UTC)") Instant hourStart,
        @Schema(description = "Productive seconds") long productive,
        @Schema(description = "Neutral seconds") long neutral,
        @Schema(description = "Frivolity seconds") long frivolity,
        @Schema(description = "Idle seconds") long idle,
        @Schema(description = "Generation timestamp") Instant updatedAt) {

    public long totalActiveSeconds() {
        return productive + neutral + frivolity;
    }
}
