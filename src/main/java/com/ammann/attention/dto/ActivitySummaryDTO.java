/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Totals over stored activity rollups for a trailing window.
 */
@Schema(description = "Summary of stored activity rollups")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivitySummaryDTO(
        @Schema(description = "Device filter, absent for all devices") String deviceId,
        @Schema(description = "Window length in hours (1-168)") int windowHours,
        @Schema(description = "First hour included") Instant since,
        @Schema(description = "Productive seconds") long productive,
        @Schema(description = "Neutral seconds") long neutral,
        @Schema(description = "Frivolity seconds") long frivolity,
        @Schema(description = "Idle seconds") long idle,
        @Schema(description = "Non-idle seconds") long totalSeconds,
        @Schema(description = "Rollup rows summarised") int sampleCount,
        @Schema(description = "One slot per hour in the window") List<TimelineSlotDTO> timeline) {

    @Schema(description = "Hourly timeline slot")
    public record TimelineSlotDTO(
            Instant hourStart,
            long productive,
            long neutral,
            long frivolity,
            long idle,
            @Schema(description = "Category with the most seconds, 'idle' when empty")
                    String dominantCategory) {}
}
