/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Aggregate for one hour of the day across the report window.
 *
 * <p>The report lists 24 of these ordered by logical hour, i.e. starting at the configured
 * day-start hour; {@link #hour()} is always the raw clock hour.
 */
@Schema(description = "Time-of-day bucket")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeOfDayStatsDTO(
        @Schema(description = "Clock hour (0-23)") int hour,
        @Schema(description = "Seconds per category") CategoryBreakdownDTO categories,
        @Schema(description = "Number of interval pieces that fell into this hour") int sampleCount,
        @Schema(description = "Category with the most seconds, 'idle' when empty", example = "productive")
                String dominantCategory,
        @Schema(description = "Domain, else app name, with the most active seconds")
                String dominantDomain,
        @Schema(description = "Active share of active plus idle time (0-100)") int avgEngagement) {}
