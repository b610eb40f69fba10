/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Run of activity without a gap longer than the configured threshold")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BehaviorEpisodeDTO(
        @Schema(description = "Identifier derived from start time and position", example = "ep-1772442000000-1")
                String id,
        @Schema(description = "Start of the first activity slice") Instant start,
        @Schema(description = "End of the latest activity slice") Instant end,
        @Schema(description = "Wall-clock duration in seconds, at least 1") long durationSeconds,
        @Schema(description = "Clipped active seconds") long activeSeconds,
        @Schema(description = "Clipped idle seconds") long idleSeconds,
        @Schema(description = "Seconds per category") CategoryBreakdownDTO categoryBreakdown,
        @Schema(description = "Category with the most seconds, idle included", example = "productive")
                String dominantCategory,
        @Schema(description = "Up to 8 domains by active seconds") List<ContextSecondsDTO> topDomains,
        @Schema(description = "Up to 8 applications by active seconds") List<ContextSecondsDTO> topApps,
        @Schema(description = "Changes of domain between consecutive visible slices") int domainSwitches,
        @Schema(description = "Behaviour events inside the episode") EpisodeEventCountsDTO eventCounts,
        @Schema(description = "Event rates per minute") EpisodeRatesDTO rates,
        @Schema(description = "Fixed-width timeline") List<EpisodeTimelineBinDTO> timelineBins) {}
