/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Fixed-width slice of an episode")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpisodeTimelineBinDTO(
        @Schema(description = "Bin start") Instant start,
        @Schema(description = "Bin end, capped at the episode end") Instant end,
        @Schema(description = "Active seconds in the bin") long activeSeconds,
        @Schema(description = "Idle seconds in the bin") long idleSeconds,
        @Schema(description = "Seconds per category") CategoryBreakdownDTO categoryBreakdown,
        @Schema(description = "Events with start <= timestamp < end") EpisodeEventCountsDTO eventCounts,
        @Schema(description = "Domain or app with the most active time in the bin") String topDomain) {}
