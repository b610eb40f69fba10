/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Effective episode query after defaults and clamping.
 */
@Schema(description = "Effective episode query parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpisodeQueryDTO(
        Instant start,
        Instant end,
        @Schema(description = "Lookback in hours (1-336)") int hours,
        @Schema(description = "Gap that closes an episode, in minutes (1-120)") int gapMinutes,
        @Schema(description = "Timeline bin width in seconds (5-300)") int binSeconds,
        @Schema(description = "Most recent episodes kept (1-500)") int maxEpisodes) {}
