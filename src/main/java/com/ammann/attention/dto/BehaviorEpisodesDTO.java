/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Behaviour episodes of a time range")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BehaviorEpisodesDTO(
        @Schema(description = "When the report was computed") Instant generatedAt,
        @Schema(description = "Range the episodes were cut from") TimeWindowDTO window,
        @Schema(description = "Effective query") EpisodeQueryDTO query,
        @Schema(description = "Totals over the returned episodes") EpisodeSummaryDTO summary,
        @Schema(description = "Episodes in chronological order") List<BehaviorEpisodeDTO> episodes) {}
