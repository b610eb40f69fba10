/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Totals over the returned episodes")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpisodeSummaryDTO(
        int totalEpisodes,
        long totalDurationSeconds,
        long totalActiveSeconds,
        long totalIdleSeconds,
        @Schema(description = "Up to 12 domains summed over the episodes' top domains")
                List<ContextSecondsDTO> topDomains) {}
