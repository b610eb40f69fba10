/* (C)2026 */
package com.ammann.attention.dto;

import com.ammann.attention.enumeration.EngagementLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Engagement metrics for one domain")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngagementMetricsDTO(
        @Schema(description = "Domain", example = "github.com") String domain,
        @Schema(description = "Report window") TimeWindowDTO window,
        @Schema(description = "Intervals overlapping the window") int sessionCount,
        @Schema(description = "Clipped active seconds") long totalSeconds,
        @Schema(description = "Mean scroll depth in percent") long avgScrollDepth,
        @Schema(description = "Mean scroll velocity in px/s") long avgScrollVelocity,
        @Schema(description = "Clicks per active minute, one decimal") double avgClicksPerMinute,
        @Schema(description = "Keystrokes per active minute, one decimal")
                double avgKeystrokesPerMinute,
        @Schema(description = "Fixation score (0-100)") int fixationScore,
        @Schema(description = "Engagement classification") EngagementLevel engagementLevel) {}
