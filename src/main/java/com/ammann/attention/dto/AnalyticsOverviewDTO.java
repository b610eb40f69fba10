/* (C)2026 */
package com.ammann.attention.dto;

import com.ammann.attention.enumeration.FocusTrend;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Attention overview for the last N days")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyticsOverviewDTO(
        @Schema(description = "Report window") TimeWindowDTO window,
        @Schema(description = "Active hours including reading and writing, one decimal")
                double totalActiveHours,
        @Schema(description = "Productive share of categorised time (0-100)", example = "64")
                int productivityScore,
        @Schema(description = "Productive time of the recent half versus the older half")
                FocusTrend focusTrend,
        @Schema(description = "Hour of day with the most productive time", example = "9")
                int peakProductiveHour,
        @Schema(description = "Hour of day with the most distraction", example = "15")
                int riskHour,
        @Schema(description = "Domain, else app name, with the most active time")
                String topEngagementDomain,
        @Schema(description = "Seconds per category") CategoryBreakdownDTO categoryBreakdown,
        @Schema(description = "Focus-session seconds inside the window") long deepWorkSeconds,
        @Schema(description = "Number of valid intervals in the window") int totalSessions,
        @Schema(description = "Active seconds, reading and writing included, per session")
                long avgSessionLengthSeconds,
        @Schema(description = "Stored intervals skipped as malformed") int rejectedIntervals,
        @Schema(description = "Human-readable observations") List<String> insights) {}
