/* (C)2026 */
package com.ammann.attention.dto;

import com.ammann.attention.enumeration.ActivityCategory;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Transition between two consecutive activity contexts")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BehavioralPatternDTO(
        @Schema(description = "Pattern id") Long id,
        @Schema(description = "Context the user left") ContextDTO from,
        @Schema(description = "Context the user moved to") ContextDTO to,
        @Schema(description = "Number of observed transitions") int frequency,
        @Schema(description = "Mean active seconds spent in the previous context")
                double avgDurationBeforeSeconds,
        @Schema(description = "Saturating frequency weight (0-1)") double correlationStrength,
        @Schema(description = "Most common hour of day of the transition") int dominantHourOfDay,
        @Schema(description = "Time the pattern table was computed") Instant computedAt) {

    /**
     * Category and context of one side of a transition. The domain falls back to the app name
     * for app-only activity and is {@code null} when suppressed.
     */
    @Schema(description = "Activity context")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ContextDTO(ActivityCategory category, String domain) {}
}
