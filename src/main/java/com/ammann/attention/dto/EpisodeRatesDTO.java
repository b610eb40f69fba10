/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Event rates over the episode duration, one decimal")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpisodeRatesDTO(
        @Schema(description = "Scrolls, clicks and keystrokes per minute") double actionsPerMinute,
        @Schema(description = "Scrolls per minute") double scrollsPerMinute,
        @Schema(description = "Clicks per minute") double clicksPerMinute,
        @Schema(description = "Keystrokes per minute") double keystrokesPerMinute,
        @Schema(description = "Focus and blur events per minute") double focusEventsPerMinute) {}
