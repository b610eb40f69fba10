/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Incremental writing progress reported by the writing subsystem.
 *
 * <p>All values are deltas since the previous report. Word deltas may be negative.
 */
@Schema(description = "Writing progress delta")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WritingProgressDTO(
        @Schema(description = "When the progress happened; defaults to now") Instant occurredAt,
        @Schema(description = "Active writing seconds") double activeSeconds,
        @Schema(description = "Focused writing seconds") double focusedSeconds,
        @Schema(description = "Keystrokes typed") long keystrokes,
        @Schema(description = "Words added") long wordsAdded,
        @Schema(description = "Words deleted") long wordsDeleted,
        @Schema(description = "Net word change") long netWords) {}
