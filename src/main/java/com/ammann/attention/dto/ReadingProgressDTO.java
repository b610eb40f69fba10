/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Reading progress delta")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReadingProgressDTO(
        @Schema(description = "When the progress happened; defaults to now") Instant occurredAt,
        @Schema(description = "Active reading seconds") double activeSeconds,
        @Schema(description = "Focused reading seconds") double focusedSeconds) {}
