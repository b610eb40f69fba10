/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Range of raw intervals to roll up")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RollupGenerateRequestDTO(
        @Schema(description = "Device identifier", example = "macbook-7f3a") String deviceId,
        @Schema(description = "Inclusive ISO-8601 start", example = "2026-03-02T00:00:00Z") String start,
        @Schema(description = "Exclusive ISO-8601 end", example = "2026-03-03T00:00:00Z") String end) {}
