/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One bucket of a trend series")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendPointDTO(
        @Schema(description = "Bucket start") Instant bucketStart,
        @Schema(description = "Bucket end (exclusive)") Instant bucketEnd,
        @Schema(description = "Productive seconds") long productive,
        @Schema(description = "Neutral and uncategorised seconds") long neutral,
        @Schema(description = "Frivolity and draining seconds") long frivolity,
        @Schema(description = "Seconds spent under an emergency unlock") long emergency,
        @Schema(description = "Idle seconds") long idle,
        @Schema(description = "Focus-session seconds") long deepWork,
        @Schema(description = "Active share (emergency included) of active plus idle time (0-100)") int engagement,
        @Schema(description = "Productive share of active time (0-100)") int qualityScore) {}
