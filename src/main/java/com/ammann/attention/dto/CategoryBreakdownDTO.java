/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Seconds spent per category")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategoryBreakdownDTO(
        @Schema(description = "Productive seconds") long productive,
        @Schema(description = "Neutral seconds") long neutral,
        @Schema(description = "Frivolity seconds") long frivolity,
        @Schema(description = "Draining seconds") long draining,
        @Schema(description = "Emergency seconds") long emergency,
        @Schema(description = "Idle seconds") long idle) {}
