/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of a behaviour-event batch")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestResultDTO(
        @Schema(description = "Events received") int received,
        @Schema(description = "Events stored") int accepted,
        @Schema(description = "Events skipped") int skipped,
        @Schema(description = "Reason per skipped event, prefixed with its index") List<String> errors) {}
