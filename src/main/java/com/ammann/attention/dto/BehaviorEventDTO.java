/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Behaviour event as posted by the browser extension.
 *
 * <p>The timestamp is kept as text so that one malformed event can be skipped without failing
 * the whole batch.
 */
@Schema(description = "Behaviour event")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BehaviorEventDTO(
        @Schema(description = "ISO-8601 timestamp", example = "2026-03-02T09:15:00Z") String timestamp,
        @Schema(description = "Extension session id") Long sessionId,
        @Schema(description = "Domain", example = "github.com") String domain,
        @Schema(description = "Event type", example = "scroll") String type,
        @Schema(description = "Scroll depth or repeat count") Long valueInt,
        @Schema(description = "Scroll velocity") Double valueFloat,
        @Schema(description = "Free-form JSON") String metadata) {}
