/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Active seconds attributed to one domain or application")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextSecondsDTO(
        @Schema(description = "Domain, or application name for app-only activity") String name,
        @Schema(description = "Active seconds") long activeSeconds) {}
