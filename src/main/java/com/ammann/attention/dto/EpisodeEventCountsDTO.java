/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Behaviour event counts per type. Repeat counts carried in {@code valueInt} are expanded, so
 * one stored event may count several times.
 */
@Schema(description = "Behaviour events per type")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpisodeEventCountsDTO(
        long scroll,
        long click,
        long keystroke,
        long focus,
        long blur,
        long idleStart,
        long idleEnd,
        long visibility) {}
