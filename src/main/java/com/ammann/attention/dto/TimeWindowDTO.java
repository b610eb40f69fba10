/* (C)2026 */
package com.ammann.attention.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Half-open report window {@code [start, end)}.
 *
 * @param start         inclusive window start
 * @param end           exclusive window end
 * @param durationHours whole hours between start and end
 */
@Schema(description = "Report window")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeWindowDTO(
        @Schema(description = "Window start (inclusive)") Instant start,
        @Schema(description = "Window end (exclusive)") Instant end,
        @Schema(description = "Window duration in hours") Long durationHours) {

    public static TimeWindowDTO create(Instant start, Instant end) {
        return new TimeWindowDTO(start, end, Duration.between(start, end).toHours());
    }

    public long startMs() {
        return start.toEpochMilli();
    }

    public long endMs() {
        return end.toEpochMilli();
    }
}
