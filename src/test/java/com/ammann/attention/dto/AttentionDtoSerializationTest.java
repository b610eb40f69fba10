/* (C)2026 */
package com.ammann.attention.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.attention.enumeration.ActivityCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AttentionDtoSerializationTest {

    private final ObjectMapper mapper =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void timeWindowComputesWholeHours() {
        TimeWindowDTO window =
                TimeWindowDTO.create(
                        Instant.parse("2026-03-01T00:00:00Z"), Instant.parse("2026-03-02T06:30:00Z"));

        assertThat(window.durationHours()).isEqualTo(30L);
        assertThat(window.endMs() - window.startMs()).isEqualTo(109_800_000L);
    }

    @Test
    void suppressedPatternContextOmitsDomain() throws Exception {
        BehavioralPatternDTO pattern =
                new BehavioralPatternDTO(
                        1L,
                        new BehavioralPatternDTO.ContextDTO(ActivityCategory.NEUTRAL, null),
                        new BehavioralPatternDTO.ContextDTO(ActivityCategory.PRODUCTIVE, "github.com"),
                        4,
                        300.0,
                        0.4,
                        9,
                        Instant.parse("2026-03-02T10:00:00Z"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(pattern));

        assertThat(json.get("from").get("category").asText()).isEqualTo("neutral");
        assertThat(json.get("from").has("domain")).isFalse();
        assertThat(json.get("to").get("domain").asText()).isEqualTo("github.com");
        assertThat(json.get("computedAt").asText()).isEqualTo("2026-03-02T10:00:00Z");
    }

    @Test
    void behaviorEventReadsExtensionPayload() throws Exception {
        BehaviorEventDTO event =
                mapper.readValue(
                        "{\"timestamp\":\"2026-03-02T09:15:00Z\",\"sessionId\":12,"
                                + "\"domain\":\"github.com\",\"type\":\"scroll\","
                                + "\"valueInt\":64,\"valueFloat\":180.5}",
                        BehaviorEventDTO.class);

        assertThat(event.sessionId()).isEqualTo(12L);
        assertThat(event.valueInt()).isEqualTo(64L);
        assertThat(event.valueFloat()).isEqualTo(180.5);
        assertThat(event.metadata()).isNull();
    }

    @Test
    void rollupTotalExcludesIdle() {
        ActivityRollupDTO rollup =
                new ActivityRollupDTO("mac", Instant.parse("2026-03-02T09:00:00Z"), 100, 50, 25, 400, null);

        assertThat(rollup.totalActiveSeconds()).isEqualTo(175);
    }
}
