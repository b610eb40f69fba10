/* (C)2026 */
package com.ammann.attention.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.model.ActivityInterval;
import com.ammann.attention.model.ActivitySpan;
import com.ammann.attention.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class IntervalParserTest {

    @Test
    void dropsAndCountsMalformedRows() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        IntervalParser parser = new IntervalParser(registry);
        Instant start = Instant.parse("2026-03-02T09:00:00Z");

        ActivityInterval valid =
                TestDataFactory.interval(
                        "2026-03-02T09:00:00Z", "2026-03-02T09:10:00Z", "a.com",
                        ActivityCategory.PRODUCTIVE);
        ActivityInterval backwards =
                new ActivityInterval(start, start.minusSeconds(5), "b.com", null, null, 1, 0);
        ActivityInterval noStart = new ActivityInterval(null, start, "c.com", null, null, 1, 0);

        IntervalParser.ParsedIntervals parsed = parser.parseAll(List.of(valid, backwards, noStart));

        assertThat(parsed.spans()).extracting(ActivitySpan::domain).containsExactly("a.com");
        assertThat(parsed.rejected()).isEqualTo(2);
        assertThat(
                        registry.counter(
                                        IntervalParser.REJECTED_METRIC,
                                        "reason",
                                        ActivitySpan.REJECT_END_BEFORE_START)
                                .count())
                .isEqualTo(1.0);
        assertThat(
                        registry.counter(
                                        IntervalParser.REJECTED_METRIC,
                                        "reason",
                                        ActivitySpan.REJECT_MISSING_START)
                                .count())
                .isEqualTo(1.0);
    }
}
