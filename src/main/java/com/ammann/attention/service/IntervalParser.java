/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.model.ActivityInterval;
import com.ammann.attention.model.ActivitySpan;
import com.ammann.attention.model.ParseResult;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Validates stored intervals in bulk, dropping malformed rows and counting them in the
 * {@value #REJECTED_METRIC} counter.
 */
@ApplicationScoped
public class IntervalParser {

    private static final Logger LOG = Logger.getLogger(IntervalParser.class);

    public static final String REJECTED_METRIC = "attention.intervals.rejected";

    private final MeterRegistry meterRegistry;

    @Inject
    public IntervalParser(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param spans    valid spans in input order
     * @param rejected number of rows dropped
     */
    public record ParsedIntervals(List<ActivitySpan> spans, int rejected) {}

    public ParsedIntervals parseAll(List<ActivityInterval> intervals) {
        List<ActivitySpan> spans = new ArrayList<>(intervals.size());
        int rejected = 0;
        for (ActivityInterval interval : intervals) {
            ParseResult<ActivitySpan> result = ActivitySpan.parse(interval);
            if (result.isOk()) {
                spans.add(result.value().orElseThrow());
            } else {
                rejected++;
                meterRegistry.counter(REJECTED_METRIC, "reason", result.rejectionReason())
                        .increment();
                LOG.debugf(
                        "Skipping interval %s: %s",
                        interval != null ? interval.id : null, result.rejectionReason());
            }
        }
        return new ParsedIntervals(spans, rejected);
    }
}
