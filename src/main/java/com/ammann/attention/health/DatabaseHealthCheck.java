/* (C)2026 */
package com.ammann.attention.health;

import com.ammann.attention.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check that queries the interval store and reports DOWN when it is unreachable or
 * slower than one second.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    static final long MAX_QUERY_MS = 1000;

    private final IntervalStore store;

    @Inject
    public DatabaseHealthCheck(IntervalStore store) {
        this.store = store;
    }

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();
            long intervals = store.countIntervals();
            long queryMs = Duration.between(start, Instant.now()).toMillis();
            boolean performanceOk = queryMs < MAX_QUERY_MS;

            return HealthCheckResponse.named("database-health")
                    .status(performanceOk)
                    .withData("activity-intervals", intervals)
                    .withData("query-time-ms", queryMs)
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named("database-health")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
