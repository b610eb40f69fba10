/* (C)2026 */
package com.ammann.attention.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * CDI producer for the {@link Clock} used by all report windows and pattern freshness checks.
 *
 * <p>Tests replace it with a fixed or mutable clock.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
