/* (C)2026 */
package com.ammann.interaction.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * CDI producer for the clock used to timestamp evaluation passes.
 *
 * <p>Every pass samples this clock exactly once; tests substitute a controllable clock.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
