/* (C)2026 */
package com.ammann.interaction.scheduled;

import com.ammann.interaction.exception.InteractionConfigurationException;
import com.ammann.interaction.model.InteractionEvent;
import com.ammann.interaction.service.InteractionEngineService;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Drives the interaction engine on a fixed tick.
 * <p>
 * Each run samples the clock once and evaluates every context with that instant, so all
 * keys in a pass see the same time. Runs never overlap (SKIP).
 * <p>
 * A configuration error raised during evaluation (slot matching past its depth limit)
 * halts evaluation for the rest of the process lifetime. It is reported by the readiness
 * check instead of being retried every tick.
 */
@ApplicationScoped
public class InteractionEvaluationScheduler {

    private static final Logger LOG = Logger.getLogger(InteractionEvaluationScheduler.class);

    private final InteractionEngineService engine;
    private final Clock clock;

    private volatile Instant lastEvaluation;
    private volatile InteractionConfigurationException fatalError;

    @Inject
    public InteractionEvaluationScheduler(InteractionEngineService engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @Scheduled(
            every = "${tracker.evaluation.interval:1s}",
            identity = "interaction-evaluation",
            concurrentExecution = ConcurrentExecution.SKIP)
    public void evaluate() {
        if (fatalError != null) {
            return;
        }

        Instant now = clock.instant();
        try {
            List<InteractionEvent> transitions = engine.evaluateAll(now);
            lastEvaluation = now;
            if (!transitions.isEmpty()) {
                LOG.debugf("Evaluation at %s emitted %d transitions", now, transitions.size());
            }
        } catch (InteractionConfigurationException e) {
            fatalError = e;
            LOG.errorf(e, "Interaction evaluation halted: %s", e.getMessage());
        }
    }

    /** Time of the last completed pass, or {@code null} before the first one. */
    public Instant getLastEvaluation() {
        return lastEvaluation;
    }

    /** The error that halted evaluation, or {@code null} while running. */
    public InteractionConfigurationException getFatalError() {
        return fatalError;
    }

    public boolean isHalted() {
        return fatalError != null;
    }
}
