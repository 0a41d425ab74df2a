/* (C)2026 */
package com.ammann.interaction.health;

import com.ammann.interaction.scheduled.InteractionEvaluationScheduler;
import com.ammann.interaction.service.InteractionEngineService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Health check for the interaction evaluation loop.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: evaluation is running ({@code WAITING} before the first pass, {@code RUNNING} after)</li>
 *   <li>DOWN: evaluation halted on a configuration error</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class EvaluationHealthCheck implements HealthCheck {

    @Inject InteractionEvaluationScheduler scheduler;

    @Inject InteractionEngineService engine;

    @Override
    public HealthCheckResponse call() {
        boolean halted = scheduler.isHalted();

        String status;
        if (halted) {
            status = "HALTED";
        } else {
            status = scheduler.getLastEvaluation() != null ? "RUNNING" : "WAITING";
        }

        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named("interaction-evaluation")
                        .status(!halted)
                        .withData("status", status)
                        .withData("contexts", engine.contextNames().size());
        if (scheduler.getLastEvaluation() != null) {
            builder.withData("last-evaluation", scheduler.getLastEvaluation().toString());
        }
        if (halted) {
            builder.withData("error", scheduler.getFatalError().getMessage());
        }
        return builder.build();
    }
}
