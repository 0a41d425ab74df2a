/* (C)2026 */
package com.ammann.interaction.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.interaction.exception.SlotMatchingException;
import com.ammann.interaction.scheduled.InteractionEvaluationScheduler;
import com.ammann.interaction.service.InteractionEngineService;
import java.time.Instant;
import java.util.Set;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

class EvaluationHealthCheckTest {

    private EvaluationHealthCheck check(InteractionEvaluationScheduler scheduler) {
        InteractionEngineService engine = mock(InteractionEngineService.class);
        when(engine.contextNames()).thenReturn(Set.of("garden", "driveway"));

        EvaluationHealthCheck check = new EvaluationHealthCheck();
        check.scheduler = scheduler;
        check.engine = engine;
        return check;
    }

    @Test
    void reportsRunningAfterFirstPass() {
        InteractionEvaluationScheduler scheduler = mock(InteractionEvaluationScheduler.class);
        when(scheduler.isHalted()).thenReturn(false);
        when(scheduler.getLastEvaluation()).thenReturn(Instant.parse("2026-03-01T12:00:00Z"));

        HealthCheckResponse response = check(scheduler).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get().get("status")).isEqualTo("RUNNING");
        assertThat(response.getData().get().get("contexts")).isEqualTo(2L);
        assertThat(response.getData().get().get("last-evaluation")).isEqualTo("2026-03-01T12:00:00Z");
    }

    @Test
    void reportsWaitingBeforeFirstPass() {
        InteractionEvaluationScheduler scheduler = mock(InteractionEvaluationScheduler.class);
        when(scheduler.isHalted()).thenReturn(false);
        when(scheduler.getLastEvaluation()).thenReturn(null);

        HealthCheckResponse response = check(scheduler).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData().get().get("status")).isEqualTo("WAITING");
        assertThat(response.getData().get()).doesNotContainKey("last-evaluation");
    }

    @Test
    void reportsHaltedOnConfigurationError() {
        InteractionEvaluationScheduler scheduler = mock(InteractionEvaluationScheduler.class);
        when(scheduler.isHalted()).thenReturn(true);
        when(scheduler.getFatalError()).thenReturn(new SlotMatchingException("Crowd", 9, 8));

        HealthCheckResponse response = check(scheduler).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData().get().get("status")).isEqualTo("HALTED");
        assertThat((String) response.getData().get().get("error")).contains("Crowd");
    }
}
