package com.appforge.orchestrator.metrics;

import com.appforge.orchestrator.model.OutcomeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the task pipeline.
 *
 * <pre>
 *   appforge.tasks.completed{status="succeeded|failed"}
 *   appforge.step.attempts{step, result="success|failure"}
 *   appforge.step.duration{step}
 *   appforge.notify.deliveries{delivered="true|false"}
 *   appforge.tasks.rejected{reason}
 * </pre>
 */
@Component
public class TaskMetrics {

    private final MeterRegistry registry;

    public TaskMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOutcome(OutcomeStatus status) {
        Counter.builder("appforge.tasks.completed")
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordAttempt(String step, boolean success) {
        Counter.builder("appforge.step.attempts")
                .tag("step", step)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordStepDuration(String step, Duration duration) {
        Timer.builder("appforge.step.duration")
                .tag("step", step)
                .register(registry)
                .record(duration);
    }

    public void recordNotification(boolean delivered) {
        Counter.builder("appforge.notify.deliveries")
                .tag("delivered", String.valueOf(delivered))
                .register(registry)
                .increment();
    }

    public void recordRejection(String reason) {
        Counter.builder("appforge.tasks.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
