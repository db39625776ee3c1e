package com.example.orgadmin.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decision engine metrics. Tags are bounded; actor and resource ids are never used as tag values.
 */
@Component
public class AuthorizationMetrics {

    private final Counter decisionAllowed;
    private final Counter decisionDenied;
    private final Counter bypass;
    private final Counter unavailable;
    private final Counter recorderDropped;
    private final Timer evaluationTimer;

    public AuthorizationMetrics(@NonNull MeterRegistry registry) {
        this.decisionAllowed = Counter.builder("authz.decision")
                .tag("result", "allowed")
                .description("Permission tuples that were allowed")
                .register(registry);

        this.decisionDenied = Counter.builder("authz.decision")
                .tag("result", "denied")
                .description("Permission tuples that were denied")
                .register(registry);

        this.bypass = Counter.builder("authz.bypass")
                .description("Evaluations short-circuited by bypass authority")
                .register(registry);

        this.unavailable = Counter.builder("authz.evaluation.unavailable")
                .description("Evaluations aborted because the data store was unavailable")
                .register(registry);

        this.recorderDropped = Counter.builder("authz.recorder.dropped")
                .description("Decision events dropped because the recorder queue was full")
                .register(registry);

        this.evaluationTimer = Timer.builder("authz.evaluation")
                .description("Time to evaluate a set of required permissions")
                .register(registry);
    }

    public void recordDecision(boolean allowed) {
        if (allowed) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
        }
    }

    public void recordBypass() {
        bypass.increment();
    }

    public void recordUnavailable() {
        unavailable.increment();
    }

    public void recordDroppedEvent() {
        recorderDropped.increment();
    }

    public void recordEvaluation(@NonNull Duration duration) {
        evaluationTimer.record(duration);
    }
}
