package com.foreman.core.metrics;

import com.foreman.core.resilience.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for the task engine.
 */
@Service
public class ForemanMetrics {

    private final MeterRegistry registry;

    public ForemanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskTransition(String status) {
        Counter.builder("foreman.task.transitions")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskDuration(String module, long minutes) {
        DistributionSummary.builder("foreman.task.duration_minutes")
                .tag("module", module)
                .register(registry)
                .record(minutes);
    }

    /**
     * Counts a storage call that failed with a transient error and is about to be retried.
     *
     * @param code errno-style code of the failure
     */
    public void recordRetry(String code) {
        Counter.builder("foreman.store.retries")
                .description("Storage attempts retried after a transient failure")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void recordHealingAttempt(boolean success) {
        Counter.builder("foreman.healing.attempts")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordCircuitStateChange(CircuitState state) {
        Counter.builder("foreman.circuit.transitions")
                .description("Observed circuit breaker state changes")
                .tag("state", state.name())
                .register(registry)
                .increment();
    }

    public void recordPhaseTransition(String phase) {
        Counter.builder("foreman.session.phase_transitions")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }
}
