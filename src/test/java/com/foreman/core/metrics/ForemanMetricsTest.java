package com.foreman.core.metrics;

import com.foreman.core.resilience.CircuitState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ForemanMetricsTest {

    private SimpleMeterRegistry registry;
    private ForemanMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ForemanMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskTransition increments by status tag")
    void recordTaskTransition() {
        metrics.recordTaskTransition("in_progress");
        metrics.recordTaskTransition("completed");
        metrics.recordTaskTransition("completed");

        var completed = registry.find("foreman.task.transitions").tag("status", "completed").counter();
        var started = registry.find("foreman.task.transitions").tag("status", "in_progress").counter();
        assertNotNull(completed);
        assertNotNull(started);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, started.count());
    }

    @Test
    @DisplayName("recordTaskDuration records to a per-module distribution summary")
    void recordTaskDuration() {
        metrics.recordTaskDuration("auth", 12);
        metrics.recordTaskDuration("auth", 30);

        var summary = registry.find("foreman.task.duration_minutes").tag("module", "auth").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(42.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordRetry counts by error code")
    void recordRetry() {
        metrics.recordRetry("EBUSY");
        var counter = registry.find("foreman.store.retries").tag("code", "EBUSY").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordHealingAttempt separates success and failure")
    void recordHealingAttempt() {
        metrics.recordHealingAttempt(true);
        metrics.recordHealingAttempt(false);
        metrics.recordHealingAttempt(false);

        assertEquals(1.0, registry.find("foreman.healing.attempts").tag("result", "success").counter().count());
        assertEquals(2.0, registry.find("foreman.healing.attempts").tag("result", "failure").counter().count());
    }

    @Test
    @DisplayName("recordCircuitStateChange and recordPhaseTransition tag by name")
    void stateChanges() {
        metrics.recordCircuitStateChange(CircuitState.OPEN);
        metrics.recordPhaseTransition("breakdown");

        assertNotNull(registry.find("foreman.circuit.transitions").tag("state", "OPEN").counter());
        assertNotNull(registry.find("foreman.session.phase_transitions").tag("phase", "breakdown").counter());
    }
}
