package com.foreman.core.resilience;

import java.time.Instant;

/**
 * Point-in-time view of a circuit breaker.
 *
 * @param state        current state
 * @param failureCount failures since the last success
 * @param openedAt     when the circuit last opened, null if it never has
 */
public record CircuitBreakerMetrics(CircuitState state, int failureCount, Instant openedAt) {
}
