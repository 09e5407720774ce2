package com.foreman.core.healing;

import com.foreman.core.resilience.CircuitState;

public record HealingStats(
        int totalAttempts,
        int successfulAttempts,
        int failedAttempts,
        int circuitOpenCount,
        CircuitState currentCircuitState
) {}
