package com.foreman.core.healing;

import com.foreman.core.resilience.CircuitState;

/**
 * Outcome of one healing attempt.
 *
 * @param success       true only when the operation ran and reported success
 * @param taskId        task being healed
 * @param attemptNumber 1-based attempt count for this task, rejected calls included
 * @param circuitState  breaker state after the attempt
 * @param error         the failure, or null
 */
public record HealingResult(
        boolean success,
        String taskId,
        int attemptNumber,
        CircuitState circuitState,
        Exception error
) {}
