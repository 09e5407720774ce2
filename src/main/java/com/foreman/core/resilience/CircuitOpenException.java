package com.foreman.core.resilience;

import java.time.Instant;

/**
 * Thrown instead of invoking the guarded operation while the circuit is open.
 */
public class CircuitOpenException extends RuntimeException {

    private final Instant openedAt;

    public CircuitOpenException(String message, Instant openedAt) {
        super(message);
        this.openedAt = openedAt;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }
}
