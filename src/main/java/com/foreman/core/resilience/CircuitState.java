package com.foreman.core.resilience;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    CLOSED,     // calls pass through, failures are counted
    OPEN,       // calls are rejected until the open timeout elapses
    HALF_OPEN   // a single trial call decides between CLOSED and OPEN
}
