package com.foreman.core.model;

import java.util.List;

/**
 * Thrown when a task or session is asked to make a state change its
 * transition table does not allow. Never retried.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String currentState;
    private final String requestedState;
    private final List<String> allowed;

    public InvalidTransitionException(String message, String currentState, String requestedState,
                                      List<String> allowed) {
        super(message);
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.allowed = List.copyOf(allowed);
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getRequestedState() {
        return requestedState;
    }

    /**
     * For task transitions, the source statuses the operation requires;
     * for phase transitions, the targets reachable from the current phase.
     */
    public List<String> getAllowed() {
        return allowed;
    }
}
