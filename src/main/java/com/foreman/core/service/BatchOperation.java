package com.foreman.core.service;

/**
 * A single step of {@link TaskService#batchOperations}. {@code reason} is required
 * for {@link Action#FAIL}; {@code duration} is an optional note for {@link Action#DONE}.
 */
public record BatchOperation(Action action, String taskId, String reason, String duration) {

    public enum Action {
        START,
        DONE,
        FAIL
    }

    public static BatchOperation start(String taskId) {
        return new BatchOperation(Action.START, taskId, null, null);
    }

    public static BatchOperation done(String taskId, String duration) {
        return new BatchOperation(Action.DONE, taskId, null, duration);
    }

    public static BatchOperation fail(String taskId, String reason) {
        return new BatchOperation(Action.FAIL, taskId, reason, null);
    }
}
