package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle status of a task.
 */
public enum TaskStatus {
    @JsonProperty("pending") PENDING("pending"),
    @JsonProperty("in_progress") IN_PROGRESS("in_progress"),
    @JsonProperty("completed") COMPLETED("completed"),
    @JsonProperty("failed") FAILED("failed"),
    @JsonProperty("blocked") BLOCKED("blocked");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    /** Name used in persisted records and on the command line. */
    public String value() {
        return value;
    }

    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
