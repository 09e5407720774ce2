package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stage of a development session. See {@link SessionState} for the allowed transitions.
 */
public enum Phase {
    @JsonProperty("clarify") CLARIFY("clarify"),
    @JsonProperty("breakdown") BREAKDOWN("breakdown"),
    @JsonProperty("implement") IMPLEMENT("implement"),
    @JsonProperty("heal") HEAL("heal"),
    @JsonProperty("deliver") DELIVER("deliver"),
    @JsonProperty("complete") COMPLETE("complete");

    private final String value;

    Phase(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Phase fromValue(String value) {
        for (Phase phase : values()) {
            if (phase.value.equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
