package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Workflow state of one development session.
 * <p>
 * Phases advance along a fixed table:
 * <pre>
 * clarify   -> breakdown
 * breakdown -> implement
 * implement -> heal, deliver
 * heal      -> implement, deliver
 * deliver   -> complete
 * complete  (terminal)
 * </pre>
 * Staying in the current phase is always allowed. Every mutation bumps {@code updatedAt}.
 * The requirements payload and error records are owned by collaborators and kept as raw JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class SessionState {

    private static final Map<Phase, Set<Phase>> VALID_TRANSITIONS = new EnumMap<>(Phase.class);

    static {
        VALID_TRANSITIONS.put(Phase.CLARIFY, EnumSet.of(Phase.BREAKDOWN));
        VALID_TRANSITIONS.put(Phase.BREAKDOWN, EnumSet.of(Phase.IMPLEMENT));
        VALID_TRANSITIONS.put(Phase.IMPLEMENT, EnumSet.of(Phase.HEAL, Phase.DELIVER));
        VALID_TRANSITIONS.put(Phase.HEAL, EnumSet.of(Phase.IMPLEMENT, Phase.DELIVER));
        VALID_TRANSITIONS.put(Phase.DELIVER, EnumSet.of(Phase.COMPLETE));
        VALID_TRANSITIONS.put(Phase.COMPLETE, EnumSet.noneOf(Phase.class));
    }

    private Phase phase;
    private String currentTask;
    private JsonNode requirementsPayload;
    private List<JsonNode> errors;
    private final Instant startedAt;
    private Instant updatedAt;

    @JsonIgnore
    private final Clock clock;

    @JsonCreator
    public SessionState(@JsonProperty("phase") Phase phase,
                        @JsonProperty("currentTask") String currentTask,
                        @JsonProperty("requirementsPayload") JsonNode requirementsPayload,
                        @JsonProperty("errors") List<JsonNode> errors,
                        @JsonProperty("startedAt") Instant startedAt,
                        @JsonProperty("updatedAt") Instant updatedAt) {
        this(phase, currentTask, requirementsPayload, errors, startedAt, updatedAt, Clock.systemUTC());
    }

    public SessionState(Phase phase, String currentTask, JsonNode requirementsPayload, List<JsonNode> errors,
                        Instant startedAt, Instant updatedAt, Clock clock) {
        if (phase == null) {
            throw new IllegalArgumentException("phase is required");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt is required");
        }
        this.phase = phase;
        this.currentTask = currentTask;
        this.requirementsPayload = requirementsPayload;
        this.errors = errors != null ? new ArrayList<>(errors) : new ArrayList<>();
        this.startedAt = startedAt;
        this.updatedAt = updatedAt != null ? updatedAt : startedAt;
        this.clock = clock;
    }

    /** New session in the clarify phase. */
    public static SessionState createNew(Clock clock) {
        return createNew(Phase.CLARIFY, clock);
    }

    public static SessionState createNew(Phase phase, Clock clock) {
        Instant now = clock.instant();
        return new SessionState(phase, null, null, List.of(), now, now, clock);
    }

    /** Same state, with mutations stamped by {@code other}. */
    public SessionState withClock(Clock other) {
        return new SessionState(phase, currentTask, requirementsPayload, errors, startedAt, updatedAt, other);
    }

    public boolean canTransitionTo(Phase target) {
        if (target == phase) {
            return true;
        }
        return VALID_TRANSITIONS.get(phase).contains(target);
    }

    public void transitionTo(Phase target) {
        if (target == null) {
            throw new IllegalArgumentException("target phase is required");
        }
        if (!canTransitionTo(target)) {
            List<String> allowed = getNextAllowedPhases().stream().map(Phase::value).toList();
            String allowedList = allowed.isEmpty() ? "none" : String.join(", ", allowed);
            throw new InvalidTransitionException(
                    String.format("Invalid phase transition: %s -> %s. Allowed transitions from %s: %s",
                            phase.value(), target.value(), phase.value(), allowedList),
                    phase.value(), target.value(), allowed);
        }
        phase = target;
        touch();
    }

    public List<Phase> getNextAllowedPhases() {
        return VALID_TRANSITIONS.get(phase).stream().sorted().collect(Collectors.toList());
    }

    public void setCurrentTask(String taskId) {
        currentTask = taskId;
        touch();
    }

    public void setRequirementsPayload(JsonNode payload) {
        requirementsPayload = payload;
        touch();
    }

    public void addError(JsonNode error) {
        errors.add(error);
        touch();
    }

    public void clearErrors() {
        errors = new ArrayList<>();
        touch();
    }

    private void touch() {
        updatedAt = clock.instant();
    }

    public Phase getPhase() { return phase; }
    public String getCurrentTask() { return currentTask; }
    public JsonNode getRequirementsPayload() { return requirementsPayload; }
    public List<JsonNode> getErrors() { return Collections.unmodifiableList(new ArrayList<>(errors)); }
    public Instant getStartedAt() { return startedAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "SessionState[" + phase.value() + (currentTask != null ? ", task=" + currentTask : "") + "]";
    }
}
