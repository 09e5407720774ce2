package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A single unit of work produced by the breakdown phase.
 * <p>
 * Status moves strictly forward: {@code pending -> in_progress -> completed | failed}.
 * There is no reopen. Persistence is the caller's job; this class only guards
 * its own fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Task {

    private final String id;
    private final String module;
    private final int priority;
    private TaskStatus status;
    private final String description;
    private final List<String> acceptanceCriteria;
    private final Integer estimatedMinutes;
    private final List<String> dependencies;
    private final TestRequirements testRequirements;
    private String notes;
    private Instant startedAt;
    private Instant completedAt;
    private Instant failedAt;

    @JsonCreator
    public Task(@JsonProperty("id") String id,
                @JsonProperty("module") String module,
                @JsonProperty("priority") int priority,
                @JsonProperty("status") TaskStatus status,
                @JsonProperty("description") String description,
                @JsonProperty("acceptanceCriteria") List<String> acceptanceCriteria,
                @JsonProperty("estimatedMinutes") Integer estimatedMinutes,
                @JsonProperty("dependencies") List<String> dependencies,
                @JsonProperty("testRequirements") TestRequirements testRequirements,
                @JsonProperty("notes") String notes,
                @JsonProperty("startedAt") Instant startedAt,
                @JsonProperty("completedAt") Instant completedAt,
                @JsonProperty("failedAt") Instant failedAt) {
        this.id = TaskIds.requireValid(id);
        requireConsistentTimestamps(id, startedAt, completedAt, failedAt);
        this.module = module;
        this.priority = priority;
        this.status = status != null ? status : TaskStatus.PENDING;
        this.description = description;
        this.acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
        this.estimatedMinutes = estimatedMinutes;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.testRequirements = testRequirements;
        this.notes = notes;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.failedAt = failedAt;
    }

    /**
     * At most one terminal instant, and only after {@code startedAt}.
     */
    private static void requireConsistentTimestamps(String id, Instant startedAt, Instant completedAt,
                                                    Instant failedAt) {
        if (completedAt != null && failedAt != null) {
            throw new IllegalArgumentException("Task " + id + " cannot be both completed and failed");
        }
        Instant terminal = completedAt != null ? completedAt : failedAt;
        if (terminal == null) {
            return;
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Task " + id + " has a terminal timestamp but was never started");
        }
        if (terminal.isBefore(startedAt)) {
            throw new IllegalArgumentException("Task " + id + " ends before it starts");
        }
    }

    /**
     * A fresh pending task with no timestamps.
     */
    public static Task create(String id, String module, int priority, String description,
                              List<String> acceptanceCriteria, Integer estimatedMinutes,
                              List<String> dependencies, TestRequirements testRequirements) {
        return new Task(id, module, priority, TaskStatus.PENDING, description, acceptanceCriteria,
                estimatedMinutes, dependencies, testRequirements, null, null, null, null);
    }

    public boolean canStart() {
        return status == TaskStatus.PENDING;
    }

    public void start() {
        start(Clock.systemUTC());
    }

    public void start(Clock clock) {
        if (!canStart()) {
            throw invalid("start", "started", TaskStatus.IN_PROGRESS, TaskStatus.PENDING);
        }
        status = TaskStatus.IN_PROGRESS;
        startedAt = clock.instant();
    }

    public void complete() {
        complete(Clock.systemUTC());
    }

    public void complete(Clock clock) {
        if (status != TaskStatus.IN_PROGRESS) {
            throw invalid("complete", "completed", TaskStatus.COMPLETED, TaskStatus.IN_PROGRESS);
        }
        status = TaskStatus.COMPLETED;
        completedAt = clock.instant();
    }

    public void fail() {
        fail(Clock.systemUTC());
    }

    public void fail(Clock clock) {
        if (status != TaskStatus.IN_PROGRESS) {
            throw invalid("fail", "failed", TaskStatus.FAILED, TaskStatus.IN_PROGRESS);
        }
        status = TaskStatus.FAILED;
        failedAt = clock.instant();
    }

    /**
     * True when at least one dependency is missing from {@code completedIds}.
     * A dependency on an id that no longer exists keeps the task blocked.
     */
    public boolean isBlocked(Set<String> completedIds) {
        for (String dependency : dependencies) {
            if (!completedIds.contains(dependency)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Minutes between start and completion/failure, rounded half-up.
     * Empty while the task has not both started and finished.
     */
    public OptionalLong getActualDuration() {
        Instant end = completedAt != null ? completedAt : failedAt;
        if (startedAt == null || end == null) {
            return OptionalLong.empty();
        }
        long millis = Duration.between(startedAt, end).toMillis();
        return OptionalLong.of(Math.round(millis / 60000.0));
    }

    public boolean isOverEstimate() {
        OptionalLong actual = getActualDuration();
        if (actual.isEmpty() || actual.getAsLong() == 0 || estimatedMinutes == null || estimatedMinutes == 0) {
            return false;
        }
        return actual.getAsLong() > estimatedMinutes;
    }

    /** Status-based progress: 0 pending/failed/blocked, 50 in progress, 100 completed. */
    public int getCompletionPercentage() {
        return switch (status) {
            case IN_PROGRESS -> 50;
            case COMPLETED -> 100;
            default -> 0;
        };
    }

    public boolean isTerminal() {
        return status == TaskStatus.COMPLETED || status == TaskStatus.FAILED;
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    public void appendNote(String note) {
        if (notes == null || notes.isBlank()) {
            notes = note;
        } else {
            notes = notes + "\n" + note;
        }
    }

    /** Deep copy, used to snapshot a task before a batch mutates it. */
    public Task copy() {
        return new Task(id, module, priority, status, description, acceptanceCriteria, estimatedMinutes,
                dependencies, testRequirements, notes, startedAt, completedAt, failedAt);
    }

    private InvalidTransitionException invalid(String verb, String participle, TaskStatus target,
                                               TaskStatus required) {
        return new InvalidTransitionException(
                String.format("Cannot %s task %s: current status is %s. Only %s tasks can be %s.",
                        verb, id, status.value(), required.value(), participle),
                status.value(), target.value(), List.of(required.value()));
    }

    public String getId() { return id; }
    public String getModule() { return module; }
    public int getPriority() { return priority; }
    public TaskStatus getStatus() { return status; }
    public String getDescription() { return description; }
    public List<String> getAcceptanceCriteria() { return acceptanceCriteria; }
    public Integer getEstimatedMinutes() { return estimatedMinutes; }
    public List<String> getDependencies() { return dependencies; }
    public TestRequirements getTestRequirements() { return testRequirements; }
    public String getNotes() { return notes; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Instant getFailedAt() { return failedAt; }

    @Override
    public String toString() {
        return "Task[" + id + ", " + status.value() + ", P" + priority + "]";
    }
}
