package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Lightweight mirror of a {@link Task} kept in the task index for fast scans.
 *
 * @param status           current task status
 * @param priority         lower is more urgent
 * @param module           owning module
 * @param description      one-line summary
 * @param filePath         task document location relative to the tasks directory, may be null
 * @param dependencies     ids of tasks that must complete first, may be null
 * @param estimatedMinutes time estimate, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskIndexEntry(
    TaskStatus status,
    int priority,
    String module,
    String description,
    String filePath,
    List<String> dependencies,
    Integer estimatedMinutes
) {

    public static TaskIndexEntry of(Task task, String filePath) {
        return new TaskIndexEntry(task.getStatus(), task.getPriority(), task.getModule(), task.getDescription(),
                filePath, task.getDependencies(), task.getEstimatedMinutes());
    }

    public TaskIndexEntry withStatus(TaskStatus newStatus) {
        return new TaskIndexEntry(newStatus, priority, module, description, filePath, dependencies, estimatedMinutes);
    }
}
