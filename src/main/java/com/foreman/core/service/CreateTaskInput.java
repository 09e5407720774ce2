package com.foreman.core.service;

import java.util.List;

/**
 * Fields for {@link TaskService#createTask(CreateTaskInput)}. Null priority and
 * estimate fall back to 1 and 30 minutes.
 */
public record CreateTaskInput(
        String id,
        String module,
        Integer priority,
        Integer estimatedMinutes,
        String description,
        List<String> acceptanceCriteria,
        List<String> dependencies,
        String testPattern
) {

    public static CreateTaskInput of(String id, String module, String description) {
        return new CreateTaskInput(id, module, null, null, description, null, null, null);
    }
}
