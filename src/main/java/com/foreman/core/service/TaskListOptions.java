package com.foreman.core.service;

import com.foreman.core.model.TaskStatus;

/**
 * Filtering, ordering and paging for {@link TaskService#listTasks(TaskListOptions)}.
 *
 * @param ready only pending tasks whose dependencies are all completed
 */
public record TaskListOptions(
        TaskStatus status,
        String module,
        Integer priority,
        Boolean hasDependencies,
        boolean ready,
        SortKey sort,
        int limit,
        int offset
) {

    public static final int DEFAULT_LIMIT = 100;

    public static final TaskListOptions DEFAULTS =
            new TaskListOptions(null, null, null, null, false, SortKey.PRIORITY, DEFAULT_LIMIT, 0);

    public TaskListOptions {
        if (sort == null) {
            sort = SortKey.PRIORITY;
        }
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
    }

    public enum SortKey {
        PRIORITY,
        STATUS,
        ESTIMATE
    }
}
