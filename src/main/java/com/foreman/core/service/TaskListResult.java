package com.foreman.core.service;

import com.foreman.core.model.Task;

import java.util.List;

/**
 * One page of a task listing; {@code total} counts every match before paging.
 */
public record TaskListResult(List<Task> tasks, int total, int offset, int limit) {

    public int returned() {
        return tasks.size();
    }
}
