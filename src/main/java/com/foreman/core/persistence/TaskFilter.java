package com.foreman.core.persistence;

import com.foreman.core.model.TaskIndexEntry;
import com.foreman.core.model.TaskStatus;

/**
 * Index-level task filter. Null fields match everything.
 */
public record TaskFilter(TaskStatus status, String module, Integer priority) {

    public static final TaskFilter ALL = new TaskFilter(null, null, null);

    public static TaskFilter byStatus(TaskStatus status) {
        return new TaskFilter(status, null, null);
    }

    public boolean matches(TaskIndexEntry entry) {
        return (status == null || status == entry.status())
                && (module == null || module.equals(entry.module()))
                && (priority == null || priority == entry.priority());
    }
}
