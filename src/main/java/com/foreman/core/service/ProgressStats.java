package com.foreman.core.service;

import com.foreman.core.model.TaskIndexEntry;

import java.util.Collection;

/**
 * Task counts by status. {@code completionPercentage} is completed over total,
 * rounded, and 0 when there are no tasks.
 */
public record ProgressStats(
        int total,
        int pending,
        int inProgress,
        int completed,
        int failed,
        int blocked,
        int completionPercentage
) {

    static ProgressStats of(Collection<TaskIndexEntry> entries) {
        int pending = 0;
        int inProgress = 0;
        int completed = 0;
        int failed = 0;
        int blocked = 0;
        for (TaskIndexEntry entry : entries) {
            switch (entry.status()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case BLOCKED -> blocked++;
            }
        }
        int total = entries.size();
        int percentage = total == 0 ? 0 : (int) Math.round(completed * 100.0 / total);
        return new ProgressStats(total, pending, inProgress, completed, failed, blocked, percentage);
    }
}
