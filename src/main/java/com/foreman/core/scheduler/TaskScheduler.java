package com.foreman.core.scheduler;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dependency-aware task selection.
 * <p>
 * The index scan in {@link com.foreman.core.persistence.IndexRepository#getNextTask()}
 * orders by priority only. This class does the second, accurate pass over full
 * {@link Task} objects: a pending task is ready once every dependency id is in the
 * completed set, and the most urgent ready task wins.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private static final Comparator<Task> BY_PRIORITY = Comparator.comparingInt(Task::getPriority);

    /**
     * Pending tasks with all dependencies satisfied, most urgent first.
     * Equal priorities keep their input order.
     *
     * @param tasks        candidate tasks
     * @param completedIds ids of completed tasks
     */
    public List<Task> readyTasks(List<Task> tasks, Set<String> completedIds) {
        return tasks.stream()
                .filter(task -> isReady(task, completedIds))
                .sorted(BY_PRIORITY)
                .collect(Collectors.toList());
    }

    /**
     * The most urgent ready task, or empty when every pending task is blocked.
     */
    public Optional<Task> selectNext(List<Task> tasks, Set<String> completedIds) {
        log.debug("selectNext: {} candidates, {} completed", tasks.size(), completedIds.size());
        Optional<Task> next = readyTasks(tasks, completedIds).stream().findFirst();
        if (next.isEmpty() && !tasks.isEmpty()) {
            log.warn("No tasks with satisfied dependencies among {} candidates", tasks.size());
        }
        return next;
    }

    /** Ids of the tasks in {@code tasks} that are completed. */
    public Set<String> completedIds(List<Task> tasks) {
        return tasks.stream()
                .filter(task -> task.getStatus() == TaskStatus.COMPLETED)
                .map(Task::getId)
                .collect(Collectors.toSet());
    }

    private boolean isReady(Task task, Set<String> completedIds) {
        if (task.getStatus() != TaskStatus.PENDING) {
            return false;
        }
        if (task.isBlocked(completedIds)) {
            log.debug("  {} - deps unsatisfied: {}", task.getId(), task.getDependencies());
            return false;
        }
        log.debug("  {} - eligible (P{}, deps: {})", task.getId(), task.getPriority(), task.getDependencies());
        return true;
    }
}
