package com.foreman.core.service;

import com.foreman.core.config.ForemanProperties;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.SessionState;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.model.TestRequirements;
import com.foreman.core.persistence.IndexRepository;
import com.foreman.core.persistence.StoreException;
import com.foreman.core.persistence.TaskFilter;
import com.foreman.core.persistence.TaskNotFoundException;
import com.foreman.core.persistence.TaskRepository;
import com.foreman.core.persistence.WorkspaceStore;
import com.foreman.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Task operations used by the CLI: creation, listing, selection of the next task,
 * and the start / complete / fail lifecycle.
 * <p>
 * Every lifecycle transition is appended to {@code progress.log}, keeps the session's
 * current task in step, and is counted in metrics.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final String PROGRESS_LOG = "progress.log";
    static final int DEFAULT_PRIORITY = 1;
    static final int DEFAULT_ESTIMATE_MINUTES = 30;

    private final TaskRepository taskRepository;
    private final IndexRepository indexRepository;
    private final StateService stateService;
    private final TaskScheduler scheduler;
    private final WorkspaceStore store;
    private final ForemanMetrics metrics;
    private final Path progressLog;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, IndexRepository indexRepository,
                       StateService stateService, TaskScheduler scheduler, WorkspaceStore store,
                       ForemanMetrics metrics, ForemanProperties properties, Clock clock) {
        this.taskRepository = taskRepository;
        this.indexRepository = indexRepository;
        this.stateService = stateService;
        this.scheduler = scheduler;
        this.store = store;
        this.metrics = metrics;
        this.progressLog = properties.stateDir().resolve(PROGRESS_LOG);
        this.clock = clock;
    }

    /**
     * @throws TaskAlreadyExistsException if a task with the same id exists
     * @throws IllegalArgumentException if the id is malformed or the module is missing
     */
    public Task createTask(CreateTaskInput input) {
        if (indexRepository.hasEntry(input.id())) {
            throw new TaskAlreadyExistsException(input.id());
        }
        if (input.module() == null || input.module().isBlank()) {
            throw new IllegalArgumentException("Task " + input.id() + " needs a module");
        }
        TestRequirements tests = input.testPattern() != null
                ? TestRequirements.unitTests(input.testPattern())
                : null;
        Task task = Task.create(
                input.id(),
                input.module(),
                input.priority() != null ? input.priority() : DEFAULT_PRIORITY,
                input.description(),
                input.acceptanceCriteria() != null ? input.acceptanceCriteria() : List.of(),
                input.estimatedMinutes() != null ? input.estimatedMinutes() : DEFAULT_ESTIMATE_MINUTES,
                input.dependencies() != null ? input.dependencies() : List.of(),
                tests);
        taskRepository.save(task);
        log.info("Task created: {} (module {}, P{})", task.getId(), task.getModule(), task.getPriority());
        return task;
    }

    public Optional<Task> getTask(String taskId) {
        return taskRepository.findById(taskId);
    }

    public TaskListResult listTasks(TaskListOptions options) {
        List<Task> tasks = new ArrayList<>(taskRepository.findAll(
                new TaskFilter(options.status(), options.module(), options.priority())));
        if (options.hasDependencies() != null) {
            boolean wanted = options.hasDependencies();
            tasks.removeIf(task -> task.hasDependencies() != wanted);
        }
        if (options.ready()) {
            tasks = new ArrayList<>(scheduler.readyTasks(tasks, completedIds()));
        }
        tasks.sort(comparator(options.sort()));

        int total = tasks.size();
        int from = Math.min(options.offset(), total);
        int to = (int) Math.min((long) from + options.limit(), total);
        return new TaskListResult(List.copyOf(tasks.subList(from, to)), total, options.offset(), options.limit());
    }

    /**
     * The most urgent pending task whose dependencies are all completed.
     * Unlike {@link IndexRepository#getNextTask()} this honours dependencies.
     */
    public Optional<Task> getNextTask() {
        List<Task> pending = taskRepository.findAll(TaskFilter.byStatus(TaskStatus.PENDING));
        if (pending.isEmpty()) {
            log.info("No pending tasks");
            return Optional.empty();
        }
        Optional<Task> next = scheduler.selectNext(pending, completedIds());
        next.ifPresent(task -> log.info("Next task: {}", task.getId()));
        return next;
    }

    /**
     * Marks the task in progress and makes it the session's current task.
     * Starting a task that is already in progress is a no-op.
     */
    public Task startTask(String taskId) {
        Task task = require(taskId);
        if (task.getStatus() == TaskStatus.IN_PROGRESS) {
            log.warn("Task already in progress: {}", taskId);
            return task;
        }
        task.start(clock);
        taskRepository.save(task);
        if (stateService.exists()) {
            stateService.setCurrentTask(taskId);
        }
        MdcContext.setTask(taskId);
        metrics.recordTaskTransition(TaskStatus.IN_PROGRESS.value());
        logProgress("STARTED", taskId, null);
        log.info("Task started: {}", taskId);
        return task;
    }

    public Task completeTask(String taskId) {
        return completeTask(taskId, null);
    }

    /**
     * Marks the task completed. Completing an already completed task is a no-op.
     *
     * @param duration free-form duration noted on the task, may be null
     */
    public Task completeTask(String taskId, String duration) {
        Task task = require(taskId);
        if (task.getStatus() == TaskStatus.COMPLETED) {
            log.warn("Task already completed: {}", taskId);
            return task;
        }
        task.complete(clock);
        if (duration != null && !duration.isBlank()) {
            task.appendNote("Completed in " + duration);
        }
        taskRepository.save(task);
        releaseCurrentTask(taskId);
        metrics.recordTaskTransition(TaskStatus.COMPLETED.value());
        task.getActualDuration().ifPresent(minutes -> metrics.recordTaskDuration(task.getModule(), minutes));
        logProgress("COMPLETED", taskId, duration);
        log.info("Task completed: {}", taskId);
        return task;
    }

    public Task failTask(String taskId, String reason) {
        Task task = require(taskId);
        task.fail(clock);
        task.appendNote("Failed: " + reason);
        taskRepository.save(task);
        releaseCurrentTask(taskId);
        metrics.recordTaskTransition(TaskStatus.FAILED.value());
        logProgress("FAILED", taskId, reason);
        log.error("Task failed: {} ({})", taskId, reason);
        return task;
    }

    /**
     * Runs the operations in order. Without {@code atomic}, failures are recorded and
     * the batch continues. With {@code atomic}, the first failure restores every task
     * the batch touched to its state before the batch and raises
     * {@link BatchOperationException}.
     */
    public List<BatchResult> batchOperations(List<BatchOperation> operations, boolean atomic) {
        log.info("Executing {} batch operations (atomic={})", operations.size(), atomic);
        var results = new ArrayList<BatchResult>();
        Map<String, Task> backups = new LinkedHashMap<>();
        for (BatchOperation op : operations) {
            try {
                if (atomic && !backups.containsKey(op.taskId())) {
                    taskRepository.findById(op.taskId()).ifPresent(task -> backups.put(op.taskId(), task.copy()));
                }
                apply(op);
                results.add(new BatchResult(op.taskId(), op.action(), true, null));
            } catch (RuntimeException e) {
                results.add(new BatchResult(op.taskId(), op.action(), false, e.getMessage()));
                if (atomic) {
                    log.warn("Batch operation on {} failed, rolling back {} tasks: {}",
                            op.taskId(), backups.size(), e.getMessage());
                    backups.values().forEach(taskRepository::save);
                    throw new BatchOperationException(
                            "Batch operation failed, rolled back: " + e.getMessage(), results, e);
                }
                log.warn("Batch operation {} on {} failed: {}", op.action(), op.taskId(), e.getMessage());
            }
        }
        long succeeded = results.stream().filter(BatchResult::success).count();
        log.info("Batch operations completed: {} succeeded, {} failed", succeeded, results.size() - succeeded);
        return results;
    }

    private void apply(BatchOperation op) {
        switch (op.action()) {
            case START -> startTask(op.taskId());
            case DONE -> completeTask(op.taskId(), op.duration());
            case FAIL -> {
                if (op.reason() == null || op.reason().isBlank()) {
                    throw new IllegalArgumentException("Reason required for fail action");
                }
                failTask(op.taskId(), op.reason());
            }
        }
    }

    private Task require(String taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private Set<String> completedIds() {
        return new HashSet<>(indexRepository.queryByStatus(TaskStatus.COMPLETED));
    }

    private void releaseCurrentTask(String taskId) {
        Optional<SessionState> state = stateService.getState();
        if (state.isPresent() && taskId.equals(state.get().getCurrentTask())) {
            stateService.updateState(StateUpdate.withoutCurrentTask());
        }
        MdcContext.clearTask();
    }

    private void logProgress(String action, String taskId, String details) {
        String line = details != null && !details.isBlank()
                ? String.format("[%s] %s: %s - %s\n", clock.instant(), action, taskId, details)
                : String.format("[%s] %s: %s\n", clock.instant(), action, taskId);
        try {
            store.ensureDirectory(progressLog.getParent());
            store.append(progressLog, line);
        } catch (StoreException e) {
            log.warn("Failed to write progress log {}: {}", progressLog, e.getMessage());
        }
    }

    private static Comparator<Task> comparator(TaskListOptions.SortKey key) {
        return switch (key) {
            case PRIORITY -> Comparator.comparingInt(Task::getPriority);
            case STATUS -> Comparator.comparing((Task task) -> task.getStatus().value());
            case ESTIMATE -> Comparator.comparingInt(
                    (Task task) -> task.getEstimatedMinutes() != null ? task.getEstimatedMinutes() : 0);
        };
    }
}
