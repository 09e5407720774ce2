package com.foreman.dispatch.cli;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.persistence.TaskNotFoundException;
import com.foreman.core.service.BatchOperation;
import com.foreman.core.service.BatchResult;
import com.foreman.core.service.CreateTaskInput;
import com.foreman.core.service.TaskListOptions;
import com.foreman.core.service.TaskListResult;
import com.foreman.core.service.TaskService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: foreman tasks create|list|next|show|start|done|fail|batch
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "Create, select and track tasks")
@Component
public class TasksCommand {

    private final TaskService taskService;

    public TasksCommand(TaskService taskService) {
        this.taskService = taskService;
    }

    @Command(name = "create", description = "Create a pending task")
    int create(@Option(names = "--id", required = true, description = "Task id, e.g. auth.login") String id,
               @Option(names = "--module", required = true) String module,
               @Option(names = "--description", required = true) String description,
               @Option(names = "--priority", description = "Lower runs first (default: 1)") Integer priority,
               @Option(names = "--estimate", description = "Estimated minutes (default: 30)") Integer estimate,
               @Option(names = "--criteria", description = "Acceptance criterion (repeatable)") List<String> criteria,
               @Option(names = "--deps", split = ",", description = "Comma-separated dependency ids") List<String> dependencies,
               @Option(names = "--test-pattern", description = "Glob of the unit tests that cover this task") String testPattern) {
        Task task = taskService.createTask(new CreateTaskInput(
                id, module, priority, estimate, description, criteria, dependencies, testPattern));
        ConsoleOutput.success("Created " + task.getId());
        return ExitCodes.SUCCESS;
    }

    @Command(name = "list", description = "List tasks")
    int list(@Option(names = "--status") String status,
             @Option(names = "--module") String module,
             @Option(names = "--priority") Integer priority,
             @Option(names = "--has-deps", arity = "1", description = "true or false") Boolean hasDependencies,
             @Option(names = "--ready", description = "Only pending tasks with completed dependencies") boolean ready,
             @Option(names = "--sort", defaultValue = "PRIORITY",
                     description = "PRIORITY, STATUS or ESTIMATE (default: ${DEFAULT-VALUE})") TaskListOptions.SortKey sort,
             @Option(names = "--limit", defaultValue = "100") int limit,
             @Option(names = "--offset", defaultValue = "0") int offset) {
        TaskStatus statusFilter = status != null ? TaskStatus.fromValue(status) : null;
        TaskListResult result = taskService.listTasks(new TaskListOptions(
                statusFilter, module, priority, hasDependencies, ready, sort, limit, offset));
        if (result.tasks().isEmpty()) {
            ConsoleOutput.info("No matching tasks");
            return ExitCodes.SUCCESS;
        }
        result.tasks().forEach(ConsoleOutput::taskRow);
        System.out.printf("%nShowing %d of %d%n", result.returned(), result.total());
        return ExitCodes.SUCCESS;
    }

    @Command(name = "next", description = "Show the next task to work on")
    int next() {
        Optional<Task> next = taskService.getNextTask();
        if (next.isEmpty()) {
            ConsoleOutput.info("No task is ready");
            return ExitCodes.DEPENDENCY_NOT_MET;
        }
        ConsoleOutput.taskDetail(next.get());
        return ExitCodes.SUCCESS;
    }

    @Command(name = "show", description = "Show one task")
    int show(@Parameters(index = "0") String taskId) {
        Task task = taskService.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        ConsoleOutput.taskDetail(task);
        return ExitCodes.SUCCESS;
    }

    @Command(name = "start", description = "Mark a task in progress")
    int start(@Parameters(index = "0") String taskId) {
        Task task = taskService.startTask(taskId);
        ConsoleOutput.success("Started " + task.getId());
        return ExitCodes.SUCCESS;
    }

    @Command(name = "done", description = "Mark a task completed")
    int done(@Parameters(index = "0") String taskId,
             @Option(names = "--duration", description = "Time spent, recorded in the task notes") String duration) {
        Task task = taskService.completeTask(taskId, duration);
        ConsoleOutput.success("Completed " + task.getId());
        return ExitCodes.SUCCESS;
    }

    @Command(name = "fail", description = "Mark a task failed")
    int fail(@Parameters(index = "0") String taskId,
             @Option(names = "--reason", required = true) String reason) {
        Task task = taskService.failTask(taskId, reason);
        ConsoleOutput.error("Failed " + task.getId() + ": " + reason);
        return ExitCodes.SUCCESS;
    }

    @Command(name = "batch", description = "Apply several operations: start:<id>, done:<id>[:duration], fail:<id>:<reason>")
    int batch(@Option(names = "--atomic", description = "Roll back every task on the first failure") boolean atomic,
              @Parameters(arity = "1..*", paramLabel = "OPERATION") List<String> specs) {
        List<BatchOperation> operations = new ArrayList<>();
        for (String spec : specs) {
            operations.add(parseOperation(spec));
        }
        List<BatchResult> results = taskService.batchOperations(operations, atomic);
        int failures = 0;
        for (BatchResult result : results) {
            String label = result.action().name().toLowerCase() + " " + result.taskId();
            if (result.success()) {
                ConsoleOutput.success(label);
            } else {
                failures++;
                ConsoleOutput.error(label + ": " + result.error());
            }
        }
        return failures == 0 ? ExitCodes.SUCCESS : ExitCodes.GENERAL_ERROR;
    }

    static BatchOperation parseOperation(String spec) {
        String[] parts = spec.split(":", 3);
        if (parts.length < 2 || parts[1].isBlank()) {
            throw new IllegalArgumentException("Invalid batch operation '" + spec + "', expected <action>:<task-id>");
        }
        String detail = parts.length == 3 ? parts[2] : null;
        return switch (parts[0].toLowerCase()) {
            case "start" -> BatchOperation.start(parts[1]);
            case "done" -> BatchOperation.done(parts[1], detail);
            case "fail" -> BatchOperation.fail(parts[1], detail);
            default -> throw new IllegalArgumentException("Unknown batch action: " + parts[0]);
        };
    }
}
