package com.foreman.core.scheduler;

import com.foreman.core.MutableClock;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TaskScheduler();
    }

    private Task task(String id, int priority, List<String> deps) {
        return Task.create(id, "core", priority, "Do " + id, List.of(), 30, deps, null);
    }

    @Test
    @DisplayName("Independent tasks -> lowest priority number first")
    void independentTasks() {
        var tasks = List.of(task("A", 3, List.of()), task("B", 1, List.of()), task("C", 2, List.of()));
        assertEquals("B", scheduler.selectNext(tasks, Set.of()).orElseThrow().getId());
        assertEquals(List.of("B", "C", "A"),
                scheduler.readyTasks(tasks, Set.of()).stream().map(Task::getId).toList());
    }

    @Test
    @DisplayName("Linear chain A->B->C -> one ready task at a time")
    void linearChain() {
        var tasks = List.of(
                task("A", 1, List.of()),
                task("B", 1, List.of("A")),
                task("C", 1, List.of("B"))
        );
        assertEquals(List.of("A"), ids(scheduler.readyTasks(tasks, Set.of())));
        assertEquals(List.of("A", "B"), ids(scheduler.readyTasks(tasks, Set.of("A"))));
        assertEquals(List.of("A", "B", "C"), ids(scheduler.readyTasks(tasks, Set.of("A", "B"))));
    }

    @Test
    @DisplayName("A blocked urgent task yields to a ready one")
    void blockedUrgentTask() {
        var tasks = List.of(task("urgent", 1, List.of("setup")), task("later", 5, List.of()));
        assertEquals("later", scheduler.selectNext(tasks, Set.of()).orElseThrow().getId());
        assertEquals("urgent", scheduler.selectNext(tasks, Set.of("setup")).orElseThrow().getId());
    }

    @Test
    @DisplayName("Equal priorities keep input order")
    void stableTies() {
        var tasks = List.of(task("first", 2, List.of()), task("second", 2, List.of()));
        assertEquals("first", scheduler.selectNext(tasks, Set.of()).orElseThrow().getId());
    }

    @Test
    @DisplayName("Only pending tasks are candidates")
    void onlyPending() {
        Task running = task("running", 1, List.of());
        running.start(new MutableClock());
        var tasks = List.of(running, task("waiting", 2, List.of()));
        assertEquals("waiting", scheduler.selectNext(tasks, Set.of()).orElseThrow().getId());
    }

    @Test
    @DisplayName("Everything blocked -> empty")
    void allBlocked() {
        var tasks = List.of(task("A", 1, List.of("ghost")), task("B", 1, List.of("A")));
        assertTrue(scheduler.selectNext(tasks, Set.of()).isEmpty());
        assertTrue(scheduler.selectNext(List.of(), Set.of()).isEmpty());
    }

    @Test
    @DisplayName("completedIds picks only completed tasks")
    void completedIds() {
        var clock = new MutableClock();
        Task done = task("done", 1, List.of());
        done.start(clock);
        done.complete(clock);
        Task failed = task("failed", 1, List.of());
        failed.start(clock);
        failed.fail(clock);
        assertEquals(Set.of("done"), scheduler.completedIds(List.of(done, failed, task("new", 1, List.of()))));
        assertEquals(TaskStatus.FAILED, failed.getStatus());
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::getId).toList();
    }
}
