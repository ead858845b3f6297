package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.SchedulerStats;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private static final Set<String> ALL = Set.of("compute", "gpu", "search");

    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TaskScheduler();
    }

    @Test
    void shouldReturnTasksByPriority() {
        scheduler.addTask(task("low", TaskPriority.LOW));
        scheduler.addTask(task("high", TaskPriority.HIGH));
        scheduler.addTask(task("medium", TaskPriority.MEDIUM));

        assertEquals("high", scheduler.nextTask(ALL).orElseThrow().getDescription());
        assertEquals("medium", scheduler.nextTask(ALL).orElseThrow().getDescription());
        assertEquals("low", scheduler.nextTask(ALL).orElseThrow().getDescription());
        assertTrue(scheduler.nextTask(ALL).isEmpty());
    }

    @Test
    void shouldBreakPriorityTiesByCreationTime() {
        Instant now = Instant.now();
        scheduler.addTask(Task.builder().description("newer").priority(TaskPriority.HIGH).createdAt(now).build());
        scheduler.addTask(Task.builder().description("older").priority(TaskPriority.HIGH).createdAt(now.minusSeconds(5)).build());

        assertEquals("older", scheduler.nextTask(ALL).orElseThrow().getDescription());
        assertEquals("newer", scheduler.nextTask(ALL).orElseThrow().getDescription());
    }

    @Test
    void shouldHoldTaskUntilDependenciesComplete() {
        Task extract = task("extract", TaskPriority.LOW);
        Task report = Task.builder()
            .description("report")
            .priority(TaskPriority.CRITICAL)
            .dependencies(List.of(extract.getId()))
            .build();
        scheduler.addTask(extract);
        scheduler.addTask(report);

        Task first = scheduler.nextTask(ALL).orElseThrow();
        assertSame(extract, first);
        assertTrue(scheduler.nextTask(ALL).isEmpty());

        extract.start();
        scheduler.updateTaskStatus(extract);
        assertTrue(scheduler.nextTask(ALL).isEmpty());

        extract.complete("rows");
        scheduler.updateTaskStatus(extract);
        assertSame(report, scheduler.nextTask(ALL).orElseThrow());
    }

    @Test
    void shouldNotReleaseTaskWhenDependencyFailed() {
        Task extract = task("extract", TaskPriority.LOW);
        Task report = Task.builder().description("report").dependencies(List.of(extract.getId())).build();
        scheduler.addTask(report);
        scheduler.addTask(extract);

        scheduler.nextTask(ALL);
        extract.start();
        extract.fail("source offline");
        scheduler.updateTaskStatus(extract);

        assertTrue(scheduler.nextTask(ALL).isEmpty());
        assertEquals(1, scheduler.getStats().getPendingTasks());
        assertEquals(1, scheduler.getStats().getFailedTasks());
    }

    @Test
    void shouldMatchCapabilitiesBySubset() {
        Task render = Task.builder().description("render").requiredCapabilities(Set.of("compute", "gpu")).build();
        scheduler.addTask(render);

        assertTrue(scheduler.nextTask(Set.of("compute")).isEmpty());
        assertSame(render, scheduler.nextTask(Set.of("compute", "gpu", "search")).orElseThrow());
    }

    @Test
    void shouldTreatMissingCapabilitySetAsNoRequirement() {
        Task open = Task.builder().description("open").priority(TaskPriority.CRITICAL).build();
        open.setRequiredCapabilities(null);
        scheduler.addTask(open);
        scheduler.addTask(task("cpu job", TaskPriority.LOW));

        assertSame(open, scheduler.nextTask(Set.of()).orElseThrow());
        assertEquals("cpu job", scheduler.nextTask(Set.of("compute")).orElseThrow().getDescription());
    }

    @Test
    void shouldSkipIneligibleTaskAndReturnNextEligible() {
        scheduler.addTask(Task.builder().description("gpu job").priority(TaskPriority.CRITICAL)
            .requiredCapabilities(Set.of("gpu")).build());
        scheduler.addTask(task("cpu job", TaskPriority.LOW));

        assertEquals("cpu job", scheduler.nextTask(Set.of("compute")).orElseThrow().getDescription());
        assertEquals(1, scheduler.getStats().getPendingTasks());
    }

    @Test
    void shouldReclassifyByStatus() {
        Task task = task("classify", TaskPriority.MEDIUM);
        scheduler.addTask(task);
        scheduler.nextTask(ALL);

        task.start();
        scheduler.updateTaskStatus(task);
        scheduler.updateTaskStatus(task);
        SchedulerStats running = scheduler.getStats();
        assertEquals(1, running.getRunningTasks());
        assertEquals(Optional.of(task), scheduler.findRunningTask(task.getId()));
        assertTrue(scheduler.findFinishedTask(task.getId()).isEmpty());

        task.complete("ok");
        scheduler.updateTaskStatus(task);
        SchedulerStats completed = scheduler.getStats();
        assertEquals(0, completed.getRunningTasks());
        assertEquals(1, completed.getCompletedTasks());
        assertEquals(Set.of(task.getId()), scheduler.getCompletedTaskIds());
        assertSame(task, scheduler.findFinishedTask(task.getId()).orElseThrow());
    }

    @Test
    void shouldDropCancelledTaskFromPartitions() {
        Task task = task("cancel me", TaskPriority.MEDIUM);
        task.start();
        scheduler.updateTaskStatus(task);

        task.cancel();
        scheduler.updateTaskStatus(task);

        assertTrue(scheduler.getRunningTasks().isEmpty());
        assertTrue(scheduler.findFinishedTask(task.getId()).isEmpty());
    }

    @Test
    void shouldNeverHandOutSameTaskTwice() throws Exception {
        int taskCount = 200;
        for (int i = 0; i < taskCount; i++) {
            scheduler.addTask(task("task-" + i, TaskPriority.values()[i % 4]));
        }
        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger handedOut = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                workers.add(pool.submit(() -> {
                    Optional<Task> next;
                    while ((next = scheduler.nextTask(ALL)).isPresent()) {
                        handedOut.incrementAndGet();
                        seen.add(next.get().getId());
                    }
                }));
            }
            for (Future<?> worker : workers) {
                worker.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(taskCount, handedOut.get());
        assertEquals(taskCount, seen.size());
    }

    private Task task(String description, TaskPriority priority) {
        return Task.builder()
            .description(description)
            .priority(priority)
            .requiredCapabilities(Set.of("compute"))
            .build();
    }
}
