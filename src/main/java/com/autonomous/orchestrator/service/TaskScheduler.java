package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.SchedulerStats;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds tasks not yet claimed by an agent, plus running/completed/failed partitions keyed by id.
 * <p>
 * Every public method runs under the scheduler monitor, so {@link #nextTask(Set)} removes a task
 * in the same step that selects it and never hands one task to two callers.
 * </p>
 */
@Slf4j
@Service
public class TaskScheduler {

    private static final Comparator<Task> QUEUE_ORDER = Comparator
        .comparingInt((Task task) -> task.getPriority().getValue()).reversed()
        .thenComparing(Task::getCreatedAt);

    private final List<Task> taskQueue = new ArrayList<>();
    private final Map<String, Task> runningTasks = new LinkedHashMap<>();
    private final Map<String, Task> completedTasks = new LinkedHashMap<>();
    private final Map<String, Task> failedTasks = new LinkedHashMap<>();

    public synchronized void addTask(Task task) {
        taskQueue.add(task);
        taskQueue.sort(QUEUE_ORDER);
        log.debug("Task queued. taskId={}, priority={}, pending={}", task.getId(), task.getPriority(), taskQueue.size());
    }

    /**
     * Removes and returns the highest-ranked pending task whose dependencies are completed and
     * whose required capabilities are all in {@code capabilities}.
     */
    public synchronized Optional<Task> nextTask(Set<String> capabilities) {
        Set<String> completedIds = new HashSet<>(completedTasks.keySet());
        Iterator<Task> iterator = taskQueue.iterator();
        while (iterator.hasNext()) {
            Task task = iterator.next();
            if (task.getStatus() == TaskStatus.PENDING
                    && task.canStart(completedIds)
                    && task.canRunWith(capabilities)) {
                iterator.remove();
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    /**
     * Files the task under the partition matching its current status, removing it from any
     * other. PENDING and CANCELLED tasks end up in no partition.
     */
    public synchronized void updateTaskStatus(Task task) {
        String id = task.getId();
        runningTasks.remove(id);
        completedTasks.remove(id);
        failedTasks.remove(id);
        TaskStatus status = task.getStatus();
        switch (status) {
            case RUNNING -> runningTasks.put(id, task);
            case COMPLETED -> completedTasks.put(id, task);
            case FAILED -> failedTasks.put(id, task);
            default -> log.debug("Task left unpartitioned. taskId={}, status={}", id, status);
        }
    }

    public synchronized List<Task> getRunningTasks() {
        return List.copyOf(runningTasks.values());
    }

    public synchronized Optional<Task> findRunningTask(String taskId) {
        return Optional.ofNullable(runningTasks.get(taskId));
    }

    /**
     * Looks the id up in the completed, then the failed partition.
     */
    public synchronized Optional<Task> findFinishedTask(String taskId) {
        Task task = completedTasks.get(taskId);
        if (task == null) {
            task = failedTasks.get(taskId);
        }
        return Optional.ofNullable(task);
    }

    public synchronized Set<String> getCompletedTaskIds() {
        return Set.copyOf(completedTasks.keySet());
    }

    public synchronized SchedulerStats getStats() {
        int pending = (int) taskQueue.stream().filter(task -> task.getStatus() == TaskStatus.PENDING).count();
        return SchedulerStats.builder()
            .pendingTasks(pending)
            .runningTasks(runningTasks.size())
            .completedTasks(completedTasks.size())
            .failedTasks(failedTasks.size())
            .build();
    }
}
