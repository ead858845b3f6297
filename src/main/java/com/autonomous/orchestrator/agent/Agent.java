package com.autonomous.orchestrator.agent;

import com.autonomous.orchestrator.OrchestratorException;
import com.autonomous.orchestrator.model.AgentMetrics;
import com.autonomous.orchestrator.model.AgentSnapshot;
import com.autonomous.orchestrator.model.AgentStatus;
import com.autonomous.orchestrator.model.Message;
import com.autonomous.orchestrator.model.MessageType;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Execution unit with a fixed capability set and a concurrency cap.
 * <p>
 * Tasks handed to {@link #assignTask(Task)} start at once while a slot is free and wait in the
 * intake queue otherwise. A single intake thread polls that queue and starts queued tasks as
 * slots free up; executions run on a worker pool sized to the cap.
 * </p>
 * <p>
 * Notifications go to the handler set with {@link #setNotificationTarget(String, Consumer)}:
 * STATUS_UPDATE {@code {task_id, status}} when a task starts and TASK_RESPONSE
 * {@code {task_id, success, result|error}} when it ends.
 * </p>
 */
@Slf4j
public class Agent {

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    private static final Duration DEFAULT_IDLE_INTERVAL = Duration.ofMillis(10);

    @Getter
    private final String name;

    @Getter
    private final int maxConcurrentTasks;

    private final Set<String> capabilities = ConcurrentHashMap.newKeySet();
    private final TaskHandler taskHandler;
    private final Duration pollInterval;
    private final Duration idleInterval;

    private final Map<String, Task> currentTasks = new ConcurrentHashMap<>();
    private final BlockingDeque<Task> taskQueue = new LinkedBlockingDeque<>();
    private final List<Task> completedTasks = Collections.synchronizedList(new ArrayList<>());
    private final Object slotLock = new Object();

    private final AtomicInteger tasksCompleted = new AtomicInteger();
    private final AtomicInteger tasksFailed = new AtomicInteger();
    private final AtomicLong totalExecutionNanos = new AtomicLong();
    private volatile Instant lastActivity;

    @Getter
    private volatile AgentStatus status = AgentStatus.IDLE;

    @Getter
    private volatile boolean running;

    private volatile String notificationRecipient;
    private volatile Consumer<Message> messageHandler;
    private volatile Consumer<Message> inboundListener;

    private ExecutorService workers;
    private ExecutorService intakeLoop;
    private AtomicBoolean intakeActive;

    public Agent(String name, Collection<String> capabilities, int maxConcurrentTasks, TaskHandler taskHandler) {
        this(name, capabilities, maxConcurrentTasks, taskHandler, DEFAULT_POLL_INTERVAL, DEFAULT_IDLE_INTERVAL);
    }

    public Agent(String name, Collection<String> capabilities, int maxConcurrentTasks, TaskHandler taskHandler,
                 Duration pollInterval, Duration idleInterval) {
        if (name == null || name.isBlank()) {
            throw new OrchestratorException("Agent name must not be blank");
        }
        if (maxConcurrentTasks < 1) {
            throw new OrchestratorException("Agent " + name + " needs at least one concurrent task slot, got "
                + maxConcurrentTasks);
        }
        this.name = name;
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.taskHandler = Objects.requireNonNull(taskHandler, "taskHandler");
        this.pollInterval = pollInterval;
        this.idleInterval = idleInterval;
        if (capabilities != null) {
            capabilities.forEach(this::addCapability);
        }
    }

    public void addCapability(String capability) {
        capabilities.add(capability);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public Set<String> getCapabilityNames() {
        return Set.copyOf(capabilities);
    }

    public void setNotificationTarget(String recipient, Consumer<Message> handler) {
        this.notificationRecipient = recipient;
        this.messageHandler = handler;
    }

    public void setInboundListener(Consumer<Message> listener) {
        this.inboundListener = listener;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        workers = Executors.newFixedThreadPool(maxConcurrentTasks, namedThreads(name + "-worker-"));
        intakeLoop = Executors.newSingleThreadExecutor(namedThreads(name + "-intake-"));
        synchronized (slotLock) {
            running = true;
            status = currentTasks.isEmpty() ? AgentStatus.IDLE : AgentStatus.BUSY;
        }
        AtomicBoolean active = new AtomicBoolean(true);
        intakeActive = active;
        intakeLoop.execute(() -> processTasks(active));
        log.info("Agent started. name={}, capabilities={}, maxConcurrentTasks={}", name, capabilities, maxConcurrentTasks);
    }

    /**
     * Stops taking new work. Executions already in flight run to completion; queued tasks stay queued.
     */
    public synchronized void stop() {
        synchronized (slotLock) {
            running = false;
            status = AgentStatus.OFFLINE;
        }
        if (intakeLoop != null) {
            intakeActive.set(false);
            intakeLoop.shutdownNow();
            workers.shutdown();
        }
        log.info("Agent stopped. name={}, inFlight={}, queued={}", name, currentTasks.size(), taskQueue.size());
    }

    public boolean canAccept(Task task) {
        if (status == AgentStatus.OFFLINE) {
            return false;
        }
        return task.canRunWith(capabilities);
    }

    /**
     * Accepts a task: starts it now if a slot is free, otherwise queues it (it stays PENDING).
     *
     * @return false when the agent is offline or lacks a required capability
     */
    public boolean assignTask(Task task) {
        if (!canAccept(task)) {
            log.debug("Task refused. agent={}, taskId={}, required={}, status={}",
                name, task.getId(), task.getRequiredCapabilities(), status);
            return false;
        }
        if (!tryStart(task)) {
            taskQueue.offer(task);
            log.debug("Task queued. agent={}, taskId={}, queued={}", name, task.getId(), taskQueue.size());
        }
        return true;
    }

    public Optional<Task> getCurrentTask(String taskId) {
        return Optional.ofNullable(currentTasks.get(taskId));
    }

    public int getCurrentTaskCount() {
        return currentTasks.size();
    }

    public int getQueuedTaskCount() {
        return taskQueue.size();
    }

    public List<Task> getCompletedTasks() {
        synchronized (completedTasks) {
            return List.copyOf(completedTasks);
        }
    }

    public AgentMetrics getMetrics() {
        return AgentMetrics.builder()
            .tasksCompleted(tasksCompleted.get())
            .tasksFailed(tasksFailed.get())
            .totalExecutionTime(Duration.ofNanos(totalExecutionNanos.get()))
            .lastActivity(lastActivity)
            .build();
    }

    public AgentSnapshot snapshot() {
        return AgentSnapshot.builder()
            .name(name)
            .status(status)
            .capabilities(getCapabilityNames())
            .maxConcurrentTasks(maxConcurrentTasks)
            .currentTasks(currentTasks.size())
            .queuedTasks(taskQueue.size())
            .completedTasks(completedTasks.size())
            .metrics(getMetrics())
            .build();
    }

    public void sendMessage(String recipient, MessageType type, Object content) {
        Consumer<Message> handler = messageHandler;
        if (handler == null) {
            return;
        }
        try {
            handler.accept(Message.of(name, recipient, type, content));
        } catch (RuntimeException e) {
            log.warn("Message handler failed. agent={}, recipient={}, type={}, error={}",
                name, recipient, type, e.getMessage());
        }
    }

    /**
     * Receives bus messages addressed to this agent.
     */
    public void onMessage(Message message) {
        lastActivity = Instant.now();
        log.debug("Message received. agent={}, from={}, type={}", name, message.getSender(), message.getMessageType());
        Consumer<Message> listener = inboundListener;
        if (listener != null) {
            listener.accept(message);
        }
    }

    private boolean tryStart(Task task) {
        synchronized (slotLock) {
            if (!running || currentTasks.size() >= maxConcurrentTasks) {
                return false;
            }
            task.start();
            if (task.getAssignedAgent() == null) {
                task.setAssignedAgent(name);
            }
            currentTasks.put(task.getId(), task);
            lastActivity = Instant.now();
            if (status != AgentStatus.ERROR) {
                status = AgentStatus.BUSY;
            }
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("task_id", task.getId());
            content.put("status", TaskStatus.RUNNING.getCode());
            sendMessage(notificationRecipient, MessageType.STATUS_UPDATE, content);
            workers.execute(() -> execute(task));
        }
        log.debug("Task started. agent={}, taskId={}, load={}/{}", name, task.getId(), currentTasks.size(), maxConcurrentTasks);
        return true;
    }

    private void execute(Task task) {
        long begin = System.nanoTime();
        try {
            Object result = taskHandler.execute(task);
            if (task.complete(result)) {
                tasksCompleted.incrementAndGet();
                completedTasks.add(task);
                log.debug("Task completed. agent={}, taskId={}", name, task.getId());
            } else {
                log.warn("Discarding result, task already {}. agent={}, taskId={}", task.getStatus(), name, task.getId());
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            recordFailure(task, e);
        } catch (Error e) {
            recordFailure(task, e);
            throw e;
        } finally {
            totalExecutionNanos.addAndGet(System.nanoTime() - begin);
            lastActivity = Instant.now();
            synchronized (slotLock) {
                currentTasks.remove(task.getId());
                if (currentTasks.isEmpty() && running) {
                    status = AgentStatus.IDLE;
                }
            }
            notifyTaskResult(task);
        }
    }

    private void recordFailure(Task task, Throwable cause) {
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        if (task.fail(error)) {
            tasksFailed.incrementAndGet();
            synchronized (slotLock) {
                if (running) {
                    status = AgentStatus.ERROR;
                }
            }
            log.warn("Task failed. agent={}, taskId={}, error={}", name, task.getId(), error);
        } else {
            log.warn("Discarding failure, task already {}. agent={}, taskId={}, error={}",
                task.getStatus(), name, task.getId(), error);
        }
    }

    private void notifyTaskResult(Task task) {
        boolean success = task.getStatus() == TaskStatus.COMPLETED;
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("task_id", task.getId());
        content.put("success", success);
        if (success) {
            content.put("result", task.getResult());
        } else {
            content.put("error", task.getError());
        }
        sendMessage(notificationRecipient, MessageType.TASK_RESPONSE, content);
    }

    /**
     * Runs until {@code active} is cleared. Every start hands in a fresh flag.
     */
    private void processTasks(AtomicBoolean active) {
        while (active.get()) {
            try {
                if (currentTasks.size() < maxConcurrentTasks) {
                    Task task = taskQueue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                    if (task != null) {
                        if (task.getStatus() != TaskStatus.PENDING) {
                            log.warn("Dropping queued task no longer pending. agent={}, taskId={}, status={}",
                                name, task.getId(), task.getStatus());
                        } else if (!tryStart(task)) {
                            taskQueue.offerFirst(task);
                        }
                    }
                }
                Thread.sleep(idleInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Intake loop interrupted. agent={}", name);
                return;
            } catch (Exception e) {
                log.error("Error in intake loop. agent={}", name, e);
                status = AgentStatus.ERROR;
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
