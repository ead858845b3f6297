package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.OrchestratorException;
import com.autonomous.orchestrator.agent.Agent;
import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AgentSnapshot;
import com.autonomous.orchestrator.model.AgentStatus;
import com.autonomous.orchestrator.model.Message;
import com.autonomous.orchestrator.model.MessageType;
import com.autonomous.orchestrator.model.SchedulerStats;
import com.autonomous.orchestrator.model.SystemStatus;
import com.autonomous.orchestrator.model.Task;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns the agent registry, the scheduler and the bus, and runs the coordination loop.
 * <p>
 * Each tick first hands at most one eligible task to every agent that was IDLE when the tick
 * began, in registration order, then fails running tasks whose timeout has elapsed. Agents report
 * back through {@link #handleAgentMessage(Message)}; the same notifications arriving over the bus
 * under {@link OrchestratorProperties#getSystemName()} are applied idempotently.
 * </p>
 */
@Slf4j
@Service
public class AgentSystem {

    public static final String TIMEOUT_ERROR = "Task timeout exceeded";

    private final TaskScheduler taskScheduler;
    private final MessageBus messageBus;
    private final MessageRouter messageRouter;
    private final OrchestratorProperties properties;

    private final Map<String, Agent> agents = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Consumer<Message>> agentSubscriptions = new ConcurrentHashMap<>();

    private volatile boolean running;
    private ScheduledExecutorService coordinator;

    public AgentSystem(TaskScheduler taskScheduler, MessageBus messageBus, MessageRouter messageRouter,
                       OrchestratorProperties properties) {
        this.taskScheduler = taskScheduler;
        this.messageBus = messageBus;
        this.messageRouter = messageRouter;
        this.properties = properties;
        messageBus.subscribe(properties.getSystemName(), this::applyNotification);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        messageBus.start();
        for (Agent agent : snapshotAgents()) {
            agent.start();
        }

        long intervalMillis = properties.getCoordinationInterval().toMillis();
        coordinator = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agent-coordinator");
            thread.setDaemon(true);
            return thread;
        });
        coordinator.scheduleWithFixedDelay(this::coordinationTick, 0, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Agent system started. agents={}, coordinationInterval={}", agents.size(), properties.getCoordinationInterval());
    }

    /**
     * Flips the run flag; in-flight executions finish on their own.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        coordinator.shutdown();
        for (Agent agent : snapshotAgents()) {
            agent.stop();
        }
        messageBus.stop();
        log.info("Agent system stopped. tasks={}", taskScheduler.getStats());
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void registerAgent(Agent agent) {
        String name = agent.getName();
        synchronized (agents) {
            if (agents.containsKey(name)) {
                throw new OrchestratorException("Agent already registered: " + name);
            }
            agents.put(name, agent);
        }
        agent.setNotificationTarget(properties.getSystemName(), this::handleAgentMessage);
        Consumer<Message> inbox = agent::onMessage;
        agentSubscriptions.put(name, inbox);
        messageBus.subscribe(name, inbox);
        if (running) {
            agent.start();
        }
        log.info("Agent registered. name={}, capabilities={}", name, agent.getCapabilityNames());
    }

    public synchronized boolean unregisterAgent(String name) {
        Agent agent = agents.remove(name);
        if (agent == null) {
            return false;
        }
        agent.stop();
        Consumer<Message> inbox = agentSubscriptions.remove(name);
        if (inbox != null) {
            messageBus.unsubscribe(name, inbox);
        }
        log.info("Agent unregistered. name={}", name);
        return true;
    }

    public Optional<Agent> getAgent(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public String submitTask(Task task) {
        taskScheduler.addTask(task);
        return task.getId();
    }

    /**
     * Polls the completed and failed partitions until the task shows up or {@code budget} runs out.
     *
     * @return the finished task, or empty when its outcome is still unknown
     */
    public Optional<Task> awaitTaskResult(String taskId, Duration budget) {
        long deadline = System.nanoTime() + budget.toNanos();
        long pollMillis = properties.getResultPollInterval().toMillis();
        while (true) {
            Optional<Task> finished = taskScheduler.findFinishedTask(taskId);
            if (finished.isPresent() || System.nanoTime() >= deadline) {
                return finished;
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    public void handleAgentMessage(Message message) {
        applyNotification(message);
        messageRouter.route(message);
    }

    public List<String> findAgentsByCapability(String capability) {
        return snapshotAgents().stream()
            .filter(agent -> agent.hasCapability(capability))
            .map(Agent::getName)
            .toList();
    }

    public void broadcastMessage(String sender, MessageType type, Object content) {
        for (Agent agent : snapshotAgents()) {
            if (!agent.getName().equals(sender)) {
                messageBus.send(Message.of(sender, agent.getName(), type, content));
            }
        }
    }

    public SystemStatus getSystemStatus() {
        Map<String, AgentSnapshot> agentStats = new LinkedHashMap<>();
        for (Agent agent : snapshotAgents()) {
            agentStats.put(agent.getName(), agent.snapshot());
        }
        return SystemStatus.builder()
            .running(running)
            .agents(agentStats)
            .tasks(taskScheduler.getStats())
            .messageBus(messageBus.getStats())
            .build();
    }

    public Optional<AgentSnapshot> getAgentStatus(String name) {
        return getAgent(name).map(Agent::snapshot);
    }

    public SchedulerStats getTaskStats() {
        return taskScheduler.getStats();
    }

    void coordinationTick() {
        if (!running) {
            return;
        }
        try {
            assignPendingTasks();
            checkTaskTimeouts();
        } catch (Exception e) {
            log.error("Error in coordination loop", e);
        }
    }

    void assignPendingTasks() {
        List<Agent> available = snapshotAgents().stream()
            .filter(agent -> agent.getStatus() == AgentStatus.IDLE)
            .toList();

        for (Agent agent : available) {
            Optional<Task> next = taskScheduler.nextTask(agent.getCapabilityNames());
            if (next.isEmpty()) {
                continue;
            }
            Task task = next.get();
            task.setAssignedAgent(agent.getName());
            if (agent.assignTask(task)) {
                taskScheduler.updateTaskStatus(task);
                log.debug("Task assigned. taskId={}, agent={}", task.getId(), agent.getName());
            } else {
                task.setAssignedAgent(null);
                taskScheduler.addTask(task);
                log.debug("Assignment refused, task returned to queue. taskId={}, agent={}", task.getId(), agent.getName());
            }
        }
    }

    void checkTaskTimeouts() {
        Instant now = Instant.now();
        for (Task task : taskScheduler.getRunningTasks()) {
            if (!task.isExpired(now)) {
                continue;
            }
            if (task.fail(TIMEOUT_ERROR)) {
                log.warn("Task timed out. taskId={}, agent={}, timeout={}", task.getId(), task.getAssignedAgent(), task.getTimeout());
            }
            taskScheduler.updateTaskStatus(task);
        }
    }

    void applyNotification(Message message) {
        if (!(message.getContent() instanceof Map<?, ?> content) || content.get("task_id") == null) {
            return;
        }
        String taskId = String.valueOf(content.get("task_id"));
        if (message.getMessageType() == MessageType.TASK_RESPONSE) {
            taskScheduler.findRunningTask(taskId).ifPresent(task -> {
                if (Boolean.TRUE.equals(content.get("success"))) {
                    task.complete(content.get("result"));
                } else {
                    Object error = content.get("error");
                    task.fail(error != null ? String.valueOf(error) : "Task failed");
                }
                taskScheduler.updateTaskStatus(task);
            });
        } else if (message.getMessageType() == MessageType.STATUS_UPDATE) {
            getAgent(message.getSender())
                .flatMap(agent -> agent.getCurrentTask(taskId))
                .ifPresent(taskScheduler::updateTaskStatus);
        }
    }

    private List<Agent> snapshotAgents() {
        synchronized (agents) {
            return new ArrayList<>(agents.values());
        }
    }
}
