package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A schedulable unit of work.
 * <p>
 * Status moves only through {@link #start()}, {@link #complete(Object)}, {@link #fail(String)}
 * and {@link #cancel()}. Terminal writes are compare-and-set: the first one wins and later
 * ones return {@code false}, which is how a timeout and a late agent result are reconciled.
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Task {

    @EqualsAndHashCode.Include
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String description;

    @Builder.Default
    private Set<String> requiredCapabilities = new LinkedHashSet<>();

    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    /** Measured from {@link #startedAt}; null or zero means no timeout. */
    private Duration timeout;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    @Builder.Default
    private volatile TaskStatus status = TaskStatus.PENDING;

    private volatile String assignedAgent;

    @Builder.Default
    private Instant createdAt = Instant.now();

    private volatile Instant startedAt;

    private volatile Instant completedAt;

    private volatile Object result;

    private volatile String error;

    /**
     * True when every dependency id is in {@code completedTaskIds}.
     */
    public boolean canStart(Set<String> completedTaskIds) {
        if (dependencies == null || dependencies.isEmpty()) {
            return true;
        }
        return completedTaskIds.containsAll(dependencies);
    }

    /**
     * True when {@code available} holds every required capability; a null requirement set requires nothing.
     */
    public boolean canRunWith(Set<String> available) {
        Set<String> required = requiredCapabilities;
        if (required == null || required.isEmpty()) {
            return true;
        }
        return available != null && available.containsAll(required);
    }

    @JsonIgnore
    public boolean isExpired() {
        return isExpired(Instant.now());
    }

    public boolean isExpired(Instant now) {
        Duration limit = timeout;
        Instant begin = startedAt;
        if (limit == null || limit.isZero() || limit.isNegative() || begin == null) {
            return false;
        }
        return Duration.between(begin, now).compareTo(limit) > 0;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public synchronized void start() {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("Task must be in PENDING status to start, was " + status);
        }
        this.status = TaskStatus.RUNNING;
        this.startedAt = Instant.now();
    }

    public synchronized boolean complete(Object result) {
        if (status != TaskStatus.RUNNING) {
            return false;
        }
        this.result = result;
        this.status = TaskStatus.COMPLETED;
        this.completedAt = Instant.now();
        return true;
    }

    public synchronized boolean fail(String error) {
        if (status != TaskStatus.RUNNING) {
            return false;
        }
        this.error = error;
        this.status = TaskStatus.FAILED;
        this.completedAt = Instant.now();
        return true;
    }

    public synchronized boolean cancel() {
        if (status != TaskStatus.PENDING && status != TaskStatus.RUNNING) {
            return false;
        }
        this.status = TaskStatus.CANCELLED;
        this.completedAt = Instant.now();
        return true;
    }
}
