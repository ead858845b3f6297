package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Point-in-time view of one agent. Never used as a coordination input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSnapshot {
    private String name;
    private AgentStatus status;
    private Set<String> capabilities;
    private int maxConcurrentTasks;
    private int currentTasks;
    private int queuedTasks;
    private int completedTasks;
    private AgentMetrics metrics;
}
