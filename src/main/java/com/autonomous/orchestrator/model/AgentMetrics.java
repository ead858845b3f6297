package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMetrics {
    private int tasksCompleted;
    private int tasksFailed;
    private Duration totalExecutionTime;
    private Instant lastActivity;
}
