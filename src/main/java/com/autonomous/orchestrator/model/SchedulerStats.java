package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStats {
    private int pendingTasks;
    private int runningTasks;
    private int completedTasks;
    private int failedTasks;
}
