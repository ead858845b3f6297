package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatus {
    private boolean running;
    private Map<String, AgentSnapshot> agents;
    private SchedulerStats tasks;
    private BusStats messageBus;
}
