package com.autonomous.orchestrator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Agent definition loaded from a YAML profile.
 */
@Data
public class AgentProfile {
    private String name;
    private String description;
    private List<String> capabilities = new ArrayList<>();

    // Resource limits
    private int maxConcurrentTasks = 1;

    // Bean name of the TaskHandler that performs the work
    private String handler = "simulated";
}
