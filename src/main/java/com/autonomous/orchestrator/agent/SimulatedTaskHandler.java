package com.autonomous.orchestrator.agent;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.Task;
import org.springframework.stereotype.Component;

/**
 * Default handler: waits the configured work delay and reports which agent ran the task.
 */
@Component("simulated")
public class SimulatedTaskHandler implements TaskHandler {

    private final OrchestratorProperties properties;

    public SimulatedTaskHandler(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public Object execute(Task task) throws Exception {
        Thread.sleep(properties.getAgents().getSimulatedWorkDelay().toMillis());
        return String.format("Task '%s' completed by %s", task.getDescription(), task.getAssignedAgent());
    }
}
