package com.autonomous.orchestrator.config;

import com.autonomous.orchestrator.OrchestratorException;
import com.autonomous.orchestrator.agent.Agent;
import com.autonomous.orchestrator.agent.TaskHandler;
import com.autonomous.orchestrator.model.AgentProfile;
import com.autonomous.orchestrator.service.AgentProfileService;
import com.autonomous.orchestrator.service.AgentSystem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Registers an agent for every loaded profile and starts the system when auto-start is on.
 */
@Slf4j
@Component
public class AgentBootstrapRunner implements ApplicationRunner {

    private final AgentSystem agentSystem;
    private final AgentProfileService profileService;
    private final Map<String, TaskHandler> taskHandlers;
    private final OrchestratorProperties properties;

    public AgentBootstrapRunner(AgentSystem agentSystem,
                                AgentProfileService profileService,
                                Map<String, TaskHandler> taskHandlers,
                                OrchestratorProperties properties) {
        this.agentSystem = agentSystem;
        this.profileService = profileService;
        this.taskHandlers = taskHandlers;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (AgentProfile profile : profileService.getAllProfiles()) {
            agentSystem.registerAgent(createAgent(profile));
        }
        if (!properties.isAutoStart()) {
            log.info("Skip agent system start because orchestrator.auto-start=false");
            return;
        }
        agentSystem.start();
    }

    Agent createAgent(AgentProfile profile) {
        TaskHandler handler = taskHandlers.get(profile.getHandler());
        if (handler == null) {
            throw new OrchestratorException("Unknown task handler '" + profile.getHandler()
                + "' for agent " + profile.getName() + ", known: " + taskHandlers.keySet());
        }
        OrchestratorProperties.Agents settings = properties.getAgents();
        return new Agent(profile.getName(), profile.getCapabilities(), profile.getMaxConcurrentTasks(), handler,
            settings.getPollInterval(), settings.getIdleInterval());
    }
}
