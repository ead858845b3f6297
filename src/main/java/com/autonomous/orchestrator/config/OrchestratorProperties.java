package com.autonomous.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Orchestrator settings, prefix {@code orchestrator}.
 */
@Data
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    /** Bus participant name of the agent system; agents address task notifications to it. */
    private String systemName = "system";

    /** Delay between coordination ticks; also the timeout check granularity. */
    private Duration coordinationInterval = Duration.ofSeconds(1);

    /** How often result waiters poll the scheduler. */
    private Duration resultPollInterval = Duration.ofMillis(100);

    /** Start the system once profile agents are registered. */
    private boolean autoStart = true;

    private Agents agents = new Agents();

    private Bus bus = new Bus();

    @Data
    public static class Agents {

        /** Directory of agent profile YAML files. */
        private String profilePath = "config/agents";

        /** Bounded wait on the intake queue. */
        private Duration pollInterval = Duration.ofMillis(100);

        /** Pause between intake loop iterations. */
        private Duration idleInterval = Duration.ofMillis(10);

        /** Work time of the simulated handler. */
        private Duration simulatedWorkDelay = Duration.ofMillis(100);
    }

    @Data
    public static class Bus {

        private int historyCapacity = 1000;

        /** Bounded wait of the delivery loop on the inbound queue. */
        private Duration pollTimeout = Duration.ofMillis(100);
    }
}
