package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.AgentSnapshot;
import com.autonomous.orchestrator.model.Message;
import com.autonomous.orchestrator.model.SchedulerStats;
import com.autonomous.orchestrator.model.SystemStatus;
import com.autonomous.orchestrator.service.AgentSystem;
import com.autonomous.orchestrator.service.MessageBus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshots for observability; nothing here feeds back into coordination.
 */
@RestController
@RequestMapping("/system")
public class SystemController {

    @Autowired
    private AgentSystem agentSystem;

    @Autowired
    private MessageBus messageBus;

    @GetMapping("/status")
    public ResponseEntity<SystemStatus> status() {
        return ResponseEntity.ok(agentSystem.getSystemStatus());
    }

    @GetMapping("/agents/{name}")
    public ResponseEntity<AgentSnapshot> agent(@PathVariable String name) {
        return agentSystem.getAgentStatus(name)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/tasks/stats")
    public ResponseEntity<SchedulerStats> taskStats() {
        return ResponseEntity.ok(agentSystem.getTaskStats());
    }

    @GetMapping("/messages/{recipient}")
    public ResponseEntity<List<Message>> messages(@PathVariable String recipient,
                                                  @RequestParam(required = false) Instant since) {
        return ResponseEntity.ok(messageBus.getMessagesFor(recipient, since));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "running", agentSystem.isRunning()
        ));
    }
}
