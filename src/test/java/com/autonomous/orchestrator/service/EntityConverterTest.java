package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Message;
import com.autonomous.orchestrator.model.MessageType;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskPriority;
import com.autonomous.orchestrator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntityConverterTest {

    private final EntityConverter converter = new EntityConverter();

    @Test
    void shouldFlattenTaskWithSnakeCaseKeys() {
        Task task = Task.builder()
            .description("crawl")
            .priority(TaskPriority.HIGH)
            .requiredCapabilities(Set.of("web_search"))
            .timeout(Duration.ofSeconds(30))
            .createdAt(Instant.parse("2026-03-01T12:00:00Z"))
            .build();
        task.start();

        Map<String, Object> fields = converter.toMap(task);

        assertEquals(task.getId(), fields.get("id"));
        assertEquals(3, fields.get("priority"));
        assertEquals("running", fields.get("status"));
        assertEquals("2026-03-01T12:00:00Z", fields.get("created_at"));
        assertEquals(List.of("web_search"), fields.get("required_capabilities"));
        assertEquals(30.0, ((Number) fields.get("timeout")).doubleValue());
        assertTrue(fields.containsKey("started_at"));
        assertFalse(fields.containsKey("expired"));
        assertFalse(fields.containsKey("terminal"));
    }

    @Test
    void shouldBuildTaskFromFields() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("id", "task-7");
        fields.put("description", "aggregate");
        fields.put("priority", 4);
        fields.put("status", "completed");
        fields.put("dependencies", List.of("task-6"));
        fields.put("created_at", "2026-03-01T12:00:00Z");

        Task task = converter.toTask(fields);

        assertEquals("task-7", task.getId());
        assertEquals(TaskPriority.CRITICAL, task.getPriority());
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(List.of("task-6"), task.getDependencies());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), task.getCreatedAt());
    }

    @Test
    void shouldFlattenMessage() {
        Message message = Message.of("alpha", "system", MessageType.TASK_RESPONSE, Map.of("task_id", "t1"));

        Map<String, Object> fields = converter.toMap(message);

        assertEquals("alpha", fields.get("sender"));
        assertEquals("task_response", fields.get("message_type"));
        assertEquals(Map.of("task_id", "t1"), fields.get("content"));
        assertTrue(fields.get("timestamp") instanceof String);
    }

    @Test
    void shouldBuildMessageFromFields() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("id", "m1");
        fields.put("sender", "system");
        fields.put("recipient", "alpha");
        fields.put("message_type", "coordination");
        fields.put("content", "pause");
        fields.put("timestamp", "2026-03-01T12:00:00Z");
        fields.put("reply_to", "m0");

        Message message = converter.toMessage(fields);

        assertEquals("m1", message.getId());
        assertEquals(MessageType.COORDINATION, message.getMessageType());
        assertEquals("pause", message.getContent());
        assertEquals("m0", message.getReplyTo());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), message.getTimestamp());
    }
}
