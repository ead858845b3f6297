package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Message;
import com.autonomous.orchestrator.model.Task;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flat field-keyed form of tasks and messages for persistence, transport and display.
 * <p>
 * Keys are snake_case; priorities are written as 1..4, statuses and message types as lowercase
 * codes, instants as ISO-8601 text and the task timeout as seconds.
 * </p>
 */
@Component
public class EntityConverter {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public EntityConverter() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public Map<String, Object> toMap(Task task) {
        return mapper.convertValue(task, MAP_TYPE);
    }

    public Task toTask(Map<String, ?> fields) {
        return mapper.convertValue(fields, Task.class);
    }

    public Map<String, Object> toMap(Message message) {
        return mapper.convertValue(message, MAP_TYPE);
    }

    public Message toMessage(Map<String, ?> fields) {
        return mapper.convertValue(fields, Message.class);
    }
}
