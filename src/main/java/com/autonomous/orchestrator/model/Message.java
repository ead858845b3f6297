package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String sender;

    private String recipient;

    private MessageType messageType;

    private Object content;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String replyTo;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static Message of(String sender, String recipient, MessageType messageType, Object content) {
        return Message.builder()
            .sender(sender)
            .recipient(recipient)
            .messageType(messageType)
            .content(content)
            .build();
    }
}
