package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Message;
import com.autonomous.orchestrator.model.MessageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Rewrites recipients by rule before handing messages to the bus.
 */
@Slf4j
@Service
public class MessageRouter {

    private final MessageBus messageBus;
    private final List<Function<Message, Optional<String>>> routingRules = new CopyOnWriteArrayList<>();

    public MessageRouter(MessageBus messageBus) {
        this.messageBus = messageBus;
    }

    /**
     * Rules are tried in registration order; the first one that yields a target wins.
     */
    public void addRoutingRule(Function<Message, Optional<String>> rule) {
        routingRules.add(rule);
    }

    public void route(Message message) {
        for (Function<Message, Optional<String>> rule : routingRules) {
            try {
                Optional<String> target = rule.apply(message);
                if (target.isPresent()) {
                    messageBus.send(message.toBuilder().recipient(target.get()).build());
                    return;
                }
            } catch (RuntimeException e) {
                log.warn("Routing rule failed. messageId={}, error={}", message.getId(), e.getMessage());
            }
        }
        messageBus.send(message);
    }

    /**
     * Sends a copy to every bus subscriber other than the sender and {@code exclude}.
     *
     * @return number of messages sent
     */
    public int broadcast(String sender, MessageType type, Object content, Set<String> exclude) {
        Set<String> skipped = exclude != null ? exclude : Set.of();
        int sent = 0;
        for (String participant : messageBus.getSubscriberNames()) {
            if (participant.equals(sender) || skipped.contains(participant)) {
                continue;
            }
            messageBus.send(Message.of(sender, participant, type, content));
            sent++;
        }
        return sent;
    }
}
