package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.BusStats;
import com.autonomous.orchestrator.model.Message;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Asynchronous message transport between named participants.
 * <p>
 * Any thread may {@link #send(Message)}; one consumer thread delivers each message to every
 * handler subscribed under its recipient. A throwing handler counts as a failed delivery and
 * does not stop delivery to the others. Delivered messages are kept in a capped history,
 * oldest evicted first.
 * </p>
 */
@Slf4j
@Service
public class MessageBus {

    private final Map<String, List<Consumer<Message>>> subscribers = new ConcurrentHashMap<>();
    private final BlockingQueue<Message> messageQueue = new LinkedBlockingQueue<>();
    private final Deque<Message> history = new ArrayDeque<>();
    private final int historyCapacity;
    private final long pollTimeoutMillis;

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesDelivered = new AtomicLong();
    private final AtomicLong messagesFailed = new AtomicLong();

    private volatile boolean running;
    private ExecutorService deliveryLoop;

    public MessageBus(OrchestratorProperties properties) {
        this.historyCapacity = properties.getBus().getHistoryCapacity();
        this.pollTimeoutMillis = properties.getBus().getPollTimeout().toMillis();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        deliveryLoop = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "message-bus");
            thread.setDaemon(true);
            return thread;
        });
        deliveryLoop.execute(this::processMessages);
        log.info("Message bus started. historyCapacity={}", historyCapacity);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        deliveryLoop.shutdownNow();
        log.info("Message bus stopped. undelivered={}", messageQueue.size());
    }

    public boolean isRunning() {
        return running;
    }

    public void subscribe(String participant, Consumer<Message> handler) {
        subscribers.computeIfAbsent(participant, key -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void unsubscribe(String participant, Consumer<Message> handler) {
        List<Consumer<Message>> handlers = subscribers.get(participant);
        if (handlers != null) {
            handlers.remove(handler);
        }
    }

    public Set<String> getSubscriberNames() {
        return Set.copyOf(subscribers.keySet());
    }

    /**
     * Queues the message for the delivery thread. While the bus is stopped nothing drains the queue,
     * so the message is only kept in history and counted as a failed delivery.
     */
    public void send(Message message) {
        messagesSent.incrementAndGet();
        if (!running) {
            record(message);
            messagesFailed.incrementAndGet();
            log.debug("Bus not running, message not queued. recipient={}, messageId={}",
                message.getRecipient(), message.getId());
            return;
        }
        messageQueue.offer(message);
    }

    /**
     * Messages in history addressed to {@code recipient}, oldest first; when {@code since} is
     * given only those stamped at or after it.
     */
    public List<Message> getMessagesFor(String recipient, Instant since) {
        synchronized (history) {
            return history.stream()
                .filter(message -> recipient.equals(message.getRecipient()))
                .filter(message -> since == null || !message.getTimestamp().isBefore(since))
                .toList();
        }
    }

    public BusStats getStats() {
        Map<String, Integer> subscriberCounts = new LinkedHashMap<>();
        subscribers.forEach((name, handlers) -> subscriberCounts.put(name, handlers.size()));
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return BusStats.builder()
            .messagesSent(messagesSent.get())
            .messagesDelivered(messagesDelivered.get())
            .messagesFailed(messagesFailed.get())
            .queueSize(messageQueue.size())
            .historySize(historySize)
            .subscribers(subscriberCounts)
            .build();
    }

    void deliver(Message message) {
        record(message);

        String recipient = message.getRecipient();
        List<Consumer<Message>> handlers = recipient == null ? null : subscribers.get(recipient);
        if (handlers == null || handlers.isEmpty()) {
            log.warn("No subscribers found. recipient={}, messageId={}", message.getRecipient(), message.getId());
            messagesFailed.incrementAndGet();
            return;
        }
        for (Consumer<Message> handler : handlers) {
            try {
                handler.accept(message);
                messagesDelivered.incrementAndGet();
            } catch (Exception e) {
                log.warn("Delivery failed. recipient={}, messageId={}, error={}",
                    message.getRecipient(), message.getId(), e.getMessage());
                messagesFailed.incrementAndGet();
            }
        }
    }

    private void record(Message message) {
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historyCapacity) {
                history.removeFirst();
            }
        }
    }

    private void processMessages() {
        while (running) {
            try {
                Message message = messageQueue.poll(pollTimeoutMillis, TimeUnit.MILLISECONDS);
                if (message != null) {
                    deliver(message);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.error("Error processing message", e);
                messagesFailed.incrementAndGet();
            }
        }
    }
}
