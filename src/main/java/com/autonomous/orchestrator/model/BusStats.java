package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusStats {
    private long messagesSent;
    private long messagesDelivered;
    private long messagesFailed;
    private int queueSize;
    private int historySize;
    private Map<String, Integer> subscribers;
}
