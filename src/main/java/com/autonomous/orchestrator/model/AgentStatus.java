package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentStatus {

    IDLE("idle"),
    BUSY("busy"),
    ERROR("error"),
    OFFLINE("offline");

    private final String code;

    AgentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
