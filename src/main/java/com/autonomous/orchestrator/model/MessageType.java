package com.autonomous.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {

    TASK_REQUEST("task_request"),
    TASK_RESPONSE("task_response"),
    STATUS_UPDATE("status_update"),
    COORDINATION("coordination"),
    ERROR("error"),
    INFO("info");

    private final String code;

    MessageType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static MessageType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MessageType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type code: " + code);
    }
}
