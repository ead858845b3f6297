package com.autonomous.orchestrator;

/**
 * Raised for registration and configuration errors; task failures never surface as this.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
