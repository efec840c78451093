package com.devloop.orchestrator.server;

/**
 * Thrown when an agent server cannot be brought up: the working directory is
 * missing, the process cannot be spawned, it exits before becoming healthy, or
 * the health check times out. All partial allocation has been undone by the
 * time this reaches the caller.
 */
public class AgentStartupException extends RuntimeException {

    private final String entityId;

    public AgentStartupException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public AgentStartupException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String entityId() { return entityId; }
}
