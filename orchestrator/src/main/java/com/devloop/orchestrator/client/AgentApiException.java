package com.devloop.orchestrator.client;

/**
 * Thrown when an agent server returns an error status or cannot be reached.
 */
public class AgentApiException extends RuntimeException {

    private final int statusCode;

    public AgentApiException(String message) {
        this(message, -1);
    }

    public AgentApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public AgentApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the request never got a response. */
    public int statusCode() { return statusCode; }
}
