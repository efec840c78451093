package com.devloop.orchestrator.workflow;

/**
 * The agent configuration file could not be written; the agent is not started.
 */
public class AgentConfigException extends RuntimeException {

    public AgentConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
