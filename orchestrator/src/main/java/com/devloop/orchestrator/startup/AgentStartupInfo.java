package com.devloop.orchestrator.startup;

import java.time.Instant;

/**
 * Startup progress of one work item's agent, as shown in the UI.
 *
 * @param errorMessage set only when {@code state} is FAILED
 */
public record AgentStartupInfo(String entityId, AgentStartupState state, String errorMessage, Instant timestamp) {

    public AgentStartupInfo(String entityId, AgentStartupState state) {
        this(entityId, state, null, Instant.now());
    }

    public AgentStartupInfo(String entityId, AgentStartupState state, String errorMessage) {
        this(entityId, state, errorMessage, Instant.now());
    }
}
