package com.devloop.orchestrator.startup;

public enum AgentStartupState {
    NOT_STARTED,
    STARTING,
    STARTED,
    FAILED
}
