package com.devloop.orchestrator.server;

/**
 * Lifecycle of an agent server process.
 *
 *   STARTING → RUNNING → STOPPED
 *   STARTING → FAILED
 */
public enum AgentServerStatus {
    STARTING,
    RUNNING,
    FAILED,
    STOPPED
}
