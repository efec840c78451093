package com.devloop.orchestrator.server;

/**
 * Published by {@link AgentServerManager} whenever the set of live servers, or
 * a live server's session, changes. Consumed by the proxy route table and the
 * UI notification hub.
 */
public record AgentServerEvent(Kind kind, String entityId, int port) {

    public enum Kind { STARTED, UPDATED, STOPPED }
}
