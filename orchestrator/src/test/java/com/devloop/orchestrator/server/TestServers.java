package com.devloop.orchestrator.server;

/**
 * Builds {@link AgentServer} records in a given lifecycle state for tests outside this package.
 */
public final class TestServers {

    private TestServers() {}

    public static AgentServer running(String entityId, String worktreePath, int port, String sessionId) {
        AgentServer server = new AgentServer(entityId, worktreePath, port, false);
        server.markRunning();
        server.setActiveSessionId(sessionId);
        return server;
    }

    public static AgentServer starting(String entityId, String worktreePath, int port) {
        return new AgentServer(entityId, worktreePath, port, false);
    }
}
