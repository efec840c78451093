package com.devloop.orchestrator.workflow;

import com.devloop.orchestrator.server.AgentServer;

import java.time.Instant;

/**
 * UI-facing view of a live agent server.
 *
 * @param baseUrl    externally reachable base URL
 * @param webViewUrl agent web UI for the active session, null without one
 */
public record RunningServerInfo(
        String  entityId,
        int     port,
        String  baseUrl,
        String  worktreePath,
        Instant startedAt,
        String  activeSessionId,
        String  webViewUrl
) {

    public static RunningServerInfo of(AgentServer server, AgentUrlService urls) {
        return new RunningServerInfo(
                server.getEntityId(),
                server.getPort(),
                urls.externalBaseUrl(server.getPort()),
                server.getWorktreePath(),
                server.getStartedAt(),
                server.getActiveSessionId(),
                urls.webViewUrl(server.getPort(), server.getWorktreePath(), server.getActiveSessionId()));
    }
}
