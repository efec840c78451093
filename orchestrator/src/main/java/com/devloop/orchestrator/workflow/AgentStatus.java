package com.devloop.orchestrator.workflow;

import com.devloop.orchestrator.client.dto.AgentSession;

import java.util.List;

/**
 * Status of one work item's agent as returned by start and status calls.
 *
 * @param activeSession session prompts are sent to; null if none could be found
 * @param sessions      every session the agent knows about
 */
public record AgentStatus(
        String            entityId,
        RunningServerInfo server,
        AgentSession      activeSession,
        List<AgentSession> sessions
) {}
