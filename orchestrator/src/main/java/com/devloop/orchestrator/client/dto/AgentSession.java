package com.devloop.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A conversation session on an agent server (GET /session, POST /session).
 * Timestamps are epoch milliseconds as reported by the agent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSession(
        String id,
        String title,
        @JsonProperty("parentID") String parentId,
        Time   time
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Time(Long created, Long updated) {}

    /** Most recent activity timestamp; 0 when the agent reported none. */
    public long lastActivity() {
        if (time == null) return 0L;
        if (time.updated() != null) return time.updated();
        return time.created() != null ? time.created() : 0L;
    }
}
