package com.devloop.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A message in an agent session (GET/POST /session/{id}/message).
 * Only the fields the orchestrator reads are mapped; the rest is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentMessage(Info info, List<Part> parts) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Info(
            String id,
            @JsonProperty("sessionID") String sessionId,
            String role
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Part(
            String   type,
            String   text,
            String   tool,
            @JsonProperty("callID") String callId,
            JsonNode state
    ) {}

    /** Concatenated text parts, or an empty string. */
    public String text() {
        if (parts == null) return "";
        StringBuilder sb = new StringBuilder();
        for (Part p : parts) {
            if ("text".equals(p.type()) && p.text() != null) {
                if (!sb.isEmpty()) sb.append('\n');
                sb.append(p.text());
            }
        }
        return sb.toString();
    }
}
