package com.devloop.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One frame from the agent's GET /event stream.
 *
 * {@code properties} is loosely typed on the wire; the fields below cover the
 * event kinds the orchestrator reacts to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentEvent(String type, Properties properties) {

    public static final String SERVER_CONNECTED  = "server.connected";
    public static final String SESSION_UPDATED   = "session.updated";
    public static final String SESSION_STATUS    = "session.status";
    public static final String MESSAGE_UPDATED   = "message.updated";
    public static final String PART_UPDATED      = "message.part.updated";
    public static final String TOOL_START        = "tool.start";
    public static final String TOOL_COMPLETE     = "tool.complete";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Properties(
            @JsonProperty("sessionID") String sessionId,
            @JsonProperty("messageID") String messageId,
            @JsonProperty("partID")    String partId,
            JsonNode status,
            String   content,
            String   toolName,
            String   error,
            JsonNode part
    ) {

        /** Status as a string; the agent sends either {@code "idle"} or {@code {"type":"idle"}}. */
        public String statusValue() {
            if (status == null || status.isNull()) return null;
            if (status.isTextual()) return status.asText();
            if (status.isObject() && status.hasNonNull("type")) return status.get("type").asText();
            return null;
        }
    }
}
