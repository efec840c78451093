package com.devloop.orchestrator.completion;

import com.devloop.orchestrator.client.dto.AgentEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes agent events that mean "the agent just ran {@code gh pr create}".
 *
 * Two shapes are understood:
 * <ul>
 *   <li>{@code tool.complete} with {@code toolName=bash} and the command text in {@code content}</li>
 *   <li>{@code message.part.updated} carrying a completed {@code bash} tool part whose
 *       {@code state.input.command} runs {@code gh pr create}; output is in {@code state.output}</li>
 * </ul>
 */
public final class PrCreationDetector {

    static final String PR_CREATE_COMMAND = "gh pr create";

    private PrCreationDetector() {}

    /** Command output to scan for a PR URL, or empty if the event is not a PR creation. */
    public static Optional<String> detect(AgentEvent event) {
        if (event == null || event.properties() == null || event.type() == null) {
            return Optional.empty();
        }
        AgentEvent.Properties props = event.properties();

        if (AgentEvent.TOOL_COMPLETE.equals(event.type())) {
            if ("bash".equalsIgnoreCase(props.toolName()) && containsPrCreate(props.content())) {
                return Optional.of(props.content());
            }
            return Optional.empty();
        }

        if (AgentEvent.PART_UPDATED.equals(event.type())) {
            JsonNode part = props.part();
            if (part == null || !"tool".equals(part.path("type").asText())
                    || !"bash".equalsIgnoreCase(part.path("tool").asText())) {
                return Optional.empty();
            }
            JsonNode state = part.path("state");
            if (!"completed".equals(state.path("status").asText())) {
                return Optional.empty();
            }
            String command = state.path("input").path("command").asText("");
            if (!containsPrCreate(command)) {
                return Optional.empty();
            }
            return Optional.of(state.path("output").asText(""));
        }

        return Optional.empty();
    }

    private static boolean containsPrCreate(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(PR_CREATE_COMMAND);
    }
}
