package com.devloop.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body for POST /session/{id}/message and /session/{id}/prompt_async.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromptRequest(
        List<Part> parts,
        Model      model,
        String     agent,
        Boolean    noReply,
        String     system
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Part(String type, String text) {}

    public record Model(
            @JsonProperty("providerID") String providerId,
            @JsonProperty("modelID")    String modelId
    ) {}

    /**
     * Single text part. A model in "provider/model" form is attached; any other
     * shape is ignored and the agent falls back to its configured model.
     */
    public static PromptRequest fromText(String text, String model) {
        Model m = null;
        if (model != null) {
            String[] pieces = model.split("/", 2);
            if (pieces.length == 2) {
                m = new Model(pieces[0], pieces[1]);
            }
        }
        return new PromptRequest(List.of(new Part("text", text)), m, null, null, null);
    }

    public static PromptRequest fromText(String text) {
        return fromText(text, null);
    }
}
