package com.devloop.orchestrator.api.dto;

/** Body for POST /agents/{entityId}/prompt. */
public record PromptRequestBody(String text) {}
