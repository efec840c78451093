package com.devloop.orchestrator.api.dto;

public record AbortResponse(String entityId, boolean aborted) {}
