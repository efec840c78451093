package com.devloop.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response from GET /global/health. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthResponse(boolean healthy, String version) {}
