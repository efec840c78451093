package com.devloop.orchestrator.api.dto;

/**
 * Optional body for the start endpoints.
 *
 * @param model "provider/model"; omit to use the project's or the global default
 */
public record StartAgentRequest(String model) {}
