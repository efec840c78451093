package com.devloop.orchestrator.workflow;

/**
 * @param localPath     main checkout of the repository
 * @param defaultBranch branch new work is based on
 * @param defaultModel  "provider/model" for agents in this project; null to use the global default
 */
public record ProjectInfo(String id, String name, String localPath, String defaultBranch, String defaultModel) {}
