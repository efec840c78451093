package com.devloop.orchestrator.workflow;

/**
 * Builds the first message an agent receives for a planned change.
 */
public interface InitialPromptFactory {

    String buildInitialPrompt(PlannedChange change, ProjectInfo project);
}
