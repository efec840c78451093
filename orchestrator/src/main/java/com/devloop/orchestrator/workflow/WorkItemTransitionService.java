package com.devloop.orchestrator.workflow;

/**
 * Owner of work item status. The orchestrator only asks; this service decides and persists.
 */
public interface WorkItemTransitionService {

    TransitionResult transitionToInProgress(String projectId, String itemId);

    TransitionResult transitionToAwaitingPr(String projectId, String itemId);

    /** Put an item that failed to start back to PENDING, recording why. */
    TransitionResult handleStartFailure(String projectId, String itemId, String errorMessage);

    /**
     * Mark the item COMPLETE as tracked pull request {@code prNumber}: the agent
     * reference is cleared and the item leaves the planning tree.
     */
    TransitionResult promoteToTrackedPr(String projectId, String itemId, int prNumber);
}
