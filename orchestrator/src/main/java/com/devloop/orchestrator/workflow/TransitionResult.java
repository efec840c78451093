package com.devloop.orchestrator.workflow;

/**
 * Outcome of a status change requested from {@link WorkItemTransitionService}.
 *
 * @param error reason for refusal; null on success
 */
public record TransitionResult(boolean success, WorkItemStatus previous, WorkItemStatus current, String error) {

    public static TransitionResult ok(WorkItemStatus previous, WorkItemStatus current) {
        return new TransitionResult(true, previous, current, null);
    }

    public static TransitionResult failed(WorkItemStatus current, String error) {
        return new TransitionResult(false, current, current, error);
    }
}
