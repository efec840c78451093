package com.devloop.orchestrator.workflow;

/**
 * Work item lifecycle as driven by agent runs.
 *
 * <pre>
 *   PENDING ──start──▶ IN_PROGRESS ──PR found──▶ COMPLETE
 *      ▲                   │
 *      └──start failed─────┤
 *                          └──no PR──▶ AWAITING_PR
 * </pre>
 */
public enum WorkItemStatus {
    PENDING,
    IN_PROGRESS,
    AWAITING_PR,
    COMPLETE;

    public boolean canTransitionTo(WorkItemStatus target) {
        return switch (this) {
            case PENDING     -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == AWAITING_PR || target == COMPLETE || target == PENDING;
            case AWAITING_PR, COMPLETE -> false;
        };
    }
}
