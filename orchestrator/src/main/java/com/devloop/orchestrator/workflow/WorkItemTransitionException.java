package com.devloop.orchestrator.workflow;

/**
 * A work item could not be moved to the requested status.
 */
public class WorkItemTransitionException extends RuntimeException {

    private final String itemId;
    private final WorkItemStatus from;
    private final WorkItemStatus to;

    public WorkItemTransitionException(String itemId, WorkItemStatus from, WorkItemStatus to, String message) {
        super("Cannot move " + itemId + " from " + from + " to " + to + ": " + message);
        this.itemId = itemId;
        this.from   = from;
        this.to     = to;
    }

    public String itemId()       { return itemId; }
    public WorkItemStatus from() { return from; }
    public WorkItemStatus to()   { return to; }
}
