package com.devloop.orchestrator.workflow;

public class WorkItemNotFoundException extends RuntimeException {

    public WorkItemNotFoundException(String message) {
        super(message);
    }
}
