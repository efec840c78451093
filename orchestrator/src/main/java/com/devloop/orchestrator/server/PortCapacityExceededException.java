package com.devloop.orchestrator.server;

/**
 * Thrown when every port in the pool is held by a live agent server.
 * Nothing has been allocated when this is raised.
 */
public class PortCapacityExceededException extends RuntimeException {

    private final int capacity;

    public PortCapacityExceededException(int capacity) {
        super("Maximum concurrent agent servers (" + capacity + ") reached");
        this.capacity = capacity;
    }

    public int capacity() { return capacity; }
}
