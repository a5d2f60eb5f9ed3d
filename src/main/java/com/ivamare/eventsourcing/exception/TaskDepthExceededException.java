package com.ivamare.eventsourcing.exception;

/**
 * Thrown when tasks keep registering nested tasks beyond the configured depth.
 */
public class TaskDepthExceededException extends TestBenchException {

    private final int maxDepth;

    public TaskDepthExceededException(int maxDepth, String description) {
        super("Task nesting deeper than " + maxDepth + " levels while registering: " + description.trim());
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
