package com.ivamare.eventsourcing.exception;

/**
 * Thrown when appended domain messages do not continue the stored stream.
 */
public class PlayheadMismatchException extends EventSourcingException {

    private final String aggregateId;
    private final int expectedPlayhead;
    private final int actualPlayhead;

    public PlayheadMismatchException(String aggregateId, int expectedPlayhead, int actualPlayhead) {
        super("Playhead mismatch for " + aggregateId + ": expected " + expectedPlayhead
            + " but was " + actualPlayhead);
        this.aggregateId = aggregateId;
        this.expectedPlayhead = expectedPlayhead;
        this.actualPlayhead = actualPlayhead;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public int getExpectedPlayhead() {
        return expectedPlayhead;
    }

    public int getActualPlayhead() {
        return actualPlayhead;
    }
}
