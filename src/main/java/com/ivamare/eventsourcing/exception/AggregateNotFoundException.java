package com.ivamare.eventsourcing.exception;

/**
 * Thrown when an aggregate has no events in its event store.
 */
public class AggregateNotFoundException extends EventSourcingException {

    private final String aggregateType;
    private final String aggregateId;

    public AggregateNotFoundException(String aggregateType, String aggregateId) {
        super("Aggregate " + aggregateType + " not found: " + aggregateId);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
