package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.Identity;

/**
 * Rewrites an aggregate's uncommitted stream before it is stored and published.
 */
@FunctionalInterface
public interface EventStreamDecorator {

    DomainEventStream decorateForWrite(Class<?> aggregateType, Identity id, DomainEventStream stream);

    static EventStreamDecorator identity() {
        return (aggregateType, id, stream) -> stream;
    }
}
