package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.domain.DomainEventStream;

/**
 * Reconstitutes an aggregate from its event stream.
 *
 * @param <T> The aggregate type
 */
@FunctionalInterface
public interface AggregateFactory<T extends EventSourcedAggregateRoot<?>> {

    T create(DomainEventStream stream);
}
