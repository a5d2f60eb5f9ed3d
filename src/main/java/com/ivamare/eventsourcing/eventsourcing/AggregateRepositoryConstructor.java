package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.eventhandling.DomainEventBus;

/**
 * Constructor signature shared by event-sourcing repositories, so custom repositories can
 * be created from the same collaborators as {@link EventSourcingRepository}:
 * {@code EventSourcingRepository::new}.
 *
 * @param <T> The aggregate type
 */
@FunctionalInterface
public interface AggregateRepositoryConstructor<T extends EventSourcedAggregateRoot<?>> {

    AggregateRepository<T> create(
        EventStore eventStore,
        DomainEventBus eventBus,
        AggregateFactory<T> aggregateFactory,
        EventStreamDecorator eventStreamDecorator);
}
