package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.Identity;
import com.ivamare.eventsourcing.eventhandling.DomainEventBus;
import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repository that stores aggregates as events and publishes them after appending.
 *
 * @param <T> The aggregate type
 */
public class EventSourcingRepository<T extends EventSourcedAggregateRoot<?>> implements AggregateRepository<T> {

    private static final Logger log = LoggerFactory.getLogger(EventSourcingRepository.class);

    private final EventStore eventStore;
    private final DomainEventBus eventBus;
    private final AggregateFactory<T> aggregateFactory;
    private final EventStreamDecorator eventStreamDecorator;

    public EventSourcingRepository(
            EventStore eventStore,
            DomainEventBus eventBus,
            AggregateFactory<T> aggregateFactory,
            EventStreamDecorator eventStreamDecorator) {
        this.eventStore = eventStore;
        this.eventBus = eventBus;
        this.aggregateFactory = aggregateFactory;
        this.eventStreamDecorator = eventStreamDecorator;
    }

    @Override
    public T load(Identity id) {
        DomainEventStream stream = eventStore.load(id);
        if (stream.isEmpty()) {
            throw new AggregateNotFoundException(aggregateName(), id.value());
        }
        return aggregateFactory.create(stream);
    }

    @Override
    public void save(T aggregate) {
        DomainEventStream uncommitted = aggregate.getUncommittedEvents();
        if (uncommitted.isEmpty()) {
            return;
        }
        Identity id = aggregate.getAggregateId();
        DomainEventStream stream = eventStreamDecorator.decorateForWrite(aggregate.getClass(), id, uncommitted);
        eventStore.append(id, stream);
        eventBus.publish(stream);

        log.debug("Saved {} event(s) for {} {}", stream.size(), aggregate.getClass().getSimpleName(), id.value());
    }

    @Override
    public boolean has(Identity id) {
        return eventStore.has(id);
    }

    public EventStore getEventStore() {
        return eventStore;
    }

    private String aggregateName() {
        return aggregateFactory instanceof ReflectionAggregateFactory<?> reflective
            ? reflective.getAggregateType().getSimpleName()
            : "aggregate";
    }
}
