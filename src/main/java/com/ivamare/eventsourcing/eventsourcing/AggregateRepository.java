package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.domain.Identity;

/**
 * Loads and saves aggregates of one type.
 *
 * @param <T> The aggregate type
 */
public interface AggregateRepository<T extends EventSourcedAggregateRoot<?>> {

    /**
     * @throws com.ivamare.eventsourcing.exception.AggregateNotFoundException if the aggregate has no events
     */
    T load(Identity id);

    void save(T aggregate);

    boolean has(Identity id);
}
