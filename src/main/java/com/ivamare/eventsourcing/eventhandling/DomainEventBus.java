package com.ivamare.eventsourcing.eventhandling;

import com.ivamare.eventsourcing.domain.DomainEventStream;

/**
 * Publishes domain messages to subscribed listeners.
 */
public interface DomainEventBus {

    void subscribe(EventListener listener);

    void publish(DomainEventStream stream);
}
