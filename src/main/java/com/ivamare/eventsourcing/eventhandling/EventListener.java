package com.ivamare.eventsourcing.eventhandling;

import com.ivamare.eventsourcing.domain.DomainMessage;

/**
 * Receives every domain message published on the {@link DomainEventBus} it subscribes to.
 */
@FunctionalInterface
public interface EventListener {

    /**
     * Handle a published domain message.
     *
     * @param message The message
     * @throws Exception on failure; asynchronous buses report it to their error callback
     */
    void handle(DomainMessage message) throws Exception;
}
