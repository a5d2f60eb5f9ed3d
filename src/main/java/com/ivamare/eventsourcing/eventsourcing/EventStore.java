package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.Identity;

import java.util.List;

/**
 * Append-only storage of domain messages per aggregate.
 */
public interface EventStore {

    /**
     * Load all messages of an aggregate.
     *
     * @return the stream, empty when the aggregate is unknown
     */
    DomainEventStream load(Identity id);

    /**
     * Load messages of an aggregate starting at the given playhead.
     */
    DomainEventStream loadFromPlayhead(Identity id, int playhead);

    /**
     * Append messages to an aggregate's stream.
     *
     * @throws com.ivamare.eventsourcing.exception.PlayheadMismatchException if the messages do not continue the stream
     */
    void append(Identity id, DomainEventStream stream);

    boolean has(Identity id);

    /**
     * Identities of all stored aggregates, in order of first append.
     */
    List<Identity> ids();

    /**
     * Every stored message, grouped by aggregate in order of first append.
     */
    DomainEventStream loadAll();
}
