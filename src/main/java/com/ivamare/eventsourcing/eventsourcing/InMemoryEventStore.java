package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.DomainMessage;
import com.ivamare.eventsourcing.domain.Identity;
import com.ivamare.eventsourcing.exception.PlayheadMismatchException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event store kept in memory, for tests.
 */
public class InMemoryEventStore implements EventStore {

    private final Map<Identity, List<DomainMessage>> streams = new LinkedHashMap<>();

    @Override
    public synchronized DomainEventStream load(Identity id) {
        return DomainEventStream.of(streams.getOrDefault(id, List.of()));
    }

    @Override
    public synchronized DomainEventStream loadFromPlayhead(Identity id, int playhead) {
        return DomainEventStream.of(streams.getOrDefault(id, List.of()).stream()
            .filter(message -> message.playhead() >= playhead)
            .toList());
    }

    @Override
    public synchronized void append(Identity id, DomainEventStream stream) {
        List<DomainMessage> existing = streams.getOrDefault(id, List.of());
        int expected = existing.size();
        for (DomainMessage message : stream) {
            if (!message.aggregateId().equals(id)) {
                throw new IllegalArgumentException("Message for " + message.aggregateId().value()
                    + " appended to stream " + id.value());
            }
            if (message.playhead() != expected) {
                throw new PlayheadMismatchException(id.value(), expected, message.playhead());
            }
            expected++;
        }
        if (!stream.isEmpty()) {
            streams.computeIfAbsent(id, key -> new ArrayList<>()).addAll(stream.messages());
        }
    }

    @Override
    public synchronized boolean has(Identity id) {
        return streams.containsKey(id);
    }

    @Override
    public synchronized List<Identity> ids() {
        return List.copyOf(streams.keySet());
    }

    @Override
    public synchronized DomainEventStream loadAll() {
        List<DomainMessage> all = new ArrayList<>();
        streams.values().forEach(all::addAll);
        return DomainEventStream.of(all);
    }
}
