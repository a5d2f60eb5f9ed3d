package com.ivamare.eventsourcing.testing;

import com.ivamare.eventsourcing.domain.DomainEvent;
import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.DomainMessage;
import com.ivamare.eventsourcing.domain.Identity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Wraps bare events as domain messages stamped with the bench's current time.
 *
 * <p>Keeps a playhead counter per aggregate id, so consecutive calls for the same id
 * continue the same stream.
 */
public class DomainMessageTestFactory {

    private final Supplier<Instant> clock;
    private final Map<Identity, Integer> playheads = new HashMap<>();

    public DomainMessageTestFactory(Supplier<Instant> clock) {
        this.clock = clock;
    }

    public synchronized DomainMessage createDomainMessage(Identity id, DomainEvent event) {
        int playhead = playheads.merge(id, 1, Integer::sum) - 1;
        return new DomainMessage(id, playhead, event, clock.get());
    }

    public synchronized List<DomainMessage> createDomainMessages(Identity id, List<? extends DomainEvent> events) {
        List<DomainMessage> messages = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            messages.add(createDomainMessage(id, event));
        }
        return messages;
    }

    public DomainEventStream createDomainEventStream(Identity id, List<? extends DomainEvent> events) {
        return DomainEventStream.of(createDomainMessages(id, events));
    }

    /**
     * Messages continuing a stored stream at {@code firstPlayhead}. Does not touch the counters.
     */
    public DomainEventStream continueStream(Identity id, int firstPlayhead, List<? extends DomainEvent> events) {
        Instant now = clock.get();
        List<DomainMessage> messages = new ArrayList<>(events.size());
        int playhead = firstPlayhead;
        for (DomainEvent event : events) {
            messages.add(new DomainMessage(id, playhead++, event, now));
        }
        return DomainEventStream.of(messages);
    }
}
