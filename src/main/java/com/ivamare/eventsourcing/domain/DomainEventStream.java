package com.ivamare.eventsourcing.domain;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Immutable, ordered sequence of domain messages.
 *
 * @param messages The messages in stream order
 */
public record DomainEventStream(List<DomainMessage> messages) implements Iterable<DomainMessage> {

    private static final DomainEventStream EMPTY = new DomainEventStream(List.of());

    public DomainEventStream {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static DomainEventStream of(List<DomainMessage> messages) {
        return new DomainEventStream(messages);
    }

    public static DomainEventStream of(DomainMessage... messages) {
        return new DomainEventStream(List.of(messages));
    }

    public static DomainEventStream empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public int size() {
        return messages.size();
    }

    public Stream<DomainMessage> stream() {
        return messages.stream();
    }

    public List<DomainEvent> events() {
        return messages.stream().map(DomainMessage::payload).toList();
    }

    public DomainEventStream append(DomainEventStream other) {
        if (other.isEmpty()) {
            return this;
        }
        List<DomainMessage> combined = new ArrayList<>(messages);
        combined.addAll(other.messages);
        return new DomainEventStream(combined);
    }

    public DomainEventStream map(UnaryOperator<DomainMessage> mapper) {
        return new DomainEventStream(messages.stream().map(mapper).toList());
    }

    @Override
    public Iterator<DomainMessage> iterator() {
        return messages.iterator();
    }
}
