package com.ivamare.eventsourcing.eventhandling;

import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.DomainMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every message published through it before handing the stream to the wrapped bus.
 */
public class RecordDomainEventBusDecorator implements DomainEventBus {

    private final DomainEventBus delegate;
    private final List<DomainMessage> messages = new ArrayList<>();

    public RecordDomainEventBusDecorator(DomainEventBus delegate) {
        this.delegate = delegate;
    }

    @Override
    public void subscribe(EventListener listener) {
        delegate.subscribe(listener);
    }

    @Override
    public void publish(DomainEventStream stream) {
        synchronized (messages) {
            messages.addAll(stream.messages());
        }
        delegate.publish(stream);
    }

    /**
     * Messages published so far, in publish order.
     */
    public List<DomainMessage> getMessages() {
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }

    public void clear() {
        synchronized (messages) {
            messages.clear();
        }
    }
}
