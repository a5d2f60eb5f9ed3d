package com.ivamare.eventsourcing.eventsourcing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ivamare.eventsourcing.domain.DomainEvent;
import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.domain.DomainMessage;
import com.ivamare.eventsourcing.domain.Identity;
import com.ivamare.eventsourcing.eventhandling.DomainEventHandlerInvoker;
import com.ivamare.eventsourcing.exception.EventSourcingException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for aggregates whose state is derived from their own events.
 *
 * <p>State changes go through {@link #apply(DomainEvent)}, which invokes the subclass's
 * {@link com.ivamare.eventsourcing.eventhandling.HandleDomainEvent} method for the event
 * and records it as uncommitted. Subclasses need a no-argument constructor for
 * {@link ReflectionAggregateFactory}.
 *
 * @param <Id> The identity type
 */
public abstract class EventSourcedAggregateRoot<Id extends Identity> {

    @JsonIgnore
    private final List<DomainMessage> uncommittedEvents = new ArrayList<>();

    private int playhead = -1;

    /**
     * Identity of this aggregate; available once the first event has been handled.
     */
    public abstract Id getAggregateId();

    /**
     * Handle an event and record it for the next save.
     */
    protected void apply(DomainEvent event) {
        int next = playhead + 1;
        handle(event, null);
        DomainMessage message = new DomainMessage(getAggregateId(), next, event, Instant.now());
        playhead = next;
        uncommittedEvents.add(message);
    }

    /**
     * Rebuild state from previously recorded messages.
     */
    public void initializeState(DomainEventStream stream) {
        for (DomainMessage message : stream) {
            handle(message.payload(), message);
            playhead = message.playhead();
        }
    }

    /**
     * Returns the events applied since the last call and forgets them.
     */
    public DomainEventStream getUncommittedEvents() {
        DomainEventStream stream = DomainEventStream.of(uncommittedEvents);
        uncommittedEvents.clear();
        return stream;
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Position of the last handled event, -1 for a fresh aggregate.
     */
    public int getPlayhead() {
        return playhead;
    }

    private void handle(DomainEvent event, DomainMessage message) {
        try {
            DomainEventHandlerInvoker.invoke(this, event, message);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new EventSourcingException("Failed to apply " + event.getClass().getSimpleName()
                + " to " + getClass().getSimpleName(), e);
        }
    }
}
