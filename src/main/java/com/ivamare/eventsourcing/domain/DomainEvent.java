package com.ivamare.eventsourcing.domain;

/**
 * Marker for something that happened in the domain.
 *
 * <p>Events are immutable; records are the natural fit.
 */
public interface DomainEvent {
}
