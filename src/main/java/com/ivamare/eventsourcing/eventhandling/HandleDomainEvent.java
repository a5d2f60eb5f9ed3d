package com.ivamare.eventsourcing.eventhandling;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as the handler for its domain event parameter.
 *
 * <p>Used by {@link AbstractEventListener} subclasses and by event-sourced aggregates.
 * Supported signatures:
 * <pre>
 * void onOrderPlaced(OrderPlaced event)
 * void onOrderPlaced(OrderPlaced event, DomainMessage message)
 * </pre>
 * When an aggregate applies a new event the message argument is null.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface HandleDomainEvent {
}
