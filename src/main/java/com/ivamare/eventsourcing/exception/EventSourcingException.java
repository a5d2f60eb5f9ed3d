package com.ivamare.eventsourcing.exception;

/**
 * Base exception for all event sourcing and test bench errors.
 */
public class EventSourcingException extends RuntimeException {

    public EventSourcingException(String message) {
        super(message);
    }

    public EventSourcingException(String message, Throwable cause) {
        super(message, cause);
    }
}
