package com.ivamare.eventsourcing.exception;

/**
 * Thrown when no handler is registered for a dispatched command or query.
 */
public class HandlerNotFoundException extends EventSourcingException {

    private final Class<?> messageType;

    public HandlerNotFoundException(Class<?> messageType) {
        super("No handler registered for " + messageType.getName());
        this.messageType = messageType;
    }

    public Class<?> getMessageType() {
        return messageType;
    }
}
