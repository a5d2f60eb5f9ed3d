package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a second handler is subscribed for a message type that already has one.
 */
public class HandlerAlreadyRegisteredException extends EventSourcingException {

    private final Class<?> messageType;

    public HandlerAlreadyRegisteredException(Class<?> messageType) {
        super("Handler already registered for " + messageType.getName());
        this.messageType = messageType;
    }

    public Class<?> getMessageType() {
        return messageType;
    }
}
