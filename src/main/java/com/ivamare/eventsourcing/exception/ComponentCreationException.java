package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a handler, listener or repository cannot be constructed from its class.
 */
public class ComponentCreationException extends EventSourcingException {

    private final Class<?> componentType;

    public ComponentCreationException(Class<?> componentType, String reason) {
        super("Cannot create " + componentType.getName() + ": " + reason);
        this.componentType = componentType;
    }

    public ComponentCreationException(Class<?> componentType, Throwable cause) {
        super("Cannot create " + componentType.getName() + ": " + cause.getMessage(), cause);
        this.componentType = componentType;
    }

    public Class<?> getComponentType() {
        return componentType;
    }
}
