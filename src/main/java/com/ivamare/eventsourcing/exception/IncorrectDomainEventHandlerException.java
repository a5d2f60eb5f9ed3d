package com.ivamare.eventsourcing.exception;

import java.lang.reflect.Method;

/**
 * Thrown when a {@code @HandleDomainEvent} method does not take exactly one domain event
 * (optionally followed by the domain message).
 */
public class IncorrectDomainEventHandlerException extends EventSourcingException {

    private final Method method;

    public IncorrectDomainEventHandlerException(Method method) {
        super("Domain event handler " + method.getDeclaringClass().getSimpleName() + "." + method.getName()
            + " must have signature: void methodName(SomeEvent event) or"
            + " void methodName(SomeEvent event, DomainMessage message)");
        this.method = method;
    }

    public Method getMethod() {
        return method;
    }
}
