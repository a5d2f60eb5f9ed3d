package com.ivamare.eventsourcing.exception;

import java.lang.reflect.Method;

/**
 * Thrown when an annotated command or query handler method has an unsupported signature.
 */
public class IncorrectHandlerException extends EventSourcingException {

    private final Method method;

    public IncorrectHandlerException(Method method, String expectedSignature) {
        super("Handler method " + method.getDeclaringClass().getSimpleName() + "." + method.getName()
            + " must have signature: " + expectedSignature);
        this.method = method;
    }

    public Method getMethod() {
        return method;
    }
}
