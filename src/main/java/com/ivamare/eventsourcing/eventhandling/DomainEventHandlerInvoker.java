package com.ivamare.eventsourcing.eventhandling;

import com.ivamare.eventsourcing.domain.DomainEvent;
import com.ivamare.eventsourcing.domain.DomainMessage;
import com.ivamare.eventsourcing.exception.IncorrectDomainEventHandlerException;
import com.ivamare.eventsourcing.handler.MessageHandlerRegistry;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Invokes {@link HandleDomainEvent} methods by payload type.
 *
 * <p>Handler methods are resolved once per class and cached.
 */
public final class DomainEventHandlerInvoker {

    private static final Map<Class<?>, Map<Class<?>, Method>> HANDLERS = new ConcurrentHashMap<>();

    private DomainEventHandlerInvoker() {
        // Utility class - no instantiation
    }

    /**
     * Invoke the handler of {@code target} for the message payload, if there is one.
     *
     * @return true if a handler method was invoked
     * @throws IncorrectDomainEventHandlerException if the target declares a malformed handler
     * @throws Exception thrown by the handler method
     */
    public static boolean invoke(Object target, DomainMessage message) throws Exception {
        return invoke(target, message.payload(), message);
    }

    /**
     * Invoke the handler of {@code target} for an event that may not be wrapped yet.
     * Two-argument handlers receive a null message in that case.
     */
    public static boolean invoke(Object target, DomainEvent event, DomainMessage message) throws Exception {
        Method method = findHandler(target.getClass(), event.getClass());
        if (method == null) {
            return false;
        }
        if (method.getParameterCount() == 2) {
            MessageHandlerRegistry.invokeHandler(method, target, event, message);
        } else {
            MessageHandlerRegistry.invokeHandler(method, target, event);
        }
        return true;
    }

    static Method findHandler(Class<?> targetType, Class<?> eventType) {
        Map<Class<?>, Method> handlers = HANDLERS.computeIfAbsent(targetType, DomainEventHandlerInvoker::scan);
        Method exact = handlers.get(eventType);
        if (exact != null) {
            return exact;
        }
        for (var entry : handlers.entrySet()) {
            if (entry.getKey().isAssignableFrom(eventType)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Map<Class<?>, Method> scan(Class<?> type) {
        Map<Class<?>, Method> handlers = new LinkedHashMap<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (!method.isAnnotationPresent(HandleDomainEvent.class) || method.isBridge()) {
                    continue;
                }
                Class<?> eventType = validate(method);
                method.setAccessible(true);
                // Subclass handlers win over overridden ones.
                handlers.putIfAbsent(eventType, method);
            }
        }
        return Map.copyOf(handlers);
    }

    private static Class<?> validate(Method method) {
        Class<?>[] params = method.getParameterTypes();
        boolean valid = switch (params.length) {
            case 1 -> DomainEvent.class.isAssignableFrom(params[0]);
            case 2 -> DomainEvent.class.isAssignableFrom(params[0]) && params[1] == DomainMessage.class;
            default -> false;
        };
        if (!valid) {
            throw new IncorrectDomainEventHandlerException(method);
        }
        return params[0];
    }
}
