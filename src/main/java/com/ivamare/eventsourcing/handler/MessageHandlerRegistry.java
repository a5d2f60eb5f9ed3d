package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;
import com.ivamare.eventsourcing.exception.IncorrectHandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps message classes to handler functions.
 *
 * <p>Handlers are discovered on plain objects by scanning for methods carrying the
 * registry's marker annotation. Each such method must take exactly one parameter,
 * a subtype of the registry's message type; its return value becomes the dispatch result.
 *
 * @param <M> The message base type (commands or queries)
 */
public class MessageHandlerRegistry<M> {

    private static final Logger log = LoggerFactory.getLogger(MessageHandlerRegistry.class);

    private final Class<M> messageType;
    private final Class<? extends Annotation> annotationType;
    private final Map<Class<?>, MessageHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Creates a registry.
     *
     * @param messageType Base type every handled message must extend
     * @param annotationType Annotation marking handler methods
     */
    public MessageHandlerRegistry(Class<M> messageType, Class<? extends Annotation> annotationType) {
        this.messageType = messageType;
        this.annotationType = annotationType;
    }

    /**
     * Register a handler for a message class.
     *
     * @throws HandlerAlreadyRegisteredException if the class already has a handler
     */
    public void register(Class<? extends M> type, MessageHandler handler) {
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new HandlerAlreadyRegisteredException(type);
        }
        log.debug("Registered handler for {}", type.getSimpleName());
    }

    public Optional<MessageHandler> get(Class<?> type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /**
     * @throws HandlerNotFoundException if the class has no handler
     */
    public MessageHandler getOrThrow(Class<?> type) {
        return get(type).orElseThrow(() -> new HandlerNotFoundException(type));
    }

    /**
     * Dispatch a message to its registered handler.
     *
     * @return result of the handler (may be null)
     * @throws HandlerNotFoundException if no handler is registered
     * @throws Exception from handler execution, unwrapped from reflection
     */
    public Object dispatch(M message) throws Exception {
        var handler = getOrThrow(message.getClass());
        log.debug("Dispatching {}", message.getClass().getSimpleName());
        return handler.handle(message);
    }

    public boolean hasHandler(Class<?> type) {
        return handlers.containsKey(type);
    }

    public List<Class<?>> registeredTypes() {
        return List.copyOf(handlers.keySet());
    }

    public void clear() {
        handlers.clear();
    }

    /**
     * Scan an object for annotated handler methods and register each of them.
     *
     * @param bean The object to scan
     * @return message classes registered for this object
     * @throws IncorrectHandlerException if an annotated method has the wrong signature
     */
    public List<Class<?>> registerBean(Object bean) {
        List<Class<?>> registered = new ArrayList<>();

        for (Method method : annotatedMethods(bean.getClass())) {
            Class<? extends M> type = validateHandlerMethod(method);
            method.setAccessible(true);

            register(type, message -> invokeHandler(method, bean, message));
            registered.add(type);

            log.debug("Discovered handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), type.getSimpleName());
        }

        return registered;
    }

    private List<Method> annotatedMethods(Class<?> type) {
        List<Method> methods = new ArrayList<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (method.isAnnotationPresent(annotationType) && !method.isBridge()) {
                    methods.add(method);
                }
            }
        }
        return methods;
    }

    @SuppressWarnings("unchecked")
    private Class<? extends M> validateHandlerMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1 || !messageType.isAssignableFrom(params[0])) {
            throw new IncorrectHandlerException(method,
                "Object methodName(" + messageType.getSimpleName() + " message)");
        }
        return (Class<? extends M>) params[0];
    }

    /**
     * Invoke a handler method, rethrowing whatever the method itself threw.
     */
    public static Object invokeHandler(Method method, Object target, Object... arguments) throws Exception {
        try {
            return method.invoke(target, arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * A resolved handler function.
     */
    @FunctionalInterface
    public interface MessageHandler {
        Object handle(Object message) throws Exception;
    }
}
