package com.ivamare.eventsourcing.eventsourcing;

import com.ivamare.eventsourcing.domain.DomainEventStream;
import com.ivamare.eventsourcing.exception.ComponentCreationException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Creates aggregates through their no-argument constructor and replays the stream on them.
 *
 * @param <T> The aggregate type
 */
public class ReflectionAggregateFactory<T extends EventSourcedAggregateRoot<?>> implements AggregateFactory<T> {

    private final Class<T> aggregateType;

    public ReflectionAggregateFactory(Class<T> aggregateType) {
        this.aggregateType = aggregateType;
    }

    @Override
    public T create(DomainEventStream stream) {
        T aggregate = instantiate();
        aggregate.initializeState(stream);
        return aggregate;
    }

    public Class<T> getAggregateType() {
        return aggregateType;
    }

    private T instantiate() {
        try {
            Constructor<T> constructor = aggregateType.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new ComponentCreationException(aggregateType, "no no-argument constructor");
        } catch (InvocationTargetException e) {
            throw new ComponentCreationException(aggregateType, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ComponentCreationException(aggregateType, e);
        }
    }
}
