package com.ivamare.eventsourcing.query;

import com.ivamare.eventsourcing.handler.MessageHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * In-process query bus that invokes handlers on the calling thread.
 */
public class SimpleQueryBus implements QueryBus {

    private static final Logger log = LoggerFactory.getLogger(SimpleQueryBus.class);

    private final MessageHandlerRegistry<Query> registry =
        new MessageHandlerRegistry<>(Query.class, HandleQuery.class);

    @Override
    public void subscribe(QueryHandler handler) {
        List<Class<?>> types = registry.registerBean(handler);
        log.debug("Subscribed {} for {} query type(s)", handler.getClass().getSimpleName(), types.size());
    }

    @Override
    public Object dispatch(Query query) throws Exception {
        return registry.dispatch(query);
    }
}
