package com.ivamare.eventsourcing.query;

/**
 * Routes queries to the handler subscribed for their type.
 */
public interface QueryBus {

    void subscribe(QueryHandler handler);

    /**
     * Dispatch a query to its handler.
     *
     * @return the answer produced by the handler
     * @throws com.ivamare.eventsourcing.exception.HandlerNotFoundException if no handler is subscribed
     * @throws Exception from the handler
     */
    Object dispatch(Query query) throws Exception;
}
