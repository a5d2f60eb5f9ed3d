package com.ivamare.eventsourcing.query;

/**
 * Marker for a request to read state. Dispatched on the {@link QueryBus}.
 */
public interface Query {
}
