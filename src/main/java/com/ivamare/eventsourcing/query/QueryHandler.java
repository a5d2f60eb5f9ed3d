package com.ivamare.eventsourcing.query;

/**
 * Marker for objects that answer queries through {@link HandleQuery} methods.
 */
public interface QueryHandler {
}
