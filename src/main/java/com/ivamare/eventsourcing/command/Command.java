package com.ivamare.eventsourcing.command;

/**
 * Marker for an instruction to change state. Dispatched on the {@link CommandBus}.
 */
public interface Command {
}
