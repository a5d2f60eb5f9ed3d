package com.ivamare.eventsourcing.command;

/**
 * Routes commands to the handler subscribed for their type.
 */
public interface CommandBus {

    /**
     * Subscribe every {@link HandleCommand} method of the handler.
     *
     * @param handler The command handler
     * @throws com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException if a command type already has a handler
     */
    void subscribe(CommandHandler handler);

    /**
     * Dispatch a command to its handler.
     *
     * @param command The command
     * @return result returned by the handler (may be null)
     * @throws com.ivamare.eventsourcing.exception.HandlerNotFoundException if no handler is subscribed
     * @throws Exception from the handler
     */
    Object dispatch(Command command) throws Exception;
}
