package com.ivamare.eventsourcing.command;

import com.ivamare.eventsourcing.handler.MessageHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * In-process command bus that invokes handlers on the calling thread.
 */
public class SimpleCommandBus implements CommandBus {

    private static final Logger log = LoggerFactory.getLogger(SimpleCommandBus.class);

    private final MessageHandlerRegistry<Command> registry =
        new MessageHandlerRegistry<>(Command.class, HandleCommand.class);

    @Override
    public void subscribe(CommandHandler handler) {
        List<Class<?>> types = registry.registerBean(handler);
        log.debug("Subscribed {} for {} command type(s)", handler.getClass().getSimpleName(), types.size());
    }

    @Override
    public Object dispatch(Command command) throws Exception {
        return registry.dispatch(command);
    }

    public boolean hasHandler(Class<? extends Command> commandType) {
        return registry.hasHandler(commandType);
    }
}
