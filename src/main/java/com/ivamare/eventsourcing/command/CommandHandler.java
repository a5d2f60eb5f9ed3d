package com.ivamare.eventsourcing.command;

/**
 * Marker for objects that handle commands.
 *
 * <p>Handler methods are annotated with {@link HandleCommand} and take exactly one
 * command. The return value is handed back to the dispatcher:
 * <pre>
 * public class OrderCommandHandler implements CommandHandler {
 *
 *     {@literal @}HandleCommand
 *     public void place(PlaceOrder command) {
 *         ...
 *     }
 * }
 * </pre>
 */
public interface CommandHandler {
}
