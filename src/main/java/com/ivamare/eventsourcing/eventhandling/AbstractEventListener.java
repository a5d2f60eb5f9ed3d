package com.ivamare.eventsourcing.eventhandling;

import com.ivamare.eventsourcing.domain.DomainMessage;

/**
 * Event listener that routes each message to the subclass's {@link HandleDomainEvent}
 * method for the payload type. Messages without a matching method are ignored.
 *
 * <pre>
 * public class OrderCountProjector extends AbstractEventListener {
 *
 *     {@literal @}HandleDomainEvent
 *     void onOrderPlaced(OrderPlaced event, DomainMessage message) {
 *         ...
 *     }
 * }
 * </pre>
 */
public abstract class AbstractEventListener implements EventListener {

    @Override
    public void handle(DomainMessage message) throws Exception {
        DomainEventHandlerInvoker.invoke(this, message);
    }
}
