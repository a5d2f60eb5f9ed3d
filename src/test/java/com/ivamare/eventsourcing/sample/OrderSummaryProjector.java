package com.ivamare.eventsourcing.sample;

import com.ivamare.eventsourcing.eventhandling.AbstractEventListener;
import com.ivamare.eventsourcing.eventhandling.HandleDomainEvent;
import com.ivamare.eventsourcing.readmodel.ReadModelRepository;

public class OrderSummaryProjector extends AbstractEventListener {

    private final ReadModelRepository<OrderSummary> summaries;

    public OrderSummaryProjector(ReadModelRepository<OrderSummary> summaries) {
        this.summaries = summaries;
    }

    @HandleDomainEvent
    void onPlaced(OrderPlaced event) {
        summaries.save(new OrderSummary(event.orderId(), event.product(), "PLACED"));
    }

    @HandleDomainEvent
    void onShipped(OrderShipped event) {
        summaries.save(summaries.get(event.orderId()).withStatus("SHIPPED"));
    }
}
