package com.ivamare.eventsourcing.sample;

import com.ivamare.eventsourcing.domain.UuidIdentity;
import com.ivamare.eventsourcing.readmodel.ReadModel;

public class OrderSummary implements ReadModel {

    private final UuidIdentity id;
    private final String product;
    private final String status;

    public OrderSummary(UuidIdentity id, String product, String status) {
        this.id = id;
        this.product = product;
        this.status = status;
    }

    @Override
    public UuidIdentity getId() {
        return id;
    }

    public String getProduct() {
        return product;
    }

    public String getStatus() {
        return status;
    }

    public OrderSummary withStatus(String status) {
        return new OrderSummary(id, product, status);
    }
}
