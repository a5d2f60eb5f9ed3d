package com.ivamare.eventsourcing.sample;

import com.ivamare.eventsourcing.domain.DomainEvent;
import com.ivamare.eventsourcing.domain.UuidIdentity;

public record OrderShipped(UuidIdentity orderId) implements DomainEvent {
}
