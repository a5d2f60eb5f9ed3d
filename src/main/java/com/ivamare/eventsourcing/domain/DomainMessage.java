package com.ivamare.eventsourcing.domain;

import java.time.Clock;
import java.time.Instant;

/**
 * A domain event wrapped with the aggregate it belongs to, its position in the
 * aggregate's stream and the time it was recorded.
 *
 * @param aggregateId The aggregate that produced the event
 * @param playhead Zero-based position in the aggregate's event stream
 * @param payload The domain event
 * @param recordedOn When the event was recorded
 */
public record DomainMessage(
    Identity aggregateId,
    int playhead,
    DomainEvent payload,
    Instant recordedOn
) {
    public DomainMessage {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId is required");
        }
        if (playhead < 0) {
            throw new IllegalArgumentException("playhead must not be negative");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        if (recordedOn == null) {
            throw new IllegalArgumentException("recordedOn is required");
        }
    }

    /**
     * Record an event at the current instant of the given clock.
     */
    public static DomainMessage recordNow(Identity aggregateId, int playhead, DomainEvent payload, Clock clock) {
        return new DomainMessage(aggregateId, playhead, payload, clock.instant());
    }

    public DomainMessage withRecordedOn(Instant instant) {
        return new DomainMessage(aggregateId, playhead, payload, instant);
    }

    public Class<? extends DomainEvent> payloadType() {
        return payload.getClass();
    }
}
