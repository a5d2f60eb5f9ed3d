package com.ivamare.eventsourcing.domain;

import java.util.UUID;

/**
 * Identity backed by a random UUID.
 *
 * @param uuid The wrapped UUID
 */
public record UuidIdentity(UUID uuid) implements Identity {

    public UuidIdentity {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid is required");
        }
    }

    public static UuidIdentity create() {
        return new UuidIdentity(UUID.randomUUID());
    }

    public static UuidIdentity of(String value) {
        return new UuidIdentity(UUID.fromString(value));
    }

    @Override
    public String value() {
        return uuid.toString();
    }

    @Override
    public String toString() {
        return value();
    }
}
