package com.ivamare.eventsourcing.domain;

/**
 * Identifies an aggregate or read model.
 *
 * <p>Implementations must be value objects: two identities with the same
 * {@link #value()} are equal and share a hash code.
 */
public interface Identity {

    /**
     * String form of this identity, used for storage keys and diagnostics.
     *
     * @return the identity value
     */
    String value();
}
