package com.ivamare.eventsourcing.readmodel;

import com.ivamare.eventsourcing.domain.Identity;

/**
 * A denormalized view built by projectors from domain events.
 */
public interface ReadModel {

    Identity getId();
}
