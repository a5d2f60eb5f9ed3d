package com.ivamare.eventsourcing.readmodel;

import com.ivamare.eventsourcing.domain.Identity;

import java.util.List;
import java.util.Optional;

/**
 * Storage for read models of one type.
 *
 * @param <T> The read model type
 */
public interface ReadModelRepository<T extends ReadModel> {

    void save(T model);

    /**
     * @throws com.ivamare.eventsourcing.exception.ModelNotFoundException if there is no model with this id
     */
    T get(Identity id);

    Optional<T> find(Identity id);

    List<T> findAll();

    void remove(Identity id);

    boolean has(Identity id);
}
