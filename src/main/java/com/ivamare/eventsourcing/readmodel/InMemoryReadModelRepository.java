package com.ivamare.eventsourcing.readmodel;

import com.ivamare.eventsourcing.domain.Identity;
import com.ivamare.eventsourcing.exception.ModelNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read model repository kept in memory, in insertion order.
 *
 * @param <T> The read model type
 */
public class InMemoryReadModelRepository<T extends ReadModel> implements ReadModelRepository<T> {

    private final String name;
    private final Map<Identity, T> models = new LinkedHashMap<>();

    public InMemoryReadModelRepository() {
        this("model");
    }

    /**
     * @param name Model name used in error messages
     */
    public InMemoryReadModelRepository(String name) {
        this.name = name;
    }

    @Override
    public synchronized void save(T model) {
        models.put(model.getId(), model);
    }

    @Override
    public synchronized T get(Identity id) {
        return find(id).orElseThrow(() -> new ModelNotFoundException(name, id.value()));
    }

    @Override
    public synchronized Optional<T> find(Identity id) {
        return Optional.ofNullable(models.get(id));
    }

    @Override
    public synchronized List<T> findAll() {
        return new ArrayList<>(models.values());
    }

    @Override
    public synchronized void remove(Identity id) {
        models.remove(id);
    }

    @Override
    public synchronized boolean has(Identity id) {
        return models.containsKey(id);
    }
}
