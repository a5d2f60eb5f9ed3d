package com.ivamare.eventsourcing.testing;

import com.ivamare.eventsourcing.readmodel.ReadModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read model contexts keyed by name. A read model class maps to its simple name, so a
 * class reference and a name reference to the same model share one repository.
 */
public class ReadModelTestContextCollection {

    private final Map<String, ReadModelTestContext<?>> contexts = new LinkedHashMap<>();

    @SuppressWarnings("unchecked")
    public synchronized <T extends ReadModel> ReadModelTestContext<T> getByName(String name) {
        return (ReadModelTestContext<T>) contexts.computeIfAbsent(name, ReadModelTestContext::new);
    }

    public <T extends ReadModel> ReadModelTestContext<T> getByType(Class<T> type) {
        return getByName(type.getSimpleName());
    }

    public <T extends ReadModel> ReadModelTestContext<T> getByInstance(T model) {
        return getByName(model.getClass().getSimpleName());
    }

    public <T extends ReadModel> ReadModelTestContext<T> getByReference(RepositoryReference reference) {
        if (reference.kind() != RepositoryReference.Kind.READ_MODEL) {
            throw new IllegalArgumentException(reference + " does not reference a read model");
        }
        return getByName(reference.name());
    }

    /**
     * Stored models by read model name; empty repositories are left out.
     */
    public Map<String, List<? extends ReadModel>> getAllModels() {
        List<ReadModelTestContext<?>> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(contexts.values());
        }
        Map<String, List<? extends ReadModel>> result = new LinkedHashMap<>();
        for (ReadModelTestContext<?> context : snapshot) {
            List<? extends ReadModel> models = context.getAllModels();
            if (!models.isEmpty()) {
                result.put(context.getName(), models);
            }
        }
        return result;
    }
}
