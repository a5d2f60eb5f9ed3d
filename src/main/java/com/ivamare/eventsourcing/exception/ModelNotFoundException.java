package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a read model cannot be found in its repository.
 */
public class ModelNotFoundException extends EventSourcingException {

    private final String modelName;
    private final String modelId;

    public ModelNotFoundException(String modelName, String modelId) {
        super("Model " + modelName + " not found: " + modelId);
        this.modelName = modelName;
        this.modelId = modelId;
    }

    public String getModelName() {
        return modelName;
    }

    public String getModelId() {
        return modelId;
    }
}
