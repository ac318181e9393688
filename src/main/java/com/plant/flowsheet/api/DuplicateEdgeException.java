package com.plant.flowsheet.api;

/** Two edge descriptors share the same id. */
public class DuplicateEdgeException extends ConfigurationException {
    private final String edgeId;

    public DuplicateEdgeException(String edgeId) {
        super("Duplicate edge id: " + edgeId);
        this.edgeId = edgeId;
    }

    public String edgeId() {
        return edgeId;
    }
}
