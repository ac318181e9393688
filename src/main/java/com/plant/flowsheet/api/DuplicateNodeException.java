package com.plant.flowsheet.api;

/** Two node descriptors share the same id. */
public class DuplicateNodeException extends ConfigurationException {
    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super("Duplicate node id: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
