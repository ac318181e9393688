package com.plant.flowsheet.api;

/**
 * A target port would receive more than one incoming edge.
 */
public class FanInViolationException extends ConfigurationException {
    private final String edgeId;
    private final String existingEdgeId;

    public FanInViolationException(String edgeId, String existingEdgeId, String nodeId, String port) {
        super("Edge '" + edgeId + "' targets port " + nodeId + "." + port
                + " which is already fed by edge '" + existingEdgeId + "'");
        this.edgeId = edgeId;
        this.existingEdgeId = existingEdgeId;
    }

    public String edgeId() {
        return edgeId;
    }

    public String existingEdgeId() {
        return existingEdgeId;
    }
}
