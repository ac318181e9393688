package com.plant.flowsheet.api;

/**
 * An edge names a node or a port that does not exist.
 */
public class UnknownReferenceException extends ConfigurationException {
    private final String edgeId;
    private final String reference;

    public UnknownReferenceException(String edgeId, String reference, String detail) {
        super("Edge '" + edgeId + "' references unknown " + detail + ": " + reference);
        this.edgeId = edgeId;
        this.reference = reference;
    }

    public String edgeId() {
        return edgeId;
    }

    public String reference() {
        return reference;
    }
}
