package com.plant.flowsheet.api;

/**
 * A component's step failed for the inputs it received (for example an input
 * outside its valid domain).
 *
 * Components may throw this without knowing their own node id; the executor
 * rethrows it with the id attached via {@link #forNode(String)}.
 */
public class ComputationException extends FlowsheetException {
    private final String nodeId;

    public ComputationException(String message) {
        this(null, message, null);
    }

    public ComputationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public ComputationException(String nodeId, String message, Throwable cause) {
        super(nodeId == null ? message : "Node '" + nodeId + "' failed: " + message, cause);
        this.nodeId = nodeId;
    }

    /** Returns the failing node id, or null if not yet attributed. */
    public String nodeId() {
        return nodeId;
    }

    /**
     * Returns this exception attributed to the given node. If it already
     * carries a node id it is returned unchanged.
     */
    public ComputationException forNode(String nodeId) {
        if (this.nodeId != null)
            return this;
        String detail = getMessage();
        Throwable cause = getCause() != null ? getCause() : this;
        return new ComputationException(nodeId, detail, cause);
    }
}
