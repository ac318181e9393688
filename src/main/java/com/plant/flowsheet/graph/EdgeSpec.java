package com.plant.flowsheet.graph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Static description of one directed connection
 * {@code sourceNode.sourcePort -> targetNode.targetPort}.
 *
 * <p>
 * The optional initial value seeds the edge before it is first written. For
 * tear edges it is the first-iteration guess.
 */
public final class EdgeSpec {
    private final String id;
    private final String sourceNode;
    private final String sourcePort;
    private final String targetNode;
    private final String targetPort;
    private final double[] initialValue;

    public EdgeSpec(String id, String sourceNode, String sourcePort, String targetNode, String targetPort,
            double[] initialValue) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Edge id must not be blank");
        this.id = id;
        this.sourceNode = sourceNode;
        this.sourcePort = sourcePort;
        this.targetNode = targetNode;
        this.targetPort = targetPort;
        this.initialValue = initialValue == null ? null : initialValue.clone();
    }

    public EdgeSpec(String id, String sourceNode, String sourcePort, String targetNode, String targetPort) {
        this(id, sourceNode, sourcePort, targetNode, targetPort, null);
    }

    public String id() {
        return id;
    }

    public String sourceNode() {
        return sourceNode;
    }

    public String sourcePort() {
        return sourcePort;
    }

    public String targetNode() {
        return targetNode;
    }

    public String targetPort() {
        return targetPort;
    }

    /** Returns a copy of the configured initial value, or null. */
    public double[] initialValue() {
        return initialValue == null ? null : initialValue.clone();
    }

    public boolean hasInitialValue() {
        return initialValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EdgeSpec other))
            return false;
        return id.equals(other.id) && Objects.equals(sourceNode, other.sourceNode)
                && Objects.equals(sourcePort, other.sourcePort) && Objects.equals(targetNode, other.targetNode)
                && Objects.equals(targetPort, other.targetPort) && Arrays.equals(initialValue, other.initialValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceNode, sourcePort, targetNode, targetPort) * 31 + Arrays.hashCode(initialValue);
    }

    @Override
    public String toString() {
        return id + "(" + sourceNode + "." + sourcePort + " -> " + targetNode + "." + targetPort + ")";
    }
}
