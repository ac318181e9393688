package com.plant.flowsheet.plan;

import java.util.List;

/** A node outside every cycle: evaluated exactly once per step. */
public record LinearStage(int index, int componentIndex, int level, int node, String nodeId) implements Stage {

    @Override
    public List<Integer> nodes() {
        return List.of(node);
    }

    @Override
    public List<String> nodeIds() {
        return List.of(nodeId);
    }

    @Override
    public String toString() {
        return "Linear[" + index + "]{" + nodeId + "}";
    }
}
