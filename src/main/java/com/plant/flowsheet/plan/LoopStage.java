package com.plant.flowsheet.plan;

import java.util.List;

/**
 * A cyclic component solved by fixed-point iteration.
 *
 * @param nodes       Internal evaluation order: a topological order of the
 *                    component once the tear edges are removed.
 * @param tearEdges   Edge indices read from the previous iteration.
 * @param settings    Tolerance, iteration cap and related settings.
 */
public record LoopStage(int index, int componentIndex, int level, List<Integer> nodes, List<String> nodeIds,
        List<Integer> tearEdges, List<String> tearEdgeIds, SolverSettings settings) implements Stage {

    public LoopStage {
        nodes = List.copyOf(nodes);
        nodeIds = List.copyOf(nodeIds);
        tearEdges = List.copyOf(tearEdges);
        tearEdgeIds = List.copyOf(tearEdgeIds);
    }

    @Override
    public boolean isLoop() {
        return true;
    }

    public LoopStage withSettings(SolverSettings newSettings) {
        return new LoopStage(index, componentIndex, level, nodes, nodeIds, tearEdges, tearEdgeIds, newSettings);
    }

    @Override
    public String toString() {
        return "Loop[" + index + "]{" + String.join(", ", nodeIds) + " | tears " + tearEdgeIds + "}";
    }
}
