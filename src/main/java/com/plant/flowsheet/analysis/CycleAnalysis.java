package com.plant.flowsheet.analysis;

import com.plant.flowsheet.graph.FlowsheetGraph;

import java.util.List;
import java.util.Set;

/**
 * Result of {@link CycleAnalyzer#analyze(FlowsheetGraph)}: the SCC partition
 * of a graph together with its condensation.
 *
 * Components are listed in dependency order: every component appears before
 * any component that consumes one of its outputs.
 */
public final class CycleAnalysis {
    private final FlowsheetGraph graph;
    private final List<StronglyConnectedComponent> components;
    private final int[] componentOf;
    private final List<Set<Integer>> condensation;

    CycleAnalysis(FlowsheetGraph graph, List<StronglyConnectedComponent> components, int[] componentOf,
            List<Set<Integer>> condensation) {
        this.graph = graph;
        this.components = List.copyOf(components);
        this.componentOf = componentOf;
        this.condensation = List.copyOf(condensation);
    }

    public FlowsheetGraph graph() {
        return graph;
    }

    public List<StronglyConnectedComponent> components() {
        return components;
    }

    public StronglyConnectedComponent component(int ci) {
        return components.get(ci);
    }

    public int componentCount() {
        return components.size();
    }

    /** Index (in dependency order) of the component containing node ni. */
    public int componentOf(int ni) {
        return componentOf[ni];
    }

    /** Components directly fed by component ci, excluding ci itself. */
    public Set<Integer> condensationSuccessors(int ci) {
        return condensation.get(ci);
    }

    /** Components that need iterative solution. */
    public List<StronglyConnectedComponent> cyclicComponents() {
        return components.stream().filter(StronglyConnectedComponent::cyclic).toList();
    }

    public boolean isAcyclic() {
        return components.stream().noneMatch(StronglyConnectedComponent::cyclic);
    }
}
