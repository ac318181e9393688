package com.plant.flowsheet.io;

import com.plant.flowsheet.api.Component;
import com.plant.flowsheet.engine.FlowsheetExecutor;
import com.plant.flowsheet.graph.FlowsheetGraph;
import com.plant.flowsheet.plan.ExecutionPlan;

import java.util.List;
import java.util.Map;

/**
 * The result of compilation: a validated graph, its plan and one component
 * per node.
 *
 * @param components Components keyed by node id, in node order.
 * @param labels     Display labels keyed by node id, for nodes that have one.
 * @param observed   Edge ids to record during a simulation.
 */
public record CompiledFlowsheet(String name, FlowsheetGraph graph, ExecutionPlan plan,
        Map<String, Component> components, Map<String, String> labels, List<String> observed) {

    /**
     * Creates an executor over the compiled plan and components. Components
     * keep state, so compile again rather than running two executors.
     */
    public FlowsheetExecutor newExecutor() {
        return new FlowsheetExecutor(plan, components);
    }
}
