package com.plant.flowsheet.plan;

import com.plant.flowsheet.analysis.CycleAnalysis;
import com.plant.flowsheet.analysis.CycleAnalyzer;
import com.plant.flowsheet.analysis.StronglyConnectedComponent;
import com.plant.flowsheet.analysis.TearSelection;
import com.plant.flowsheet.analysis.TearSelector;
import com.plant.flowsheet.graph.FlowsheetGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a flowsheet graph into an {@link ExecutionPlan}.
 *
 * Pipeline: {@link CycleAnalyzer} partitions the graph into SCCs in
 * dependency order; each singleton SCC without a self-loop becomes a
 * {@link LinearStage}; each cyclic SCC gets tear edges from the
 * {@link TearSelector} and becomes a {@link LoopStage} whose internal order is
 * a topological sort of the SCC minus its tears (ties by ascending node id).
 *
 * Planning is deterministic: the same graph always yields an equal plan.
 */
public final class StagePlanner {
    private static final Logger log = LogManager.getLogger(StagePlanner.class);

    private final CycleAnalyzer analyzer;
    private final TearSelector tearSelector;

    public StagePlanner() {
        this(new CycleAnalyzer(), new TearSelector());
    }

    public StagePlanner(CycleAnalyzer analyzer, TearSelector tearSelector) {
        this.analyzer = analyzer;
        this.tearSelector = tearSelector;
    }

    public ExecutionPlan plan(FlowsheetGraph graph) {
        return plan(graph, SolverSettings.defaults());
    }

    /**
     * Builds the plan.
     *
     * @param graph    A validated flowsheet graph.
     * @param settings Solver settings attached to every loop stage.
     */
    public ExecutionPlan plan(FlowsheetGraph graph, SolverSettings settings) {
        CycleAnalysis analysis = analyzer.analyze(graph);
        int c = analysis.componentCount();

        // Dependency levels over the condensation, components are already in order
        int[] level = new int[c];
        for (int ci = 0; ci < c; ci++)
            for (int next : analysis.condensationSuccessors(ci))
                level[next] = Math.max(level[next], level[ci] + 1);

        List<Stage> stages = new ArrayList<>(c);
        for (StronglyConnectedComponent scc : analysis.components()) {
            int index = stages.size();
            if (!scc.cyclic()) {
                int node = scc.nodes().get(0);
                stages.add(new LinearStage(index, scc.index(), level[scc.index()], node, graph.nodeId(node)));
                continue;
            }

            TearSelection tears = tearSelector.select(graph, scc);
            List<Integer> order = internalOrder(graph, scc, tears);
            stages.add(new LoopStage(index, scc.index(), level[scc.index()], order,
                    order.stream().map(graph::nodeId).toList(),
                    tears.tearEdges(),
                    tears.tearEdges().stream().map(graph::edgeId).toList(),
                    settings));
            log.debug("Loop stage {}: nodes {} tears {} ({})", index,
                    order.stream().map(graph::nodeId).toList(),
                    tears.tearEdges().stream().map(graph::edgeId).toList(), tears.strategy());
        }

        ExecutionPlan plan = new ExecutionPlan(graph, stages, settings);
        log.info("Planned {} nodes into {} stages ({} loops, {} tear edges, {} levels)",
                graph.nodeCount(), plan.stageCount(), plan.loopStages().size(), plan.tearEdgeIds().size(),
                plan.levels().size());
        return plan;
    }

    /**
     * Kahn's algorithm over the component's internal edges minus tears. The
     * ready set is ordered by node id.
     */
    private static List<Integer> internalOrder(FlowsheetGraph graph, StronglyConnectedComponent scc,
            TearSelection tears) {
        Map<Integer, Integer> inDegree = new HashMap<>();
        for (int node : scc.nodes())
            inDegree.put(node, 0);
        for (int node : scc.nodes()) {
            for (int i = 0; i < graph.outEdgeCount(node); i++) {
                int ei = graph.outEdge(node, i);
                int target = graph.edgeTarget(ei);
                if (inDegree.containsKey(target) && !tears.isTear(ei))
                    inDegree.merge(target, 1, Integer::sum);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>(Comparator.comparing(graph::nodeId));
        inDegree.forEach((node, d) -> {
            if (d == 0)
                ready.add(node);
        });

        List<Integer> order = new ArrayList<>(scc.size());
        while (!ready.isEmpty()) {
            int node = ready.poll();
            order.add(node);
            for (int i = 0; i < graph.outEdgeCount(node); i++) {
                int ei = graph.outEdge(node, i);
                int target = graph.edgeTarget(ei);
                if (inDegree.containsKey(target) && !tears.isTear(ei) && inDegree.merge(target, -1, Integer::sum) == 0)
                    ready.add(target);
            }
        }
        if (order.size() != scc.size())
            throw new IllegalStateException("Component " + scc.index() + " still cyclic after tearing: ordered "
                    + order.size() + " of " + scc.size() + " nodes");
        return order;
    }
}
