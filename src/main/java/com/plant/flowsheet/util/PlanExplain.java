package com.plant.flowsheet.util;

import com.plant.flowsheet.graph.EdgeSpec;
import com.plant.flowsheet.graph.FlowsheetGraph;
import com.plant.flowsheet.plan.ExecutionPlan;
import com.plant.flowsheet.plan.LoopStage;
import com.plant.flowsheet.plan.Stage;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic views of an execution plan.
 *
 * <p>
 * Intended for logs, debugging sessions and documentation. Not for the hot
 * path: every call builds strings.
 */
public final class PlanExplain {
    private final ExecutionPlan plan;
    private final FlowsheetGraph graph;
    private final Map<String, String> labels;

    public PlanExplain(ExecutionPlan plan) {
        this(plan, Map.of());
    }

    /** @param labels Display labels keyed by node id. */
    public PlanExplain(ExecutionPlan plan, Map<String, String> labels) {
        this.plan = plan;
        this.graph = plan.graph();
        this.labels = labels;
    }

    /**
     * Stage-by-stage listing of the plan.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Plan (").append(graph.nodeCount()).append(" nodes, ").append(graph.edgeCount())
                .append(" edges, ").append(plan.stageCount()).append(" stages, ").append(plan.levels().size())
                .append(" levels):\n");
        for (Stage stage : plan.stages()) {
            sb.append("  [").append(stage.index()).append("] L").append(stage.level()).append(' ');
            if (stage instanceof LoopStage loop) {
                sb.append("LOOP ").append(String.join(" -> ", loop.nodeIds()));
                sb.append("\n        tears: ");
                List<Integer> tears = loop.tearEdges();
                for (int i = 0; i < tears.size(); i++) {
                    if (i > 0)
                        sb.append(", ");
                    sb.append(graph.edge(tears.get(i)));
                }
                sb.append("\n        tol=").append(loop.settings().tolerance()).append(" maxIter=")
                        .append(loop.settings().maxIterations()).append(" relax=")
                        .append(loop.settings().relaxation());
            } else {
                sb.append("LINEAR ").append(stage.nodeIds().get(0));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Mermaid flowchart of the flowsheet. Edges carry their port names; tear
     * edges are drawn dashed.
     */
    public String toMermaid() {
        Set<Integer> tears = new HashSet<>();
        for (LoopStage loop : plan.loopStages())
            tears.addAll(loop.tearEdges());

        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");
        for (String nodeId : plan.nodeOrder()) {
            String type = graph.node(graph.nodeIndex(nodeId)).type();
            sb.append("  ").append(sanitize(nodeId)).append("[\"").append(labels.getOrDefault(nodeId, nodeId))
                    .append("<br/><i>").append(type).append("</i>\"];\n");
        }
        for (int ei = 0; ei < graph.edgeCount(); ei++) {
            EdgeSpec e = graph.edge(ei);
            String label = e.sourcePort() + " / " + e.targetPort();
            sb.append("  ").append(sanitize(e.sourceNode()))
                    .append(tears.contains(ei) ? " -. \"" + label + "\" .-> " : " -- \"" + label + "\" --> ")
                    .append(sanitize(e.targetNode())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
