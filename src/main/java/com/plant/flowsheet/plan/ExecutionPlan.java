package com.plant.flowsheet.plan;

import com.plant.flowsheet.graph.FlowsheetGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The static schedule of a flowsheet: stages in dependency order.
 *
 * A plan is built once per graph by {@link StagePlanner} and is read-only
 * afterwards. Graphs are immutable, so a changed configuration means a new
 * graph and a new plan.
 *
 * Two plans are equal if their stages and settings are equal; the graph
 * reference is not compared.
 */
public final class ExecutionPlan {
    private final FlowsheetGraph graph;
    private final List<Stage> stages;
    private final List<List<Integer>> levels;
    private final SolverSettings settings;

    ExecutionPlan(FlowsheetGraph graph, List<Stage> stages, SolverSettings settings) {
        this.graph = graph;
        this.stages = List.copyOf(stages);
        this.settings = settings;
        int depth = stages.stream().mapToInt(Stage::level).max().orElse(-1) + 1;
        List<List<Integer>> byLevel = new ArrayList<>(depth);
        for (int l = 0; l < depth; l++)
            byLevel.add(new ArrayList<>());
        for (Stage s : stages)
            byLevel.get(s.level()).add(s.index());
        this.levels = byLevel.stream().map(List::copyOf).toList();
    }

    public FlowsheetGraph graph() {
        return graph;
    }

    /** Settings the plan was built with; every loop stage carries the same. */
    public SolverSettings settings() {
        return settings;
    }

    public List<Stage> stages() {
        return stages;
    }

    public Stage stage(int index) {
        return stages.get(index);
    }

    public int stageCount() {
        return stages.size();
    }

    /** Stage indices grouped by dependency level, lowest level first. */
    public List<List<Integer>> levels() {
        return levels;
    }

    public List<LoopStage> loopStages() {
        return stages.stream().filter(Stage::isLoop).map(LoopStage.class::cast).toList();
    }

    public List<LinearStage> linearStages() {
        return stages.stream().filter(s -> !s.isLoop()).map(LinearStage.class::cast).toList();
    }

    /** All node ids in the order the executor first evaluates them. */
    public List<String> nodeOrder() {
        return stages.stream().flatMap(s -> s.nodeIds().stream()).toList();
    }

    /** Ids of all tear edges, in stage order. */
    public List<String> tearEdgeIds() {
        return loopStages().stream().flatMap(s -> s.tearEdgeIds().stream()).toList();
    }

    /** Returns a copy of this plan with new settings on every loop stage. */
    public ExecutionPlan withSettings(SolverSettings settings) {
        List<Stage> updated = stages.stream()
                .map(s -> s instanceof LoopStage loop ? loop.withSettings(settings) : s)
                .collect(Collectors.toList());
        return new ExecutionPlan(graph, updated, settings);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ExecutionPlan other && stages.equals(other.stages)
                && settings.equals(other.settings));
    }

    @Override
    public int hashCode() {
        return Objects.hash(stages, settings);
    }

    @Override
    public String toString() {
        return stages.stream().map(Stage::toString).collect(Collectors.joining(" -> ", "Plan[", "]"));
    }
}
