package com.plant.flowsheet.plan;

import com.plant.flowsheet.graph.FlowsheetGraph;
import com.plant.flowsheet.graph.NodeSpec;
import com.plant.flowsheet.graph.RandomFlowsheets;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class StagePlannerTest {

    private final StagePlanner planner = new StagePlanner();

    private static NodeSpec unit(String id) {
        return NodeSpec.of(id, List.of("in", "in2"), List.of("out", "out2"));
    }

    @Test
    public void testEmptyGraphHasNoStages() {
        ExecutionPlan plan = planner.plan(FlowsheetGraph.builder().build());
        assertEquals(0, plan.stageCount());
        assertTrue(plan.levels().isEmpty());
        assertTrue(plan.nodeOrder().isEmpty());
    }

    @Test
    public void testTwoNodeRecycleIsOneLoopStage() {
        // A <-> B
        FlowsheetGraph g = FlowsheetGraph.builder()
                .addNode(unit("A")).addNode(unit("B"))
                .addEdge("ab", "A", "out", "B", "in")
                .addEdge("ba", "B", "out", "A", "in")
                .build();
        ExecutionPlan plan = planner.plan(g);

        assertEquals(1, plan.stageCount());
        assertTrue(plan.stage(0).isLoop());
        LoopStage loop = plan.loopStages().get(0);
        assertEquals(Set.of("A", "B"), new HashSet<>(loop.nodeIds()));
        assertEquals(1, loop.tearEdges().size());
        assertEquals(List.of("ab"), loop.tearEdgeIds());
        // With A->B torn, B runs first
        assertEquals(List.of("B", "A"), loop.nodeIds());
        assertEquals(SolverSettings.defaults(), loop.settings());
    }

    @Test
    public void testIndependentChainsAreAllLinear() {
        // A1 -> A2, B1 -> B2, C1 -> C2
        FlowsheetGraph.Builder b = FlowsheetGraph.builder();
        for (String c : List.of("A", "B", "C")) {
            b.addNode(unit(c + "1")).addNode(unit(c + "2"));
            b.addEdge(c + "e", c + "1", "out", c + "2", "in");
        }
        ExecutionPlan plan = planner.plan(b.build());

        assertEquals(6, plan.stageCount());
        assertTrue(plan.loopStages().isEmpty());
        assertEquals(6, plan.linearStages().size());
        assertEquals(List.of("A1", "A2", "B1", "B2", "C1", "C2"), plan.nodeOrder());
        assertTrue(plan.tearEdgeIds().isEmpty());

        // Heads on level 0, tails on level 1
        assertEquals(2, plan.levels().size());
        assertEquals(3, plan.levels().get(0).size());
        assertEquals(3, plan.levels().get(1).size());
    }

    @Test
    public void testAcyclicOrderIsTopological() {
        for (long seed = 1; seed <= 20; seed++) {
            FlowsheetGraph g = acyclic(seed, 40, 80);
            ExecutionPlan plan = planner.plan(g);
            assertEquals(g.nodeCount(), plan.stageCount());

            int[] position = new int[g.nodeCount()];
            for (Stage s : plan.stages())
                position[s.nodes().get(0)] = s.index();
            for (int ei = 0; ei < g.edgeCount(); ei++)
                assertTrue("seed " + seed, position[g.edgeSource(ei)] < position[g.edgeTarget(ei)]);
        }
    }

    @Test
    public void testLoopOrderRespectsNonTearEdges() {
        for (long seed = 1; seed <= 30; seed++) {
            FlowsheetGraph g = RandomFlowsheets.random(seed, 15, 30);
            ExecutionPlan plan = planner.plan(g);
            for (LoopStage loop : plan.loopStages()) {
                List<Integer> order = loop.nodes();
                for (int ei = 0; ei < g.edgeCount(); ei++) {
                    int s = order.indexOf(g.edgeSource(ei));
                    int t = order.indexOf(g.edgeTarget(ei));
                    if (s >= 0 && t >= 0 && !loop.tearEdges().contains(ei))
                        assertTrue("seed " + seed, s < t);
                }
            }
        }
    }

    @Test
    public void testLevelsShareNoEdges() {
        for (long seed = 1; seed <= 20; seed++) {
            FlowsheetGraph g = RandomFlowsheets.random(seed, 30, 40);
            ExecutionPlan plan = planner.plan(g);
            int[] stageOf = new int[g.nodeCount()];
            for (Stage s : plan.stages())
                for (int ni : s.nodes())
                    stageOf[ni] = s.index();

            for (int ei = 0; ei < g.edgeCount(); ei++) {
                Stage from = plan.stage(stageOf[g.edgeSource(ei)]);
                Stage to = plan.stage(stageOf[g.edgeTarget(ei)]);
                if (from != to)
                    assertTrue("seed " + seed, from.level() < to.level());
            }
            int total = plan.levels().stream().mapToInt(List::size).sum();
            assertEquals(plan.stageCount(), total);
        }
    }

    @Test
    public void testPlanningIsIdempotent() {
        FlowsheetGraph g = RandomFlowsheets.random(3, 25, 50);
        ExecutionPlan first = planner.plan(g);
        ExecutionPlan second = new StagePlanner().plan(g);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void testSelfLoopIsLoopStage() {
        FlowsheetGraph g = FlowsheetGraph.builder()
                .addNode(unit("A"))
                .addEdge("loop", "A", "out", "A", "in")
                .build();
        ExecutionPlan plan = planner.plan(g);
        assertEquals(1, plan.loopStages().size());
        assertEquals(List.of("loop"), plan.tearEdgeIds());
    }

    @Test
    public void testWithSettingsReplacesLoopSettings() {
        FlowsheetGraph g = RandomFlowsheets.chain(3, true);
        ExecutionPlan plan = planner.plan(g);
        SolverSettings tight = SolverSettings.defaults().withTolerance(1e-10).withMaxIterations(500);

        ExecutionPlan updated = plan.withSettings(tight);
        assertEquals(tight, updated.settings());
        assertEquals(tight, updated.loopStages().get(0).settings());
        assertEquals(SolverSettings.defaults(), plan.settings());
        assertNotEquals(plan, updated);
        assertEquals(plan.nodeOrder(), updated.nodeOrder());
    }

    /** Random DAG: edges only run from lower to higher index. */
    private static FlowsheetGraph acyclic(long seed, int nodes, int edges) {
        java.util.Random rnd = new java.util.Random(seed);
        int[] used = new int[nodes];
        int[][] wiring = new int[edges][];
        for (int e = 0; e < edges; e++) {
            int s = rnd.nextInt(nodes - 1);
            int t = s + 1 + rnd.nextInt(nodes - s - 1);
            wiring[e] = new int[] { s, t, used[t]++ };
        }
        FlowsheetGraph.Builder b = FlowsheetGraph.builder();
        for (int i = nodes - 1; i >= 0; i--) {
            List<String> inputs = new java.util.ArrayList<>();
            for (int p = 0; p < used[i]; p++)
                inputs.add("in" + p);
            b.addNode(NodeSpec.of(RandomFlowsheets.id(i), inputs, List.of("out")));
        }
        for (int e = 0; e < edges; e++)
            b.addEdge("e" + e, RandomFlowsheets.id(wiring[e][0]), "out", RandomFlowsheets.id(wiring[e][1]),
                    "in" + wiring[e][2]);
        return b.build();
    }
}
