package com.plant.flowsheet.analysis;

import com.plant.flowsheet.graph.FlowsheetGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Chooses tear edges for a cyclic strongly connected component.
 *
 * A minimum feedback arc set is NP-hard, so this is a heuristic. Only two
 * properties are guaranteed: the result is deterministic, and removing the
 * selected edges leaves the component acyclic.
 *
 * Strategy:
 * 1. Enumerate the elementary cycles of the component. Enumeration is edge
 * based, so parallel streams between the same two units count as separate
 * cycles.
 * 2. Greedy: tear the edge that lies on the most remaining cycles, ties going
 * to the lowest edge index. Re-count and repeat until no cycle is left.
 * 3. Redundancy pass: walk the torn edges from last selected to first and put
 * each one back if the component stays acyclic without tearing it.
 *
 * Cycle counts can explode on densely meshed components. Enumeration stops
 * after {@code cycleLimit} cycles or {@code workLimit} path extensions; the
 * selector then tears DFS back edges instead (nodes and edges visited in index
 * order) and runs the same redundancy pass.
 */
public final class TearSelector {
    private static final Logger log = LogManager.getLogger(TearSelector.class);

    public static final int DEFAULT_CYCLE_LIMIT = 10_000;
    public static final long DEFAULT_WORK_LIMIT = 2_000_000L;

    /** How a tear set was obtained. */
    public enum Strategy {
        GREEDY_CYCLE_COUNT,
        DFS_BACK_EDGES
    }

    private final int cycleLimit;
    private final long workLimit;

    public TearSelector() {
        this(DEFAULT_CYCLE_LIMIT, DEFAULT_WORK_LIMIT);
    }

    public TearSelector(int cycleLimit, long workLimit) {
        if (cycleLimit <= 0 || workLimit <= 0)
            throw new IllegalArgumentException("Enumeration limits must be positive");
        this.cycleLimit = cycleLimit;
        this.workLimit = workLimit;
    }

    /**
     * Selects tear edges for one component.
     *
     * @return An empty selection if the component is not cyclic.
     */
    public TearSelection select(FlowsheetGraph graph, StronglyConnectedComponent scc) {
        if (!scc.cyclic())
            return new TearSelection(scc.index(), List.of(), Strategy.GREEDY_CYCLE_COUNT);

        Subgraph sub = new Subgraph(graph, scc);
        boolean[] torn = new boolean[sub.edgeCount()];
        List<Integer> selected = new ArrayList<>();
        Strategy strategy = Strategy.GREEDY_CYCLE_COUNT;

        while (true) {
            long[] perEdge = new long[sub.edgeCount()];
            long cycles = sub.countCycles(torn, perEdge, cycleLimit, workLimit);
            if (cycles < 0) {
                log.debug("Component {} ({} nodes): cycle enumeration over limit, tearing DFS back edges",
                        scc.index(), scc.size());
                Arrays.fill(torn, false);
                selected = sub.backEdges(torn);
                strategy = Strategy.DFS_BACK_EDGES;
                break;
            }
            if (cycles == 0)
                break;

            int best = -1;
            for (int e = 0; e < perEdge.length; e++)
                if (!torn[e] && (best < 0 || perEdge[e] > perEdge[best]))
                    best = e;
            torn[best] = true;
            selected.add(best);
        }

        // Redundancy pass, latest choice first
        for (int i = selected.size() - 1; i >= 0; i--) {
            int e = selected.get(i);
            torn[e] = false;
            if (sub.hasCycle(torn))
                torn[e] = true;
        }
        if (sub.hasCycle(torn))
            throw new IllegalStateException("Tear selection left a cycle in component " + scc.index());

        List<Integer> tears = new ArrayList<>();
        for (int e = 0; e < torn.length; e++)
            if (torn[e])
                tears.add(sub.globalEdge(e));
        return new TearSelection(scc.index(), tears, strategy);
    }

    /**
     * The internal subgraph of one component, re-indexed locally. Local node
     * and edge indices follow the global index order.
     */
    private static final class Subgraph {
        private final int[] edgeGlobal;
        private final int[] edgeFrom;
        private final int[] edgeTo;
        private final int[][] out;
        private final int nodeCount;

        Subgraph(FlowsheetGraph graph, StronglyConnectedComponent scc) {
            int[] members = scc.nodes().stream().mapToInt(Integer::intValue).sorted().toArray();
            this.nodeCount = members.length;
            // Component-local index, sized by the component
            Map<Integer, Integer> local = new HashMap<>(members.length * 2);
            for (int i = 0; i < members.length; i++)
                local.put(members[i], i);

            List<Integer> internal = new ArrayList<>();
            for (int node : members)
                for (int k = 0; k < graph.outEdgeCount(node); k++) {
                    int ei = graph.outEdge(node, k);
                    if (local.containsKey(graph.edgeTarget(ei)))
                        internal.add(ei);
                }
            internal.sort(null);

            int m = internal.size();
            edgeGlobal = new int[m];
            edgeFrom = new int[m];
            edgeTo = new int[m];
            int[] outCount = new int[nodeCount];
            for (int e = 0; e < m; e++) {
                int ei = internal.get(e);
                edgeGlobal[e] = ei;
                edgeFrom[e] = local.get(graph.edgeSource(ei));
                edgeTo[e] = local.get(graph.edgeTarget(ei));
                outCount[edgeFrom[e]]++;
            }
            out = new int[nodeCount][];
            for (int v = 0; v < nodeCount; v++)
                out[v] = new int[outCount[v]];
            int[] fill = new int[nodeCount];
            for (int e = 0; e < m; e++)
                out[edgeFrom[e]][fill[edgeFrom[e]]++] = e;
        }

        int edgeCount() {
            return edgeGlobal.length;
        }

        int globalEdge(int e) {
            return edgeGlobal[e];
        }

        /**
         * Counts elementary cycles avoiding torn edges, adding each cycle to
         * perEdge for every edge on it. Each cycle is found once, from its
         * lowest local node.
         *
         * @return the number of cycles, or -1 if a limit was exceeded.
         */
        long countCycles(boolean[] torn, long[] perEdge, int cycleLimit, long workLimit) {
            int[] pathNodes = new int[nodeCount];
            int[] pathEdges = new int[nodeCount];
            int[] pos = new int[nodeCount];
            boolean[] onPath = new boolean[nodeCount];
            long cycles = 0, work = 0;

            for (int s = 0; s < nodeCount; s++) {
                int depth = 0;
                pathNodes[0] = s;
                pos[0] = 0;
                onPath[s] = true;
                while (depth >= 0) {
                    int v = pathNodes[depth];
                    if (pos[depth] < out[v].length) {
                        int e = out[v][pos[depth]++];
                        if (torn[e])
                            continue;
                        if (++work > workLimit)
                            return -1;
                        int w = edgeTo[e];
                        if (w == s) {
                            for (int i = 0; i < depth; i++)
                                perEdge[pathEdges[i]]++;
                            perEdge[e]++;
                            if (++cycles > cycleLimit)
                                return -1;
                        } else if (w > s && !onPath[w]) {
                            pathEdges[depth] = e;
                            depth++;
                            pathNodes[depth] = w;
                            pos[depth] = 0;
                            onPath[w] = true;
                        }
                    } else {
                        onPath[v] = false;
                        depth--;
                    }
                }
            }
            return cycles;
        }

        /** Kahn's algorithm on the non-torn edges. */
        boolean hasCycle(boolean[] torn) {
            int[] inDegree = new int[nodeCount];
            for (int e = 0; e < edgeCount(); e++)
                if (!torn[e])
                    inDegree[edgeTo[e]]++;
            int[] queue = new int[nodeCount];
            int head = 0, tail = 0;
            for (int v = 0; v < nodeCount; v++)
                if (inDegree[v] == 0)
                    queue[tail++] = v;
            while (head < tail) {
                int v = queue[head++];
                for (int e : out[v])
                    if (!torn[e] && --inDegree[edgeTo[e]] == 0)
                        queue[tail++] = edgeTo[e];
            }
            return tail != nodeCount;
        }

        /**
         * Marks every DFS back edge as torn and returns them in discovery
         * order. Iterative, white/grey/black colouring.
         */
        List<Integer> backEdges(boolean[] torn) {
            final int white = 0, grey = 1, black = 2;
            int[] color = new int[nodeCount];
            int[] stack = new int[nodeCount];
            int[] pos = new int[nodeCount];
            List<Integer> found = new ArrayList<>();

            for (int root = 0; root < nodeCount; root++) {
                if (color[root] != white)
                    continue;
                int sp = 0;
                stack[sp++] = root;
                color[root] = grey;
                while (sp > 0) {
                    int v = stack[sp - 1];
                    if (pos[v] < out[v].length) {
                        int e = out[v][pos[v]++];
                        int w = edgeTo[e];
                        if (color[w] == white) {
                            color[w] = grey;
                            stack[sp++] = w;
                        } else if (color[w] == grey) {
                            torn[e] = true;
                            found.add(e);
                        }
                    } else {
                        color[v] = black;
                        sp--;
                    }
                }
            }
            return found;
        }
    }
}
