package com.plant.flowsheet.analysis;

import com.plant.flowsheet.graph.FlowsheetGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;

/**
 * Partitions a flowsheet into strongly connected components.
 *
 * Algorithm:
 * 1. Tarjan's algorithm, written iteratively with explicit stacks so long
 * process chains cannot overflow the JVM call stack. Linear in nodes + edges.
 * 2. The condensation graph (one vertex per SCC) is built from the edges whose
 * ends fall in different components.
 * 3. Kahn's algorithm orders the condensation. The ready queue is keyed by
 * the smallest node id in each component, so ties between independent
 * components resolve the same way on every run.
 *
 * The condensation of a directed graph is always acyclic; if Kahn's sort does
 * not consume every component the analyzer itself is broken, which is
 * reported as an {@link IllegalStateException}.
 */
@Log4j2
public final class CycleAnalyzer {

    public CycleAnalysis analyze(FlowsheetGraph graph) {
        final int n = graph.nodeCount();

        // 1. Tarjan
        int[] rawComponentOf = new int[n];
        List<int[]> rawComponents = tarjan(graph, rawComponentOf);
        final int c = rawComponents.size();

        // 2. Condensation over raw component ids
        List<Set<Integer>> rawSucc = new ArrayList<>(c);
        for (int i = 0; i < c; i++)
            rawSucc.add(new TreeSet<>());
        int[] inDegree = new int[c];
        for (int ei = 0; ei < graph.edgeCount(); ei++) {
            int from = rawComponentOf[graph.edgeSource(ei)];
            int to = rawComponentOf[graph.edgeTarget(ei)];
            if (from != to && rawSucc.get(from).add(to))
                inDegree[to]++;
        }

        // 3. Kahn, ties by smallest node id
        String[] minId = new String[c];
        for (int i = 0; i < c; i++) {
            for (int ni : rawComponents.get(i)) {
                String id = graph.nodeId(ni);
                if (minId[i] == null || id.compareTo(minId[i]) < 0)
                    minId[i] = id;
            }
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>(Comparator.comparing((Integer i) -> minId[i]));
        for (int i = 0; i < c; i++)
            if (inDegree[i] == 0)
                ready.add(i);

        int[] order = new int[c];
        int[] rank = new int[c];
        int emitted = 0;
        while (!ready.isEmpty()) {
            int curr = ready.poll();
            rank[curr] = emitted;
            order[emitted++] = curr;
            for (int next : rawSucc.get(curr))
                if (--inDegree[next] == 0)
                    ready.add(next);
        }
        if (emitted != c)
            throw new IllegalStateException(
                    "Condensation graph is cyclic: ordered " + emitted + " of " + c + " components");

        // 4. Re-index everything in dependency order
        List<StronglyConnectedComponent> components = new ArrayList<>(c);
        List<Set<Integer>> condensation = new ArrayList<>(c);
        for (int ci = 0; ci < c; ci++) {
            int raw = order[ci];
            Integer[] members = Arrays.stream(rawComponents.get(raw)).boxed().toArray(Integer[]::new);
            Arrays.sort(members, Comparator.comparing(graph::nodeId));
            boolean cyclic = members.length > 1 || graph.hasSelfLoop(members[0]);
            components.add(new StronglyConnectedComponent(ci, Arrays.asList(members), cyclic));

            Set<Integer> succ = new TreeSet<>();
            for (int s : rawSucc.get(raw))
                succ.add(rank[s]);
            condensation.add(Collections.unmodifiableSet(succ));
        }
        int[] componentOf = new int[n];
        for (int ni = 0; ni < n; ni++)
            componentOf[ni] = rank[rawComponentOf[ni]];

        if (log.isDebugEnabled()) {
            long cyclic = components.stream().filter(StronglyConnectedComponent::cyclic).count();
            log.debug("Cycle analysis: {} nodes, {} components, {} cyclic", n, c, cyclic);
        }
        return new CycleAnalysis(graph, components, componentOf, condensation);
    }

    /**
     * Iterative Tarjan. Fills componentOf with raw component ids and returns
     * the member lists, in the order Tarjan emits them (reverse topological).
     */
    private static List<int[]> tarjan(FlowsheetGraph graph, int[] componentOf) {
        final int n = graph.nodeCount();
        int[] index = new int[n];
        int[] low = new int[n];
        int[] nextEdge = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);

        int[] stack = new int[n];
        int sp = 0;
        int[] callStack = new int[n];
        int cp;
        int counter = 0;
        List<int[]> components = new ArrayList<>();

        for (int root = 0; root < n; root++) {
            if (index[root] != -1)
                continue;

            index[root] = low[root] = counter++;
            stack[sp++] = root;
            onStack[root] = true;
            cp = 0;
            callStack[cp++] = root;

            while (cp > 0) {
                int v = callStack[cp - 1];
                if (nextEdge[v] < graph.outEdgeCount(v)) {
                    int w = graph.edgeTarget(graph.outEdge(v, nextEdge[v]++));
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        stack[sp++] = w;
                        onStack[w] = true;
                        callStack[cp++] = w;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                // All successors of v explored
                cp--;
                if (low[v] == index[v]) {
                    int id = components.size();
                    int start = sp;
                    do {
                        start--;
                    } while (stack[start] != v);
                    int[] members = Arrays.copyOfRange(stack, start, sp);
                    for (int w : members) {
                        onStack[w] = false;
                        componentOf[w] = id;
                    }
                    sp = start;
                    components.add(members);
                }
                if (cp > 0) {
                    int parent = callStack[cp - 1];
                    low[parent] = Math.min(low[parent], low[v]);
                }
            }
        }
        return components;
    }
}
