package com.plant.flowsheet.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded random graphs for property-style tests. Every node gets enough
 * input ports that no edge violates fan-in.
 */
public final class RandomFlowsheets {

    private RandomFlowsheets() {
    }

    public static FlowsheetGraph random(long seed, int nodes, int edges) {
        Random rnd = new Random(seed);
        int[] used = new int[nodes];
        List<String[]> wiring = new ArrayList<>();
        for (int e = 0; e < edges; e++) {
            int s = rnd.nextInt(nodes);
            int t = rnd.nextInt(nodes);
            wiring.add(new String[] { "e" + e, id(s), "out", id(t), "in" + used[t]++ });
        }
        FlowsheetGraph.Builder b = FlowsheetGraph.builder();
        for (int i = 0; i < nodes; i++) {
            List<String> inputs = new ArrayList<>();
            for (int p = 0; p < used[i]; p++)
                inputs.add("in" + p);
            b.addNode(NodeSpec.of(id(i), inputs, List.of("out")));
        }
        for (String[] w : wiring)
            b.addEdge(w[0], w[1], w[2], w[3], w[4]);
        return b.build();
    }

    /** A -> B -> ... chain of the given length, optionally closed into a ring. */
    public static FlowsheetGraph chain(int length, boolean closed) {
        FlowsheetGraph.Builder b = FlowsheetGraph.builder();
        for (int i = 0; i < length; i++)
            b.addNode(NodeSpec.of(id(i), List.of("in"), List.of("out")));
        for (int i = 0; i + 1 < length; i++)
            b.addEdge("e" + i, id(i), "out", id(i + 1), "in");
        if (closed)
            b.addEdge("back", id(length - 1), "out", id(0), "in");
        return b.build();
    }

    /** Zero-padded so that string order equals numeric order. */
    public static String id(int i) {
        return String.format("n%06d", i);
    }
}
