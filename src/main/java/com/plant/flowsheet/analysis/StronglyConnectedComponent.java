package com.plant.flowsheet.analysis;

import java.util.List;

/**
 * One strongly connected component of the flowsheet.
 *
 * @param index  Position of this component in dependency order.
 * @param nodes  Node indices, sorted by ascending node id.
 * @param cyclic true if the component has more than one node or a self-loop,
 *               i.e. it needs iterative solution.
 */
public record StronglyConnectedComponent(int index, List<Integer> nodes, boolean cyclic) {

    public StronglyConnectedComponent {
        nodes = List.copyOf(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(int node) {
        return nodes.contains(node);
    }
}
