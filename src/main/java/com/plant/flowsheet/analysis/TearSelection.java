package com.plant.flowsheet.analysis;

import java.util.List;

/**
 * Tear edges chosen for one component.
 *
 * @param componentIndex Index of the component in dependency order.
 * @param tearEdges      Global edge indices, ascending.
 * @param strategy       How the edges were found.
 */
public record TearSelection(int componentIndex, List<Integer> tearEdges, TearSelector.Strategy strategy) {

    public TearSelection {
        tearEdges = List.copyOf(tearEdges);
    }

    public boolean isTear(int edge) {
        return tearEdges.contains(edge);
    }
}
