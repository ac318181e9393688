package com.plant.flowsheet.component;

import com.plant.flowsheet.api.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mixes all present input streams into one, weighted by flow.
 *
 * Inputs are combined in declared port order. Ports without a value are
 * skipped; with no input at all the component produces nothing and the
 * outgoing edge keeps its previous value.
 */
public final class CombinerComponent implements Component {
    private final List<String> inputPorts;
    private final String outputPort;
    private final int flowIndex;

    public CombinerComponent(List<String> inputPorts, String outputPort, int flowIndex) {
        this.inputPorts = List.copyOf(inputPorts);
        this.outputPort = outputPort;
        this.flowIndex = flowIndex;
    }

    @Override
    public Map<String, double[]> step(Map<String, double[]> inputs, double dt) {
        List<double[]> present = new ArrayList<>(inputPorts.size());
        for (String port : inputPorts) {
            double[] v = inputs.get(port);
            if (v != null)
                present.add(v);
        }
        if (present.isEmpty())
            return Map.of();
        return Map.of(outputPort, Streams.mix(present, flowIndex));
    }
}
