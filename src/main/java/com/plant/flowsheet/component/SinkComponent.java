package com.plant.flowsheet.component;

import com.plant.flowsheet.api.Component;

import java.util.Map;

/**
 * End of the line, e.g. the plant effluent. Remembers the last value it
 * received and passes it through on its output port, if it has one.
 */
public final class SinkComponent implements Component {
    private final String inputPort;
    private final String outputPort;
    private double[] last;

    /** @param outputPort pass-through port, or null for none. */
    public SinkComponent(String inputPort, String outputPort) {
        this.inputPort = inputPort;
        this.outputPort = outputPort;
    }

    @Override
    public Map<String, double[]> step(Map<String, double[]> inputs, double dt) {
        double[] v = inputs.get(inputPort);
        if (v == null)
            return Map.of();
        last = v.clone();
        return outputPort == null ? Map.of() : Map.of(outputPort, v.clone());
    }

    /** Last value received, or null. */
    public double[] lastValue() {
        return last == null ? null : last.clone();
    }
}
