package com.plant.flowsheet.component;

import com.plant.flowsheet.api.Component;

import java.util.Map;

/** Constant source stream. */
public final class InfluentComponent implements Component {
    private final String outputPort;
    private final double[] composition;

    public InfluentComponent(String outputPort, double[] composition) {
        this.outputPort = outputPort;
        this.composition = composition.clone();
    }

    @Override
    public Map<String, double[]> step(Map<String, double[]> inputs, double dt) {
        return Map.of(outputPort, composition.clone());
    }
}
