package com.plant.flowsheet.component;

import com.plant.flowsheet.api.Component;
import com.plant.flowsheet.api.ComputationException;

import java.util.Map;

/**
 * Element-wise {@code y = gain * x + offset}.
 *
 * Gain and offset are vectors; a vector of length 1 applies to every
 * element. Useful as a linear stand-in for a unit in tests and for
 * calibrating recycle loops.
 */
public final class AffineComponent implements Component {
    private final String inputPort;
    private final String outputPort;
    private final double[] gain;
    private final double[] offset;

    public AffineComponent(String inputPort, String outputPort, double[] gain, double[] offset) {
        if (gain.length == 0 || offset.length == 0)
            throw new IllegalArgumentException("gain and offset must not be empty");
        this.inputPort = inputPort;
        this.outputPort = outputPort;
        this.gain = gain.clone();
        this.offset = offset.clone();
    }

    @Override
    public Map<String, double[]> step(Map<String, double[]> inputs, double dt) {
        double[] x = inputs.get(inputPort);
        if (x == null)
            return Map.of();
        check(gain, x.length, "gain");
        check(offset, x.length, "offset");

        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++)
            y[i] = at(gain, i) * x[i] + at(offset, i);
        return Map.of(outputPort, y);
    }

    private static double at(double[] v, int i) {
        return v.length == 1 ? v[0] : v[i];
    }

    private static void check(double[] v, int width, String name) {
        if (v.length != 1 && v.length != width)
            throw new ComputationException(name + " has " + v.length + " elements, input has " + width);
    }
}
