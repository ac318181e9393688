package com.plant.flowsheet.component;

import com.plant.flowsheet.api.Component;
import com.plant.flowsheet.api.ComputationException;
import com.plant.flowsheet.api.Snapshotable;

import java.util.Map;

/**
 * Ideally mixed tank with first-order dynamics, {@code dx/dt = (u - x) / tau},
 * integrated with explicit Euler.
 *
 * Every call within a step integrates from the state the step began with, so
 * repeated sweeps of a recycle loop do not advance time. The new state is
 * adopted in {@link #commitStep()}. Stable for {@code dt <= tau}.
 */
public final class FirstOrderTankComponent implements Component, Snapshotable {
    private final String inputPort;
    private final String outputPort;
    private final double tau;

    private double[] state;
    private double[] pending;

    /**
     * @param initialState Starting content, or null to start from the first
     *                     inlet value.
     */
    public FirstOrderTankComponent(String inputPort, String outputPort, double tau, double[] initialState) {
        if (!(tau > 0))
            throw new IllegalArgumentException("tau must be positive: " + tau);
        this.inputPort = inputPort;
        this.outputPort = outputPort;
        this.tau = tau;
        this.state = initialState == null ? null : initialState.clone();
    }

    @Override
    public Map<String, double[]> step(Map<String, double[]> inputs, double dt) {
        double[] u = inputs.get(inputPort);
        if (u == null) {
            pending = state;
            return state == null ? Map.of() : Map.of(outputPort, state.clone());
        }
        double[] x = state == null ? u : state;
        if (x.length != u.length)
            throw new ComputationException("Inlet width " + u.length + " does not match tank state width " + x.length);

        double k = dt / tau;
        double[] next = new double[u.length];
        for (int i = 0; i < next.length; i++)
            next[i] = x[i] + k * (u[i] - x[i]);
        pending = next;
        return Map.of(outputPort, next.clone());
    }

    @Override
    public void commitStep() {
        if (pending != null)
            state = pending;
        pending = null;
    }

    @Override
    public double[] captureState() {
        return state == null ? new double[0] : state.clone();
    }

    @Override
    public void restoreState(double[] snapshot) {
        state = snapshot.length == 0 ? null : snapshot.clone();
        pending = null;
    }

    /** Current content of the tank, or null before the first step. */
    public double[] state() {
        return state == null ? null : state.clone();
    }
}
