package com.plant.flowsheet.api;

/**
 * Capability for components that hold internal state across steps.
 *
 * <p>
 * The executor captures the state of every snapshotable component before a
 * simulation step and restores it if the step fails, so a failed step leaves
 * neither edge values nor component state behind. Stateless components do
 * not need to implement this.
 */
public interface Snapshotable {

    /**
     * Returns a copy of the component's internal state.
     */
    double[] captureState();

    /**
     * Restores state previously returned by {@link #captureState()}.
     */
    void restoreState(double[] state);
}
