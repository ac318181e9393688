package com.plant.flowsheet.api;

import java.util.Map;

/**
 * One unit operation in the flowsheet.
 *
 * This is the only contract the engine relies on. Every kind of process
 * component (mixers, splitters, reactors, settlers, controllers) implements
 * it, and the engine never looks behind it.
 *
 * Contract:
 *
 * 1. Inputs: a map from input port name to the stream vector currently held
 * by the edge feeding that port. Ports without a feeding edge, or whose edge
 * has not produced a value yet, are absent from the map. The arrays belong to
 * the engine and must not be modified.
 *
 * 2. Outputs: a map from output port name to the produced stream vector. The
 * engine copies each vector onto every edge leaving that port, so the
 * component may reuse its buffers between calls. Ports missing from the map
 * leave their edges unchanged.
 *
 * 3. Determinism: given identical inputs and identical internal state, step
 * must return identical outputs. Internal state (integrators, controller
 * memory) is allowed, but a component must never read or write another
 * component's state; all coupling goes through edge values.
 *
 * 4. Repeated calls: inside a loop stage a component is stepped once per
 * iteration with the same dt. Stateful components that advance time on each
 * call should compute from the state they held when the step began and
 * move to the new state in {@link #commitStep()}. Components whose state can
 * change inside a step should implement {@link Snapshotable} so the engine can
 * roll back a failed step.
 */
@FunctionalInterface
public interface Component {

    /**
     * Computes output streams from input streams.
     *
     * @param inputs Current input values keyed by input port name.
     * @param dt     Size of the simulation step.
     * @return Output values keyed by output port name; never null.
     * @throws ComputationException if the inputs are outside the component's
     *                              valid domain.
     */
    Map<String, double[]> step(Map<String, double[]> inputs, double dt);

    /**
     * Called once on every component after a step succeeded. The last
     * {@link #step} call of the step saw the converged inputs.
     */
    default void commitStep() {
    }
}
