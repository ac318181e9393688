package com.plant.flowsheet.engine;

import com.plant.flowsheet.api.ExecutorState;

import java.util.List;

/**
 * How one loop stage ended within a step.
 *
 * @param outcome    CONVERGED or ITERATION_CAP_REACHED.
 * @param iterations Sweeps performed.
 * @param residual   Residual of the last sweep.
 */
public record LoopOutcome(int stageIndex, List<String> nodeIds, ExecutorState outcome, int iterations,
        double residual) {

    public LoopOutcome {
        nodeIds = List.copyOf(nodeIds);
    }

    public boolean converged() {
        return outcome == ExecutorState.CONVERGED;
    }
}
