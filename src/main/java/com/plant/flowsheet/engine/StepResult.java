package com.plant.flowsheet.engine;

import java.util.List;

/**
 * Summary of a completed step.
 *
 * @param step  0-based index of the step.
 * @param time  Simulation time at the end of the step.
 * @param loops One outcome per loop stage, in plan order.
 */
public record StepResult(long step, double time, List<LoopOutcome> loops) {

    public StepResult {
        loops = List.copyOf(loops);
    }

    /** Loops that hit their iteration cap and were accepted anyway. */
    public List<LoopOutcome> unconvergedLoops() {
        return loops.stream().filter(l -> !l.converged()).toList();
    }

    public boolean converged() {
        return loops.stream().allMatch(LoopOutcome::converged);
    }

    public int totalIterations() {
        return loops.stream().mapToInt(LoopOutcome::iterations).sum();
    }
}
