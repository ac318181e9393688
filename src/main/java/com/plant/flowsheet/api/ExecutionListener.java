package com.plant.flowsheet.api;

/**
 * Observability hook for the executor.
 *
 * Implementations can be registered with the executor to receive callbacks
 * while a simulation step runs. Typical uses:
 *
 * - Profiling: time spent per node and per step.
 * - Convergence monitoring: iterations and residuals per loop stage.
 * - Error reporting: which node failed and why.
 *
 * Callbacks run on the executor thread (or on pool threads when stages run
 * in parallel), inside the step. Keep them cheap, and thread-safe if the
 * executor is given an executor service.
 */
public interface ExecutionListener {

    /**
     * Called before the first stage of a step.
     *
     * @param step Index of the step about to run (0-based).
     * @param time Simulation time at the start of the step.
     */
    default void onStepStart(long step, double time) {
    }

    /**
     * Called after a node's step returned and its outputs were written.
     *
     * @param stageIndex    Index of the stage in the plan.
     * @param nodeId        The node that was evaluated.
     * @param durationNanos Wall time spent inside the component.
     */
    default void onNodeEvaluated(long step, int stageIndex, String nodeId, long durationNanos) {
    }

    /**
     * Called after every sweep of a loop stage.
     *
     * @param iteration 1-based iteration number.
     * @param residual  Maximum tear-edge change observed in this sweep.
     */
    default void onLoopIteration(long step, int stageIndex, int iteration, double residual) {
    }

    /**
     * Called when a stage finishes, successfully or not.
     *
     * @param outcome    CONVERGED, ITERATION_CAP_REACHED or FAILED. Linear
     *                   stages report CONVERGED.
     * @param iterations Number of sweeps (1 for linear stages).
     * @param residual   Final residual (0 for linear stages).
     */
    default void onStageEnd(long step, int stageIndex, ExecutorState outcome, int iterations, double residual) {
    }

    /**
     * Called when a node fails during a step.
     */
    default void onNodeError(long step, int stageIndex, String nodeId, Throwable error) {
    }

    /**
     * Called when the step is over.
     *
     * @param success false if the step was rolled back.
     */
    default void onStepEnd(long step, boolean success) {
    }
}
