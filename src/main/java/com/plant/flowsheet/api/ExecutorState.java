package com.plant.flowsheet.api;

/**
 * States of the executor while running one simulation step.
 *
 * IDLE -> RUNNING_STAGE -> (CONVERGED | ITERATION_CAP_REACHED | FAILED) -> IDLE
 */
public enum ExecutorState {
    IDLE,
    RUNNING_STAGE,
    CONVERGED,
    ITERATION_CAP_REACHED,
    FAILED
}
