package com.plant.flowsheet.plan;

import java.util.List;

/**
 * One step of an {@link ExecutionPlan}: either a single node evaluated once
 * ({@link LinearStage}) or a cyclic component iterated to convergence
 * ({@link LoopStage}).
 */
public interface Stage {

    /** Position in the plan. */
    int index();

    /** Index of the strongly connected component this stage covers. */
    int componentIndex();

    /**
     * Dependency level: longest chain of upstream stages. Stages on the same
     * level share no edges and may run concurrently.
     */
    int level();

    /** Node indices in evaluation order. */
    List<Integer> nodes();

    /** Node ids in evaluation order. */
    List<String> nodeIds();

    default boolean isLoop() {
        return false;
    }
}
